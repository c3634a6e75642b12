package com.metapharm.phi.infrastructure.audit;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied description of an audited event.
 *
 * <p>{@code userId}, {@code eventType}, {@code action}, {@code resourceType} and
 * {@code resourceId} are required. The timestamp is never supplied by callers.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AuditEventParams {

    private final String userId;

    /** Pharmacy / organisation; null for global events. */
    private final String tenantId;

    /** Dotted event name, e.g. {@code prescription.approved}. */
    private final String eventType;

    private final AuditAction action;
    private final String resourceType;
    private final String resourceId;

    /** Only kept for UPDATE actions. */
    private final Map<String, FieldChange> changes;

    private final String ipAddress;
    private final String userAgent;
    private final DeviceInfo deviceInfo;

    /**
     * @throws InvalidAuditParamsException listing every missing required field
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(userId)) {
            missing.add("userId");
        }
        if (isBlank(eventType)) {
            missing.add("eventType");
        }
        if (action == null) {
            missing.add("action");
        }
        if (isBlank(resourceType)) {
            missing.add("resourceType");
        }
        if (isBlank(resourceId)) {
            missing.add("resourceId");
        }
        if (!missing.isEmpty()) {
            throw new InvalidAuditParamsException(missing);
        }
    }

    /**
     * Copy of these params carrying the given request context.
     */
    public AuditEventParams withContext(RequestContext context) {
        return toBuilder()
            .ipAddress(context.getIpAddress())
            .userAgent(context.getUserAgent())
            .deviceInfo(context.getDeviceInfo())
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
