package com.metapharm.phi.infrastructure.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of an access to, or mutation of, regulated data.
 *
 * <p><strong>Immutability:</strong> the entity has no setters, every column is
 * {@code updatable = false} and Hibernate treats it as {@link Immutable}.
 * Entries reference the acting user and tenant by id only, so they outlive
 * both.
 *
 * <p>The only way to build an entry is {@link #create(AuditEventParams, Instant)},
 * which rejects incomplete parameters.
 */
@Entity
@Immutable
@Table(name = "audit_trail_entries", indexes = {
    @Index(name = "idx_audit_trail_resource", columnList = "resource_type, resource_id"),
    @Index(name = "idx_audit_trail_tenant", columnList = "tenant_id"),
    @Index(name = "idx_audit_trail_user", columnList = "user_id"),
    @Index(name = "idx_audit_trail_event", columnList = "event_type"),
    @Index(name = "idx_audit_trail_created", columnList = "created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@ToString(exclude = "changes")
public class AuditTrailEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /** Null for global/system events. */
    @Column(name = "tenant_id", length = 36, updatable = false)
    private String tenantId;

    @Column(name = "user_id", length = 36, nullable = false, updatable = false)
    private String userId;

    @Column(name = "event_type", length = 100, nullable = false, updatable = false)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 50, nullable = false, updatable = false)
    private AuditAction action;

    @Column(name = "resource_type", length = 100, nullable = false, updatable = false)
    private String resourceType;

    @Column(name = "resource_id", length = 64, nullable = false, updatable = false)
    private String resourceId;

    /** {field: {old, new}}; only for UPDATE actions. */
    @Convert(converter = AuditJsonConverters.ChangesConverter.class)
    @Column(name = "changes", columnDefinition = "text", updatable = false)
    private Map<String, FieldChange> changes;

    /** IPv4 or IPv6 */
    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "text", updatable = false)
    private String userAgent;

    @Convert(converter = AuditJsonConverters.DeviceInfoConverter.class)
    @Column(name = "device_info", columnDefinition = "text", updatable = false)
    private DeviceInfo deviceInfo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Build a new, not yet persisted entry.
     *
     * @param params    event description; validated here
     * @param createdAt system-assigned creation time
     * @throws InvalidAuditParamsException if a required field is missing
     */
    public static AuditTrailEntry create(AuditEventParams params, Instant createdAt) {
        Objects.requireNonNull(params, "Audit params must not be null");
        params.validate();

        AuditTrailEntry entry = new AuditTrailEntry();
        entry.userId = params.getUserId();
        entry.tenantId = blankToNull(params.getTenantId());
        entry.eventType = params.getEventType();
        entry.action = params.getAction();
        entry.resourceType = params.getResourceType();
        entry.resourceId = params.getResourceId();
        entry.changes = params.getAction() == AuditAction.UPDATE && params.getChanges() != null
            && !params.getChanges().isEmpty()
            ? new LinkedHashMap<>(params.getChanges())
            : null;
        entry.ipAddress = blankToNull(params.getIpAddress());
        entry.userAgent = blankToNull(params.getUserAgent());
        entry.deviceInfo = params.getDeviceInfo();
        entry.createdAt = Objects.requireNonNull(createdAt, "Creation time must not be null");
        return entry;
    }

    public Map<String, FieldChange> getChanges() {
        return changes == null ? null : Collections.unmodifiableMap(changes);
    }

    /**
     * @return true for an UPDATE that recorded field changes
     */
    public boolean hasChanges() {
        return action == AuditAction.UPDATE && changes != null;
    }

    public List<String> getChangedFields() {
        return hasChanges() ? List.copyOf(changes.keySet()) : List.of();
    }

    public Object getOldValue(String field) {
        FieldChange change = hasChanges() ? changes.get(field) : null;
        return change == null ? null : change.getOldValue();
    }

    public Object getNewValue(String field) {
        FieldChange change = hasChanges() ? changes.get(field) : null;
        return change == null ? null : change.getNewValue();
    }

    public boolean isFromTenant(String tenantId) {
        return this.tenantId != null && this.tenantId.equals(tenantId);
    }

    public boolean isGlobalEvent() {
        return tenantId == null;
    }

    /**
     * Human readable summary, e.g. {@code prescription updated}.
     */
    public String getEventDescription() {
        return resourceType + " " + action.getPastTense();
    }

    public String getDevicePlatform() {
        return deviceInfo == null ? null : deviceInfo.getPlatform();
    }

    public String getBrowser() {
        return deviceInfo == null ? null : deviceInfo.getBrowser();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
