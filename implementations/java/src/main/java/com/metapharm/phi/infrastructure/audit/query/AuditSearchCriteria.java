package com.metapharm.phi.infrastructure.audit.query;

import com.metapharm.phi.infrastructure.audit.AuditAction;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;

/**
 * Filters and paging for an audit trail search. Every filter is optional;
 * {@code page} is 1-based.
 */
@Getter
@Builder
@ToString
public class AuditSearchCriteria {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private final String tenantId;
    private final String userId;
    private final String resourceType;
    private final String resourceId;
    private final String eventType;
    private final AuditAction action;
    private final Instant startDate;
    private final Instant endDate;

    private final Integer page;
    private final Integer limit;

    /** Newest first unless set. */
    private final Sort.Direction direction;

    public int effectivePage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int effectiveLimit() {
        if (limit == null || limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    Pageable toPageable() {
        Sort.Direction dir = direction == null ? Sort.Direction.DESC : direction;
        return PageRequest.of(effectivePage() - 1, effectiveLimit(), Sort.by(dir, "createdAt"));
    }
}
