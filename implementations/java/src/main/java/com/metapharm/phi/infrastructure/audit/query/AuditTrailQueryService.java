package com.metapharm.phi.infrastructure.audit.query;

import com.metapharm.phi.infrastructure.audit.AuditTrailEntry;
import com.metapharm.phi.infrastructure.audit.AuditTrailRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the audit trail, used by compliance reporting.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuditTrailQueryService {

    private final AuditTrailRepository repository;

    public Page<AuditTrailEntry> search(AuditSearchCriteria criteria) {
        Page<AuditTrailEntry> page = repository.findAll(toSpecification(criteria), criteria.toPageable());
        if (log.isDebugEnabled()) {
            log.debug("Audit search {} returned {} of {} entries",
                criteria, page.getNumberOfElements(), page.getTotalElements());
        }
        return page;
    }

    /**
     * Every entry for one resource, oldest first.
     */
    public List<AuditTrailEntry> findResourceHistory(String resourceType, String resourceId) {
        return repository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(resourceType, resourceId);
    }

    static Specification<AuditTrailEntry> toSpecification(AuditSearchCriteria c) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (c.getTenantId() != null) {
                predicates.add(cb.equal(root.get("tenantId"), c.getTenantId()));
            }
            if (c.getUserId() != null) {
                predicates.add(cb.equal(root.get("userId"), c.getUserId()));
            }
            if (c.getResourceType() != null) {
                predicates.add(cb.equal(root.get("resourceType"), c.getResourceType()));
            }
            if (c.getResourceId() != null) {
                predicates.add(cb.equal(root.get("resourceId"), c.getResourceId()));
            }
            if (c.getEventType() != null) {
                predicates.add(cb.equal(root.get("eventType"), c.getEventType()));
            }
            if (c.getAction() != null) {
                predicates.add(cb.equal(root.get("action"), c.getAction()));
            }
            if (c.getStartDate() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), c.getStartDate()));
            }
            if (c.getEndDate() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), c.getEndDate()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
