package com.metapharm.phi.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Insert-only store for audit trail entries. Exposes no update or
 * delete operation.
 */
public interface AuditTrailRepository
        extends Repository<AuditTrailEntry, UUID>, JpaSpecificationExecutor<AuditTrailEntry> {

    AuditTrailEntry save(AuditTrailEntry entry);

    AuditTrailEntry saveAndFlush(AuditTrailEntry entry);

    Optional<AuditTrailEntry> findById(UUID id);

    List<AuditTrailEntry> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);

    long count();
}
