package com.metapharm.phi.infrastructure.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Audit writes against a real transaction manager, nested in a caller's transaction.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Audit trail transaction isolation")
class AuditTrailTransactionTest {

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private AuditTrailRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private static AuditEventParams params(String resourceId, String eventType) {
        return AuditEventParams.builder()
            .userId("pharmacist-1")
            .tenantId("pharmacy-tx")
            .eventType(eventType)
            .action(AuditAction.UPDATE)
            .resourceType("prescription")
            .resourceId(resourceId)
            .build();
    }

    private long historySize(String resourceId) {
        return repository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc("prescription", resourceId).size();
    }

    @Test
    @DisplayName("Failed audit insert returns empty and the caller's transaction still commits")
    void testStorageFailureDoesNotAbortCallerTransaction() {
        AtomicReference<Optional<AuditTrailEntry>> recorded = new AtomicReference<>();

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            repository.save(AuditTrailEntry.create(params("rx-tx-1", "prescription.approved"), Instant.now()));
            // event_type is limited to 100 characters
            recorded.set(auditTrailService.record(params("rx-tx-1", "prescription." + "x".repeat(120))));
        });

        assertThat(recorded.get()).isEmpty();
        assertThat(historySize("rx-tx-1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Stored entry survives a rollback of the caller's transaction")
    void testEntryIsCommittedIndependently() {
        AtomicReference<Optional<AuditTrailEntry>> recorded = new AtomicReference<>();

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            recorded.set(auditTrailService.record(params("rx-tx-2", "prescription.rejected")));
            status.setRollbackOnly();
        });

        assertThat(recorded.get()).isPresent();
        assertThat(historySize("rx-tx-2")).isEqualTo(1);
    }
}
