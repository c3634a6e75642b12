package com.metapharm.phi.infrastructure.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Optional;

/**
 * Writes each entry in its own transaction and flushes it there, so a storage
 * failure surfaces here and never reaches, or rolls back, the caller's transaction.
 */
@Service
@Slf4j
public class DefaultAuditTrailService implements AuditTrailService {

    private final AuditTrailRepository repository;
    private final RequestContextExtractor requestContextExtractor;
    private final Clock clock;
    private final TransactionTemplate auditTransaction;

    public DefaultAuditTrailService(AuditTrailRepository repository,
                                    RequestContextExtractor requestContextExtractor,
                                    Clock clock,
                                    PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.requestContextExtractor = requestContextExtractor;
        this.clock = clock;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Optional<AuditTrailEntry> record(AuditEventParams params) {
        AuditTrailEntry entry = AuditTrailEntry.create(params, clock.instant());
        if (log.isDebugEnabled() && !ProtectedResourceType.isProtected(entry.getResourceType())) {
            log.debug("Auditing resource type {} outside the PHI catalogue", entry.getResourceType());
        }
        try {
            AuditTrailEntry saved = auditTransaction.execute(status -> repository.saveAndFlush(entry));
            if (saved == null) {
                log.error("Audit event {} for {}:{} was not stored",
                    params.getEventType(), params.getResourceType(), params.getResourceId());
                return Optional.empty();
            }
            log.info("AUDIT event={} action={} resource={}:{} user={} tenant={}",
                saved.getEventType(), saved.getAction(), saved.getResourceType(),
                saved.getResourceId(), saved.getUserId(), saved.getTenantId());
            return Optional.of(saved);
        } catch (RuntimeException e) {
            log.error("Failed to persist audit event {} for {}:{}",
                params.getEventType(), params.getResourceType(), params.getResourceId(), e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<AuditTrailEntry> recordFromRequest(HttpServletRequest request, AuditEventParams params) {
        params.validate();
        return record(params.withContext(requestContextExtractor.extract(request)));
    }
}
