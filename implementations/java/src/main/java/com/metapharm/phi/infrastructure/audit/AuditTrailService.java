package com.metapharm.phi.infrastructure.audit;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Append-only audit trail for regulated data.
 *
 * <p>Recording is best effort: a storage failure is logged and reported as an
 * empty result, it never fails the business operation being audited.
 * Incomplete parameters are a caller bug and are rejected.
 */
public interface AuditTrailService {

    /**
     * @return the persisted entry, or empty if it could not be stored
     * @throws InvalidAuditParamsException if a required field is missing; nothing is stored
     */
    Optional<AuditTrailEntry> record(AuditEventParams params);

    /**
     * Same as {@link #record(AuditEventParams)}, with address, User-Agent and
     * device info taken from {@code request}.
     */
    Optional<AuditTrailEntry> recordFromRequest(HttpServletRequest request, AuditEventParams params);
}
