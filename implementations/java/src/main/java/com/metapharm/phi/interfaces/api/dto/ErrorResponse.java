package com.metapharm.phi.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Error body for PHI protection failures. Carries a stable {@link Code} for
 * clients and the request id to correlate with the server log; cipher and key
 * service details are never included.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    UUID requestId;
    Instant timestamp;
    int status;
    Code code;
    String message;
    String path;

    /** Set when the failure must be followed up as a possible tampering attempt. */
    boolean securityEvent;

    /** Required audit fields that were missing or blank. */
    @Singular
    List<String> missingFields;

    public enum Code {
        /** Stored ciphertext failed GCM authentication. */
        PHI_INTEGRITY_FAILURE,
        /** Any other encryption, envelope or key service failure. */
        PHI_PROCESSING_FAILURE,
        AUDIT_EVENT_INCOMPLETE
    }
}
