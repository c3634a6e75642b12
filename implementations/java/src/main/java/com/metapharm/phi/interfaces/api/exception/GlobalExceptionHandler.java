package com.metapharm.phi.interfaces.api.exception;

import com.metapharm.phi.infrastructure.audit.InvalidAuditParamsException;
import com.metapharm.phi.infrastructure.crypto.exception.AuthenticationFailedException;
import com.metapharm.phi.infrastructure.crypto.exception.PhiCryptoException;
import com.metapharm.phi.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.UUID;

/**
 * Maps PHI protection failures to HTTP responses for hosting services.
 *
 * Cipher failures never reach the client in detail: the body carries a generic
 * message and the request id, the cause stays in the log.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    /**
     * Tag mismatch: tampered or corrupted ciphertext.
     */
    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationFailed(
            AuthenticationFailedException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = error(HttpStatus.INTERNAL_SERVER_ERROR,
            ErrorResponse.Code.PHI_INTEGRITY_FAILURE, "Protected data could not be read.", request)
            .securityEvent(true)
            .build();

        if (log.isErrorEnabled()) {
            log.error("SECURITY: encrypted field failed authentication on {} (requestId={})",
                request.getRequestURI(), errorResponse.getRequestId());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    @ExceptionHandler(PhiCryptoException.class)
    public ResponseEntity<ErrorResponse> handleCryptoFailure(
            PhiCryptoException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = error(HttpStatus.INTERNAL_SERVER_ERROR,
            ErrorResponse.Code.PHI_PROCESSING_FAILURE, "Protected data could not be processed.", request)
            .build();

        if (log.isErrorEnabled()) {
            log.error("PHI crypto failure on {} (requestId={}): {}",
                request.getRequestURI(), errorResponse.getRequestId(), ex.getClass().getSimpleName(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    @ExceptionHandler(InvalidAuditParamsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAuditParams(
            InvalidAuditParamsException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = error(HttpStatus.BAD_REQUEST,
            ErrorResponse.Code.AUDIT_EVENT_INCOMPLETE, ex.getMessage(), request)
            .missingFields(ex.getMissingFields())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Rejected audit event: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    private ErrorResponse.ErrorResponseBuilder error(HttpStatus status, ErrorResponse.Code code,
                                                     String message, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(clock.instant())
            .status(status.value())
            .code(code)
            .message(message)
            .path(request.getRequestURI());
    }
}
