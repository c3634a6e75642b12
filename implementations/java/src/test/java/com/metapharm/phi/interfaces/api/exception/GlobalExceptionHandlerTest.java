package com.metapharm.phi.interfaces.api.exception;

import com.metapharm.phi.infrastructure.audit.InvalidAuditParamsException;
import com.metapharm.phi.infrastructure.crypto.exception.AuthenticationFailedException;
import com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException;
import com.metapharm.phi.interfaces.api.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import javax.crypto.AEADBadTagException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2025-11-07T10:00:00Z");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));
    private final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/patients/42");

    @Test
    void testCryptoFailureDoesNotLeakDetails() {
        ResponseEntity<ErrorResponse> response = handler.handleCryptoFailure(
            new KeyServiceException("Failed to decrypt data key: AccessDeniedException arn:aws:kms:..."), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).doesNotContain("arn:aws").doesNotContain("KMS");
        assertThat(response.getBody().getPath()).isEqualTo("/patients/42");
        assertThat(response.getBody().getTimestamp()).isEqualTo(NOW);
        assertThat(response.getBody().getRequestId()).isNotNull();
        assertThat(response.getBody().getCode()).isEqualTo(ErrorResponse.Code.PHI_PROCESSING_FAILURE);
        assertThat(response.getBody().isSecurityEvent()).isFalse();
    }

    @Test
    void testAuthenticationFailureIsGeneric() {
        ResponseEntity<ErrorResponse> response = handler.handleAuthenticationFailed(
            new AuthenticationFailedException("Encrypted field failed authentication",
                new AEADBadTagException("Tag mismatch")), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).doesNotContain("Tag");
        assertThat(response.getBody().getCode()).isEqualTo(ErrorResponse.Code.PHI_INTEGRITY_FAILURE);
        assertThat(response.getBody().isSecurityEvent()).isTrue();
    }

    @Test
    void testInvalidAuditParamsIsBadRequest() {
        ResponseEntity<ErrorResponse> response = handler.handleInvalidAuditParams(
            new InvalidAuditParamsException(List.of("userId", "resourceId")), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getCode()).isEqualTo(ErrorResponse.Code.AUDIT_EVENT_INCOMPLETE);
        assertThat(response.getBody().getMissingFields()).containsExactly("userId", "resourceId");
    }
}
