package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * Base exception for field encryption and key management failures.
 *
 * <p>Messages never contain key material or plaintext. Callers exposing these
 * errors over HTTP must map them to a generic server error.
 */
public class PhiCryptoException extends RuntimeException {

    public PhiCryptoException(String message) {
        super(message);
    }

    public PhiCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
