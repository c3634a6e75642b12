package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * The key-management service was unreachable, timed out, or returned an
 * incomplete response. Retrying is the caller's decision.
 */
public class KeyServiceException extends PhiCryptoException {

    public KeyServiceException(String message) {
        super(message);
    }

    public KeyServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
