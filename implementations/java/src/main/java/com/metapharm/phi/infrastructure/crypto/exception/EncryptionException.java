package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * Wraps any failure raised while producing an envelope.
 */
public class EncryptionException extends PhiCryptoException {

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
