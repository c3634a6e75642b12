package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * Empty or missing plaintext/envelope was handed to the cipher. Not retryable.
 */
public class InvalidInputException extends PhiCryptoException {

    public InvalidInputException(String message) {
        super(message);
    }
}
