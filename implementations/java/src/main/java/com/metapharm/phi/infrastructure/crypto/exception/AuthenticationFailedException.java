package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * GCM tag verification failed. The envelope was corrupted or tampered with;
 * no plaintext is ever returned. Treat as a security event.
 */
public class AuthenticationFailedException extends PhiCryptoException {

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
