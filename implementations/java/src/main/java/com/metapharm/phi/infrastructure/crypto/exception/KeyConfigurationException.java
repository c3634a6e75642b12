package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * Thrown at startup when key management is not configured (e.g. no master key id).
 * The application context must not start when this is raised.
 */
public class KeyConfigurationException extends PhiCryptoException {

    public KeyConfigurationException(String message) {
        super(message);
    }
}
