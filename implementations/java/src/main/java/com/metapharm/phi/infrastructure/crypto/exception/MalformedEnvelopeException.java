package com.metapharm.phi.infrastructure.crypto.exception;

/**
 * A stored envelope does not match the expected binary layout
 * (truncated, wrong length prefix, missing sections).
 */
public class MalformedEnvelopeException extends PhiCryptoException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }
}
