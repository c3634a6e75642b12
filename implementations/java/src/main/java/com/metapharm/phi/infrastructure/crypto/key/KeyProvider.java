package com.metapharm.phi.infrastructure.crypto.key;

/**
 * Sole point of contact with the external key-management service.
 *
 * <p>Implementations hold no mutable state and perform exactly one remote call
 * per invocation. No retries happen at this layer.
 */
public interface KeyProvider {

    /**
     * Request a fresh AES-256 data key.
     *
     * @return plaintext (32 bytes) and encrypted form of the new key
     * @throws com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException
     *         if the service fails, times out, or returns an incomplete response
     */
    DataKey generateDataKey();

    /**
     * Unwrap a previously generated data key.
     *
     * @param encryptedKey encrypted data key as embedded in an envelope
     * @return 32-byte plaintext key, owned by the caller
     * @throws com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException
     *         if the service fails or returns no plaintext
     */
    byte[] decryptDataKey(byte[] encryptedKey);
}
