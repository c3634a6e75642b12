package com.metapharm.phi.infrastructure.crypto;

import java.util.Map;

/**
 * Field-level envelope encryption for PHI columns.
 *
 * <p>Every encrypt call uses a fresh data key and a fresh IV, so encrypting the
 * same value twice yields two unrelated envelopes.
 *
 * @see EncryptedFieldEnvelope for the stored byte layout
 */
public interface FieldCipher {

    /**
     * Encrypt a UTF-8 string.
     *
     * @param plaintext non-empty value
     * @return envelope bytes for storage
     * @throws com.metapharm.phi.infrastructure.crypto.exception.InvalidInputException if null or empty
     * @throws com.metapharm.phi.infrastructure.crypto.exception.EncryptionException on any other failure
     */
    byte[] encrypt(String plaintext);

    /**
     * Encrypt raw bytes.
     */
    byte[] encrypt(byte[] plaintext);

    /**
     * Decrypt an envelope produced by {@link #encrypt(String)}.
     *
     * @return the plaintext decoded as UTF-8
     * @throws com.metapharm.phi.infrastructure.crypto.exception.InvalidInputException if null or empty
     * @throws com.metapharm.phi.infrastructure.crypto.exception.MalformedEnvelopeException on a corrupt layout
     * @throws com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException if the data key cannot be unwrapped
     * @throws com.metapharm.phi.infrastructure.crypto.exception.AuthenticationFailedException on tag mismatch
     */
    String decrypt(byte[] envelope);

    /**
     * Encrypt each non-null value; failures are collected per field.
     */
    FieldBatchResult<byte[]> encryptFields(Map<String, String> fields);

    /**
     * Decrypt each non-null envelope; failures are collected per field.
     */
    FieldBatchResult<String> decryptFields(Map<String, byte[]> fields);
}
