package com.metapharm.phi.infrastructure.crypto;

import com.metapharm.phi.infrastructure.crypto.exception.InvalidInputException;
import com.metapharm.phi.infrastructure.crypto.exception.MalformedEnvelopeException;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;

/**
 * Self-describing binary form of one encrypted field.
 *
 * <p>Layout (fixed order, big-endian length prefix):
 * <pre>
 * +----------------------+--------------------+---------+--------------+------------+
 * | encrypted key length | encrypted data key | IV      | GCM auth tag | ciphertext |
 * | 4 bytes, uint32 BE   | n bytes            | 16 bytes| 16 bytes     | m bytes    |
 * +----------------------+--------------------+---------+--------------+------------+
 * </pre>
 * The ciphertext has the same length as the plaintext. Any consumer of stored
 * PHI columns must reproduce this layout byte for byte.
 *
 * <p>Immutable: all byte arrays are copied on construction and on access.
 */
public final class EncryptedFieldEnvelope {

    public static final int LENGTH_PREFIX_BYTES = 4;
    public static final int IV_LENGTH = 16;
    public static final int AUTH_TAG_LENGTH = 16;

    private final byte[] encryptedDataKey;
    private final byte[] iv;
    private final byte[] authTag;
    private final byte[] ciphertext;

    private EncryptedFieldEnvelope(byte[] encryptedDataKey, byte[] iv, byte[] authTag, byte[] ciphertext) {
        this.encryptedDataKey = encryptedDataKey;
        this.iv = iv;
        this.authTag = authTag;
        this.ciphertext = ciphertext;
    }

    /**
     * Assemble an envelope from its parts.
     *
     * @throws IllegalArgumentException if a part is missing or has the wrong length
     */
    public static EncryptedFieldEnvelope of(byte[] encryptedDataKey, byte[] iv, byte[] authTag, byte[] ciphertext) {
        if (encryptedDataKey == null || encryptedDataKey.length == 0) {
            throw new IllegalArgumentException("Encrypted data key must not be empty");
        }
        if (iv == null || iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("IV must be exactly " + IV_LENGTH + " bytes");
        }
        if (authTag == null || authTag.length != AUTH_TAG_LENGTH) {
            throw new IllegalArgumentException("Auth tag must be exactly " + AUTH_TAG_LENGTH + " bytes");
        }
        if (ciphertext == null || ciphertext.length == 0) {
            throw new IllegalArgumentException("Ciphertext must not be empty");
        }
        return new EncryptedFieldEnvelope(encryptedDataKey.clone(), iv.clone(), authTag.clone(), ciphertext.clone());
    }

    /**
     * Parse stored bytes strictly in the fixed field order.
     *
     * @throws InvalidInputException if {@code bytes} is null or empty
     * @throws MalformedEnvelopeException on truncation or inconsistent lengths
     */
    public static EncryptedFieldEnvelope parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException("Cannot decrypt empty envelope");
        }
        if (bytes.length < LENGTH_PREFIX_BYTES) {
            throw new MalformedEnvelopeException(
                "Envelope is " + bytes.length + " bytes, too short for the key length prefix");
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long keyLength = Integer.toUnsignedLong(buffer.getInt());
        if (keyLength == 0) {
            throw new MalformedEnvelopeException("Envelope declares an empty encrypted data key");
        }

        long required = keyLength + IV_LENGTH + AUTH_TAG_LENGTH;
        if (required > buffer.remaining()) {
            throw new MalformedEnvelopeException(String.format(
                "Envelope truncated: %d bytes after prefix, at least %d required for a %d-byte data key",
                buffer.remaining(), required, keyLength));
        }
        if (required == buffer.remaining()) {
            throw new MalformedEnvelopeException("Envelope carries no ciphertext");
        }

        byte[] encryptedDataKey = new byte[(int) keyLength];
        byte[] iv = new byte[IV_LENGTH];
        byte[] authTag = new byte[AUTH_TAG_LENGTH];
        buffer.get(encryptedDataKey).get(iv).get(authTag);
        byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        return new EncryptedFieldEnvelope(encryptedDataKey, iv, authTag, ciphertext);
    }

    /**
     * Total envelope size for a given encrypted key and plaintext length.
     */
    public static int expectedLength(int encryptedKeyLength, int plaintextLength) {
        return LENGTH_PREFIX_BYTES + encryptedKeyLength + IV_LENGTH + AUTH_TAG_LENGTH + plaintextLength;
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(length())
            .putInt(encryptedDataKey.length)
            .put(encryptedDataKey)
            .put(iv)
            .put(authTag)
            .put(ciphertext)
            .array();
    }

    public int length() {
        return expectedLength(encryptedDataKey.length, ciphertext.length);
    }

    public byte[] getEncryptedDataKey() {
        return encryptedDataKey.clone();
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    /**
     * Ciphertext followed by the tag, the input shape expected by the JCE GCM decryptor.
     */
    byte[] ciphertextWithTag() {
        byte[] combined = Arrays.copyOf(ciphertext, ciphertext.length + authTag.length);
        System.arraycopy(authTag, 0, combined, ciphertext.length, authTag.length);
        return combined;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedFieldEnvelope)) {
            return false;
        }
        EncryptedFieldEnvelope other = (EncryptedFieldEnvelope) o;
        return Arrays.equals(encryptedDataKey, other.encryptedDataKey)
            && Arrays.equals(iv, other.iv)
            && Arrays.equals(authTag, other.authTag)
            && Arrays.equals(ciphertext, other.ciphertext);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(encryptedDataKey);
        result = 31 * result + Arrays.hashCode(iv);
        result = 31 * result + Arrays.hashCode(authTag);
        return 31 * result + Arrays.hashCode(ciphertext);
    }

    /**
     * Never prints the encrypted key or the ciphertext.
     */
    @Override
    public String toString() {
        String fingerprint = Base64.getEncoder().encodeToString(encryptedDataKey);
        return String.format("EncryptedFieldEnvelope[key=****%s, ciphertextLength=%d]",
            fingerprint.substring(Math.max(0, fingerprint.length() - 4)), ciphertext.length);
    }
}
