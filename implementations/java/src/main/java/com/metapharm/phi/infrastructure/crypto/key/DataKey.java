package com.metapharm.phi.infrastructure.crypto.key;

import javax.security.auth.Destroyable;
import java.util.Arrays;
import java.util.Objects;

/**
 * A data encryption key as returned by the key-management service: the
 * plaintext form used to encrypt one field, and the encrypted form stored
 * inside the envelope.
 *
 * <p>Call {@link #destroy()} once the plaintext key is no longer needed.
 */
public final class DataKey implements Destroyable {

    private final byte[] plaintextKey;
    private final byte[] encryptedKey;
    private volatile boolean destroyed;

    public DataKey(byte[] plaintextKey, byte[] encryptedKey) {
        this.plaintextKey = Objects.requireNonNull(plaintextKey, "Plaintext key must not be null").clone();
        this.encryptedKey = Objects.requireNonNull(encryptedKey, "Encrypted key must not be null").clone();
    }

    /**
     * @return copy of the plaintext key; the caller owns (and should zero) the copy
     * @throws IllegalStateException if the key was destroyed
     */
    public byte[] getPlaintextKey() {
        if (destroyed) {
            throw new IllegalStateException("Data key has been destroyed");
        }
        return plaintextKey.clone();
    }

    public byte[] getEncryptedKey() {
        return encryptedKey.clone();
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(plaintextKey, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "DataKey[encryptedKeyLength=" + encryptedKey.length + ", destroyed=" + destroyed + "]";
    }
}
