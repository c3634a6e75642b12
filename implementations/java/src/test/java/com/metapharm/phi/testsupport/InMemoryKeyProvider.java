package com.metapharm.phi.testsupport;

import com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException;
import com.metapharm.phi.infrastructure.crypto.key.DataKey;
import com.metapharm.phi.infrastructure.crypto.key.KeyProvider;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Local stand-in for KMS: data keys are wrapped with AES-GCM under a random
 * in-memory master key, so wrapped keys are opaque and unique like real ones.
 */
public class InMemoryKeyProvider implements KeyProvider {

    private static final int WRAP_IV_LENGTH = 12;

    private final SecureRandom random = new SecureRandom();
    private final SecretKeySpec masterKey;

    public InMemoryKeyProvider() {
        byte[] master = new byte[32];
        random.nextBytes(master);
        this.masterKey = new SecretKeySpec(master, "AES");
    }

    @Override
    public DataKey generateDataKey() {
        byte[] plaintextKey = new byte[32];
        random.nextBytes(plaintextKey);
        try {
            return new DataKey(plaintextKey, wrap(plaintextKey));
        } finally {
            Arrays.fill(plaintextKey, (byte) 0);
        }
    }

    @Override
    public byte[] decryptDataKey(byte[] encryptedKey) {
        if (encryptedKey == null || encryptedKey.length <= WRAP_IV_LENGTH) {
            throw new KeyServiceException("Cannot decrypt data key: invalid ciphertext");
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, masterKey,
                new GCMParameterSpec(128, encryptedKey, 0, WRAP_IV_LENGTH));
            return cipher.doFinal(encryptedKey, WRAP_IV_LENGTH, encryptedKey.length - WRAP_IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new KeyServiceException("Cannot decrypt data key: " + e.getMessage(), e);
        }
    }

    private byte[] wrap(byte[] plaintextKey) {
        byte[] iv = new byte[WRAP_IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(128, iv));
            byte[] wrapped = cipher.doFinal(plaintextKey);
            return ByteBuffer.allocate(iv.length + wrapped.length).put(iv).put(wrapped).array();
        } catch (GeneralSecurityException e) {
            throw new KeyServiceException("Cannot wrap data key: " + e.getMessage(), e);
        }
    }
}
