package com.metapharm.phi.infrastructure.crypto;

import com.metapharm.phi.infrastructure.crypto.exception.AuthenticationFailedException;
import com.metapharm.phi.infrastructure.crypto.exception.EncryptionException;
import com.metapharm.phi.infrastructure.crypto.exception.InvalidInputException;
import com.metapharm.phi.infrastructure.crypto.exception.PhiCryptoException;
import com.metapharm.phi.infrastructure.crypto.key.DataKey;
import com.metapharm.phi.infrastructure.crypto.key.DataKeyCache;
import com.metapharm.phi.infrastructure.crypto.key.KeyProvider;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * AES-256-GCM envelope encryption backed by a {@link KeyProvider}.
 *
 * <p>Architecture:
 * <ul>
 *   <li>Master key stays in the key-management service</li>
 *   <li>A new data key is generated for every encrypt call and stored, wrapped, in the envelope</li>
 *   <li>Unwrapped data keys are cached for decryption only ({@link DataKeyCache})</li>
 *   <li>16-byte random IV and 128-bit tag per field</li>
 * </ul>
 *
 * <p>Stateless apart from the shared cache; safe for concurrent use.
 */
@Slf4j
public class EnvelopeFieldCipher implements FieldCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KEY_ALGORITHM = "AES";
    private static final int GCM_TAG_LENGTH_BITS = EncryptedFieldEnvelope.AUTH_TAG_LENGTH * 8;

    private final KeyProvider keyProvider;
    private final DataKeyCache dataKeyCache;
    private final SecureRandom secureRandom;

    public EnvelopeFieldCipher(KeyProvider keyProvider, DataKeyCache dataKeyCache) {
        this(keyProvider, dataKeyCache, new SecureRandom());
    }

    EnvelopeFieldCipher(KeyProvider keyProvider, DataKeyCache dataKeyCache, SecureRandom secureRandom) {
        this.keyProvider = keyProvider;
        this.dataKeyCache = dataKeyCache;
        this.secureRandom = secureRandom;
    }

    @Override
    public byte[] encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new InvalidInputException("Cannot encrypt empty value");
        }
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        if (plaintext == null || plaintext.length == 0) {
            throw new InvalidInputException("Cannot encrypt empty value");
        }

        DataKey dataKey = null;
        byte[] plaintextKey = null;
        try {
            dataKey = keyProvider.generateDataKey();
            plaintextKey = dataKey.getPlaintextKey();

            byte[] iv = new byte[EncryptedFieldEnvelope.IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(plaintextKey, KEY_ALGORITHM),
                new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));

            // JCE appends the tag to the ciphertext
            byte[] ciphertextWithTag = cipher.doFinal(plaintext);
            int ciphertextLength = ciphertextWithTag.length - EncryptedFieldEnvelope.AUTH_TAG_LENGTH;
            byte[] ciphertext = Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength);
            byte[] authTag = Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length);

            byte[] envelope = EncryptedFieldEnvelope
                .of(dataKey.getEncryptedKey(), iv, authTag, ciphertext)
                .toBytes();

            log.debug("Encrypted {} bytes into {}-byte envelope", plaintext.length, envelope.length);
            return envelope;

        } catch (GeneralSecurityException | RuntimeException e) {
            log.error("Field encryption failed: {}", e.getMessage());
            throw new EncryptionException("Failed to encrypt field", e);
        } finally {
            zero(plaintextKey);
            if (dataKey != null) {
                dataKey.destroy();
            }
        }
    }

    @Override
    public String decrypt(byte[] envelope) {
        EncryptedFieldEnvelope parsed = EncryptedFieldEnvelope.parse(envelope);
        byte[] plaintextKey = resolveDataKey(parsed.getEncryptedDataKey());

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(plaintextKey, KEY_ALGORITHM),
                new GCMParameterSpec(GCM_TAG_LENGTH_BITS, parsed.getIv()));

            byte[] plaintext = cipher.doFinal(parsed.ciphertextWithTag());
            try {
                return new String(plaintext, StandardCharsets.UTF_8);
            } finally {
                zero(plaintext);
            }

        } catch (AEADBadTagException e) {
            log.error("SECURITY: authentication tag mismatch on encrypted field {}", parsed);
            throw new AuthenticationFailedException("Encrypted field failed authentication", e);
        } catch (GeneralSecurityException e) {
            log.error("Field decryption failed: {}", e.getMessage());
            throw new PhiCryptoException("Failed to decrypt field", e);
        } finally {
            zero(plaintextKey);
        }
    }

    @Override
    public FieldBatchResult<byte[]> encryptFields(Map<String, String> fields) {
        FieldBatchResult<byte[]> result = new FieldBatchResult<>();
        fields.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            try {
                result.succeeded(name, encrypt(value));
            } catch (PhiCryptoException e) {
                log.warn("Encryption of field '{}' failed: {}", name, e.getMessage());
                result.failed(name, e);
            }
        });
        return result;
    }

    @Override
    public FieldBatchResult<String> decryptFields(Map<String, byte[]> fields) {
        FieldBatchResult<String> result = new FieldBatchResult<>();
        fields.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            try {
                result.succeeded(name, decrypt(value));
            } catch (PhiCryptoException e) {
                log.warn("Decryption of field '{}' failed: {}", name, e.getMessage());
                result.failed(name, e);
            }
        });
        return result;
    }

    /**
     * Cache first, then the key service; a successful unwrap populates the cache.
     *
     * @return a plaintext key copy owned by the caller
     */
    private byte[] resolveDataKey(byte[] encryptedKey) {
        String fingerprint = DataKeyCache.fingerprint(encryptedKey);
        Optional<byte[]> cached = dataKeyCache.get(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }

        byte[] plaintextKey = keyProvider.decryptDataKey(encryptedKey);
        dataKeyCache.put(fingerprint, plaintextKey);
        return plaintextKey;
    }

    private static void zero(byte[] bytes) {
        if (bytes != null) {
            Arrays.fill(bytes, (byte) 0);
        }
    }
}
