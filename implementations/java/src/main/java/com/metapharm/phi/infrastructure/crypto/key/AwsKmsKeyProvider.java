package com.metapharm.phi.infrastructure.crypto.key;

import com.metapharm.phi.infrastructure.crypto.exception.KeyConfigurationException;
import com.metapharm.phi.infrastructure.crypto.exception.KeyServiceException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DataKeySpec;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.GenerateDataKeyRequest;
import software.amazon.awssdk.services.kms.model.GenerateDataKeyResponse;

import java.util.Arrays;

/**
 * {@link KeyProvider} backed by AWS KMS.
 *
 * <p>Data keys are generated under a single customer master key
 * ({@code GenerateDataKey} with {@code AES_256}) and unwrapped with
 * {@code Decrypt}. Every SDK failure, including API call timeouts, surfaces as
 * {@link KeyServiceException}.
 */
@Slf4j
public class AwsKmsKeyProvider implements KeyProvider {

    static final int DATA_KEY_LENGTH = 32;

    private final KmsClient kmsClient;
    private final String keyId;

    public AwsKmsKeyProvider(KmsClient kmsClient, String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new KeyConfigurationException(
                "KMS master key id is not configured. Set phi.encryption.kms.key-id (AWS_KMS_KEY_ID).");
        }
        if (kmsClient == null) {
            throw new KeyConfigurationException("KMS client is not configured");
        }
        this.kmsClient = kmsClient;
        this.keyId = keyId;
    }

    @Override
    public DataKey generateDataKey() {
        GenerateDataKeyResponse response;
        try {
            response = kmsClient.generateDataKey(GenerateDataKeyRequest.builder()
                .keyId(keyId)
                .keySpec(DataKeySpec.AES_256)
                .build());
        } catch (SdkException e) {
            log.error("KMS GenerateDataKey failed: {}", e.getMessage());
            throw new KeyServiceException("Failed to generate data key: " + e.getMessage(), e);
        }

        if (response == null || response.plaintext() == null || response.ciphertextBlob() == null) {
            throw new KeyServiceException("KMS GenerateDataKey returned incomplete response");
        }

        byte[] plaintextKey = response.plaintext().asByteArray();
        try {
            requireAes256(plaintextKey);
            return new DataKey(plaintextKey, response.ciphertextBlob().asByteArray());
        } finally {
            Arrays.fill(plaintextKey, (byte) 0);
        }
    }

    @Override
    public byte[] decryptDataKey(byte[] encryptedKey) {
        if (encryptedKey == null || encryptedKey.length == 0) {
            throw new KeyServiceException("Cannot decrypt an empty data key");
        }

        DecryptResponse response;
        try {
            response = kmsClient.decrypt(DecryptRequest.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(encryptedKey))
                .keyId(keyId)
                .build());
        } catch (SdkException e) {
            log.error("KMS Decrypt failed: {}", e.getMessage());
            throw new KeyServiceException("Failed to decrypt data key: " + e.getMessage(), e);
        }

        if (response == null || response.plaintext() == null) {
            throw new KeyServiceException("KMS Decrypt returned no plaintext");
        }

        byte[] plaintextKey = response.plaintext().asByteArray();
        requireAes256(plaintextKey);
        return plaintextKey;
    }

    private static void requireAes256(byte[] plaintextKey) {
        if (plaintextKey.length != DATA_KEY_LENGTH) {
            int length = plaintextKey.length;
            Arrays.fill(plaintextKey, (byte) 0);
            throw new KeyServiceException(
                "KMS returned a " + length + "-byte data key, expected " + DATA_KEY_LENGTH);
        }
    }
}
