package com.metapharm.phi.config;

import com.metapharm.phi.infrastructure.crypto.exception.KeyConfigurationException;
import com.metapharm.phi.infrastructure.crypto.key.AwsKmsKeyProvider;
import com.metapharm.phi.infrastructure.crypto.key.KeyProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;

import java.net.URI;

/**
 * AWS KMS client and the key provider built on it.
 *
 * <p>Building the client makes no AWS call; credentials are resolved on first use.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class KmsConfiguration {

    private final EncryptionProperties properties;

    @Bean(destroyMethod = "close")
    public KmsClient kmsClient() {
        EncryptionProperties.Kms kms = properties.getKms();
        log.info("Initializing AWS KMS client for region: {}", kms.getRegion());

        KmsClientBuilder builder = KmsClient.builder()
            .region(Region.of(kms.getRegion()))
            .credentialsProvider(credentialsProvider(kms))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(kms.getApiCallTimeout())
                .build());

        if (kms.getEndpoint() != null && !kms.getEndpoint().isBlank()) {
            log.info("Using KMS endpoint override {}", kms.getEndpoint());
            builder.endpointOverride(URI.create(kms.getEndpoint()));
        }
        return builder.build();
    }

    @Bean
    public KeyProvider keyProvider(KmsClient kmsClient) {
        return new AwsKmsKeyProvider(kmsClient, properties.getKms().getKeyId());
    }

    static AwsCredentialsProvider credentialsProvider(EncryptionProperties.Kms kms) {
        if (kms.isUseDefaultCredentials()) {
            log.info("Using AWS default credentials provider chain");
            return DefaultCredentialsProvider.create();
        }
        if (isBlank(kms.getAccessKeyId()) || isBlank(kms.getSecretAccessKey())) {
            throw new KeyConfigurationException(
                "AWS credentials not configured. Set phi.encryption.kms.access-key-id and "
                    + "phi.encryption.kms.secret-access-key or enable use-default-credentials.");
        }
        log.info("Using static AWS credentials");
        return StaticCredentialsProvider.create(
            AwsBasicCredentials.create(kms.getAccessKeyId(), kms.getSecretAccessKey()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
