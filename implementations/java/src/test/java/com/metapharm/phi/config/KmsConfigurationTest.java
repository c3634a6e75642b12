package com.metapharm.phi.config;

import com.metapharm.phi.infrastructure.crypto.exception.KeyConfigurationException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.services.kms.KmsClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KmsConfigurationTest {

    @Test
    void testDefaultCredentialChain() {
        EncryptionProperties.Kms kms = new EncryptionProperties.Kms();

        assertThat(KmsConfiguration.credentialsProvider(kms)).isInstanceOf(DefaultCredentialsProvider.class);
    }

    @Test
    void testStaticCredentials() {
        EncryptionProperties.Kms kms = new EncryptionProperties.Kms();
        kms.setUseDefaultCredentials(false);
        kms.setAccessKeyId("AKIAEXAMPLE");
        kms.setSecretAccessKey("secret");

        AwsCredentialsProvider provider = KmsConfiguration.credentialsProvider(kms);

        assertThat(provider).isInstanceOf(StaticCredentialsProvider.class);
        assertThat(provider.resolveCredentials().accessKeyId()).isEqualTo("AKIAEXAMPLE");
    }

    @Test
    void testMissingStaticCredentialsFailFast() {
        EncryptionProperties.Kms kms = new EncryptionProperties.Kms();
        kms.setUseDefaultCredentials(false);

        assertThatThrownBy(() -> KmsConfiguration.credentialsProvider(kms))
            .isInstanceOf(KeyConfigurationException.class)
            .hasMessageContaining("access-key-id");
    }

    @Test
    void testMissingKeyIdFailsWhenBuildingProvider() {
        EncryptionProperties properties = new EncryptionProperties();
        properties.getKms().setUseDefaultCredentials(false);
        properties.getKms().setAccessKeyId("AKIAEXAMPLE");
        properties.getKms().setSecretAccessKey("secret");
        properties.getKms().setEndpoint("http://localhost:4566");
        KmsConfiguration configuration = new KmsConfiguration(properties);

        try (KmsClient client = configuration.kmsClient()) {
            assertThatThrownBy(() -> configuration.keyProvider(client))
                .isInstanceOf(KeyConfigurationException.class)
                .hasMessageContaining("key-id");
        }
    }
}
