package com.metapharm.phi.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * {@code phi.encryption.*} settings.
 *
 * <p>The master key id is checked when the key provider is built, so a missing
 * id fails startup with a {@code KeyConfigurationException} naming the setting.
 */
@ConfigurationProperties(prefix = "phi.encryption")
@Validated
@Getter
@Setter
public class EncryptionProperties {

    @Valid
    private Kms kms = new Kms();

    @Valid
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Kms {

        /** Key id, ARN or alias of the master key. */
        private String keyId;

        @NotBlank
        private String region = "eu-central-1";

        /** Override for LocalStack and similar. */
        private String endpoint;

        private boolean useDefaultCredentials = true;
        private String accessKeyId;
        private String secretAccessKey;

        @NotNull
        private Duration apiCallTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Cache {

        @NotNull
        private Duration ttl = Duration.ofHours(1);

        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(10);

        @Positive
        private long maximumSize = 10_000;
    }
}
