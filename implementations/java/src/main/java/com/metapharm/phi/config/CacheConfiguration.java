package com.metapharm.phi.config;

import com.metapharm.phi.infrastructure.crypto.EnvelopeFieldCipher;
import com.metapharm.phi.infrastructure.crypto.FieldCipher;
import com.metapharm.phi.infrastructure.crypto.key.DataKeyCache;
import com.metapharm.phi.infrastructure.crypto.key.KeyProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Data key cache and the field cipher that uses it.
 *
 * <p>The cache holds unwrapped data keys for decryption only. Its ticker follows
 * the {@link Clock} bean so expiry can be driven from tests.
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DataKeyCache dataKeyCache(Clock clock, EncryptionProperties properties) {
        EncryptionProperties.Cache cache = properties.getCache();
        log.info("Configuring data key cache: ttl={}, sweepInterval={}, maximumSize={}",
            cache.getTtl(), cache.getSweepInterval(), cache.getMaximumSize());
        return new DataKeyCache(clock, cache.getTtl(), cache.getMaximumSize());
    }

    @Bean
    public FieldCipher fieldCipher(KeyProvider keyProvider, DataKeyCache dataKeyCache) {
        return new EnvelopeFieldCipher(keyProvider, dataKeyCache);
    }
}
