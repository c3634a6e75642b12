package com.metapharm.phi.config;

import com.metapharm.phi.infrastructure.crypto.EnvelopeFieldCipher;
import com.metapharm.phi.infrastructure.crypto.FieldCipher;
import com.metapharm.phi.infrastructure.crypto.exception.InvalidInputException;
import com.metapharm.phi.infrastructure.crypto.key.DataKeyCache;
import com.metapharm.phi.testsupport.InMemoryKeyProvider;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerformanceConfigurationTest {

    private SimpleMeterRegistry registry;
    private FieldCipher cipher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        AspectJProxyFactory factory = new AspectJProxyFactory(
            new EnvelopeFieldCipher(new InMemoryKeyProvider(), new DataKeyCache(Clock.systemUTC())));
        factory.addInterface(FieldCipher.class);
        factory.addAspect(new PerformanceConfiguration.CryptoPerformanceAspect(registry));
        cipher = factory.getProxy();
    }

    @Test
    void testSuccessfulCallsAreTimed() {
        cipher.decrypt(cipher.encrypt("value"));

        Timer encrypt = registry.find(PerformanceConfiguration.CRYPTO_TIMER)
            .tag("method", "encrypt").tag("outcome", "success").timer();
        Timer decrypt = registry.find(PerformanceConfiguration.CRYPTO_TIMER)
            .tag("method", "decrypt").tag("outcome", "success").timer();
        assertThat(encrypt).isNotNull();
        assertThat(encrypt.count()).isEqualTo(1);
        assertThat(decrypt.count()).isEqualTo(1);
    }

    @Test
    void testFailuresAreTimedAndRethrown() {
        assertThatThrownBy(() -> cipher.encrypt("")).isInstanceOf(InvalidInputException.class);

        assertThat(registry.find(PerformanceConfiguration.CRYPTO_TIMER)
            .tag("outcome", "failure").timer()).isNotNull();
    }
}
