package com.metapharm.phi;

import com.metapharm.phi.application.PhiApplicationService;
import com.metapharm.phi.infrastructure.audit.AuditAction;
import com.metapharm.phi.infrastructure.audit.AuditEventParams;
import com.metapharm.phi.infrastructure.audit.AuditTrailEntry;
import com.metapharm.phi.infrastructure.audit.query.AuditSearchCriteria;
import com.metapharm.phi.infrastructure.audit.query.AuditTrailQueryService;
import com.metapharm.phi.infrastructure.crypto.key.KeyProvider;
import com.metapharm.phi.testsupport.InMemoryKeyProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class PhiProtectionApplicationTests {

    @TestConfiguration
    static class LocalKeys {

        @Bean
        @Primary
        KeyProvider localKeyProvider() {
            return new InMemoryKeyProvider();
        }
    }

    @Autowired
    private PhiApplicationService phiApplicationService;

    @Autowired
    private AuditTrailQueryService auditTrailQueryService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void testEncryptAuditAndQueryThroughTheContext() {
        byte[] envelope = phiApplicationService.encryptField("Rue du Rhône 12");
        assertThat(phiApplicationService.decryptField(envelope)).isEqualTo("Rue du Rhône 12");

        AuditTrailEntry entry = phiApplicationService.logAuditEvent(AuditEventParams.builder()
            .userId("user-1")
            .tenantId("pharmacy-ctx")
            .eventType("patient_profile.read")
            .action(AuditAction.READ)
            .resourceType("patient_profile")
            .resourceId("p-1")
            .build()).orElseThrow();

        assertThat(entry.getId()).isNotNull();
        assertThat(auditTrailQueryService.search(AuditSearchCriteria.builder()
            .tenantId("pharmacy-ctx").build()).getTotalElements()).isEqualTo(1);
        assertThat(meterRegistry.find("phi.crypto.operation").timers()).isNotEmpty();
    }
}
