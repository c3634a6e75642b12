package com.metapharm.phi;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * PHI protection core of the MetaPharm platform.
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM envelopes, data keys wrapped by AWS KMS</li>
 *   <li><strong>Audit Trail</strong>: append-only record of every access to regulated data</li>
 * </ul>
 *
 * <p>Both are used in-process by the platform services through
 * {@link com.metapharm.phi.application.PhiApplicationService}.
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class PhiProtectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhiProtectionApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  MetaPharm PHI Protection Core                            ║
            ║  Encryption: AES-256-GCM (envelope, AWS KMS)              ║
            ║  Audit Trail: APPEND-ONLY                                 ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
