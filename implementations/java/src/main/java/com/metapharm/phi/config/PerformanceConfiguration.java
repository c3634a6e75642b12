package com.metapharm.phi.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timers around cipher, key service and audit calls.
 *
 * Security: tags carry method names and outcomes only, never field names or values.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    static final String CRYPTO_TIMER = "phi.crypto.operation";
    static final String KEY_SERVICE_TIMER = "phi.key-service.call";
    static final String AUDIT_TIMER = "phi.audit.record";

    /**
     * Time field encryption/decryption.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.metapharm.phi.infrastructure.crypto.FieldCipher.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, CRYPTO_TIMER, "Field encryption timing", joinPoint);
        }

        /**
         * Round trips to the key-management service dominate encrypt latency.
         */
        @Around("execution(* com.metapharm.phi.infrastructure.crypto.key.KeyProvider.*(..))")
        public Object timeKeyServiceCall(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, KEY_SERVICE_TIMER, "Key service call timing", joinPoint);
        }
    }

    @Aspect
    @Component
    @Slf4j
    public static class AuditPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public AuditPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.metapharm.phi.infrastructure.audit.AuditTrailService.record*(..))")
        public Object timeAuditRecord(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, AUDIT_TIMER, "Audit trail write timing", joinPoint);
        }
    }

    static Object timed(MeterRegistry registry, String name, String description,
                        ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().getName();
        Timer.Sample sample = Timer.start(registry);
        String outcome = "failure";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description(description)
                .register(registry));
        }
    }
}
