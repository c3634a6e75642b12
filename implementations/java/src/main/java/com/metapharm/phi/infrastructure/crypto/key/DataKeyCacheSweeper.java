package com.metapharm.phi.infrastructure.crypto.key;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired data keys from memory.
 * Lookups re-check expiry themselves, so the interval only bounds memory use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataKeyCacheSweeper {

    private final DataKeyCache dataKeyCache;

    @Scheduled(
        fixedDelayString = "${phi.encryption.cache.sweep-interval:PT10M}",
        initialDelayString = "${phi.encryption.cache.sweep-interval:PT10M}")
    public void sweepExpiredKeys() {
        try {
            long removed = dataKeyCache.sweep();
            log.debug("Data key sweep completed: {} expired keys removed", removed);
        } catch (RuntimeException e) {
            log.error("Error during data key cache sweep", e);
        }
    }
}
