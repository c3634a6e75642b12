package com.metapharm.phi.infrastructure.crypto.key;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide, time-bounded cache of unwrapped data keys, keyed by a
 * fingerprint of the encrypted key bytes.
 *
 * <p>The cache is advisory: losing an entry costs one KMS round trip, never
 * correctness. Entries are never returned at or after their expiry instant,
 * whether or not {@link #sweep()} has run yet.
 *
 * <p>Key bytes are copied on the way in and on the way out. The cached copy is
 * zeroed when the entry is evicted, replaced, swept or cleared.
 *
 * <p>Thread-safe. Time comes from the injected {@link Clock} so that expiry
 * can be driven from tests.
 */
@Slf4j
public class DataKeyCache implements MeterBinder {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    static final String METRIC_NAME = "phi.data-keys";

    private final Clock clock;
    private final Duration defaultTtl;
    private final Cache<String, CachedDataKey> cache;

    public DataKeyCache(Clock clock) {
        this(clock, DEFAULT_TTL, 10_000);
    }

    public DataKeyCache(Clock clock, Duration defaultTtl, long maximumSize) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.defaultTtl = requirePositive(defaultTtl);
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new UntilExpiresAt())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .removalListener((String fingerprint, CachedDataKey entry, RemovalCause cause) -> {
                if (entry != null) {
                    entry.destroy();
                }
            })
            .recordStats()
            .build();
    }

    /**
     * Derive the cache lookup key for an encrypted data key.
     */
    public static String fingerprint(byte[] encryptedKey) {
        return Base64.getEncoder().encodeToString(encryptedKey);
    }

    /**
     * @return a copy of the cached key, or empty if absent or expired
     */
    public Optional<byte[]> get(String fingerprint) {
        CachedDataKey entry = cache.getIfPresent(fingerprint);
        if (entry == null || !clock.instant().isBefore(entry.expiresAt)) {
            return Optional.empty();
        }
        // null once the entry has been evicted and zeroed
        return Optional.ofNullable(entry.copyKey());
    }

    public void put(String fingerprint, byte[] plaintextKey) {
        put(fingerprint, plaintextKey, defaultTtl);
    }

    /**
     * Insert or overwrite the entry for {@code fingerprint}; it expires at
     * {@code now + ttl}.
     */
    public void put(String fingerprint, byte[] plaintextKey, Duration ttl) {
        Objects.requireNonNull(fingerprint, "Fingerprint must not be null");
        Objects.requireNonNull(plaintextKey, "Plaintext key must not be null");
        Instant expiresAt = clock.instant().plus(requirePositive(ttl));
        cache.put(fingerprint, new CachedDataKey(plaintextKey.clone(), expiresAt));
    }

    /**
     * Remove every entry whose expiry instant has passed.
     *
     * @return number of entries removed
     */
    public long sweep() {
        long before = cache.estimatedSize();
        Instant now = clock.instant();
        cache.asMap().values().removeIf(entry -> !now.isBefore(entry.expiresAt));
        cache.cleanUp();
        long removed = Math.max(0, before - cache.estimatedSize());
        if (removed > 0 && log.isDebugEnabled()) {
            log.debug("Swept {} expired data keys, {} remaining", removed, cache.estimatedSize());
        }
        return removed;
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        log.info("Data key cache cleared");
    }

    /**
     * Number of live entries; expired entries are evicted first.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        CaffeineCacheMetrics.monitor(registry, cache, METRIC_NAME);
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache ttl must be positive");
        }
        return ttl;
    }

    private static final class CachedDataKey {

        private final byte[] plaintextKey;
        private final Instant expiresAt;
        private boolean destroyed;

        private CachedDataKey(byte[] plaintextKey, Instant expiresAt) {
            this.plaintextKey = plaintextKey;
            this.expiresAt = expiresAt;
        }

        // copy and zeroing exclude each other, so a reader never sees a half-zeroed key
        private synchronized byte[] copyKey() {
            return destroyed ? null : plaintextKey.clone();
        }

        private synchronized void destroy() {
            destroyed = true;
            Arrays.fill(plaintextKey, (byte) 0);
        }
    }

    /**
     * Lets Caffeine drop entries on its own at their absolute expiry instant.
     */
    private final class UntilExpiresAt implements Expiry<String, CachedDataKey> {

        @Override
        public long expireAfterCreate(String key, CachedDataKey value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, CachedDataKey value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, CachedDataKey value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CachedDataKey value) {
            Duration remaining = Duration.between(clock.instant(), value.expiresAt);
            return remaining.isNegative() ? 0 : remaining.toNanos();
        }
    }
}
