package kr.crownrpg.realtime.core.cache;

import java.time.Duration;

/**
 * 캐시 정책.
 * <p>
 * {@code maxSizeBytes} is reported only; the cache never evicts by size.
 */
public final class CacheSettings {

    private final String keyPrefix;
    private final Duration defaultTtl;
    private final long maxSizeBytes;
    private final Duration cleanupInterval;
    private final boolean coalesceFetches;

    public CacheSettings(String keyPrefix, Duration defaultTtl, long maxSizeBytes, Duration cleanupInterval, boolean coalesceFetches) {
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.defaultTtl = defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative() ? Duration.ofMinutes(60) : defaultTtl;
        this.maxSizeBytes = Math.max(0L, maxSizeBytes);
        this.cleanupInterval = cleanupInterval == null || cleanupInterval.isNegative() ? Duration.ZERO : cleanupInterval;
        this.coalesceFetches = coalesceFetches;
    }

    public static CacheSettings defaults() {
        return new CacheSettings("crown_cache_", Duration.ofMinutes(60), 50L * 1024 * 1024, Duration.ofMinutes(5), false);
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public long maxSizeBytes() {
        return maxSizeBytes;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    public boolean coalesceFetches() {
        return coalesceFetches;
    }
}
