package kr.crownrpg.realtime.api.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL 기반 read-through 캐시.
 * <p>
 * An entry is valid while {@code now - storedAt < ttl}; expired entries are treated as absent. Entries are only
 * ever replaced, never partially updated. Eviction is time based only.
 */
public interface ReadThroughCache {

    /**
     * Returns a valid cached value. Never invokes a fetcher.
     */
    <T> Optional<T> get(String key, Class<T> type);

    <T> void set(String key, T value, Duration ttl);

    /**
     * Stores with the configured default ttl.
     */
    <T> void set(String key, T value);

    /**
     * Returns the cached value if valid; otherwise fetches, stores and returns the fresh value.
     *
     * @throws NoCachedDataException if the value is missing and the network is unavailable
     * @throws CacheFetchException   if the fetcher fails
     */
    <T> T getOrFetch(String key, Class<T> type, Fetcher<T> fetcher, Duration ttl);

    <T> T getOrFetch(String key, Class<T> type, Fetcher<T> fetcher);

    void invalidate(String key);

    /**
     * Removes every entry whose key contains {@code substring}.
     */
    void invalidatePattern(String substring);

    void clear();

    /**
     * Total size of the stored entries in bytes.
     */
    long sizeInBytes();
}
