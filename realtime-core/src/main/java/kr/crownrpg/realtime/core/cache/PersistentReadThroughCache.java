package kr.crownrpg.realtime.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.cache.CacheFetchException;
import kr.crownrpg.realtime.api.cache.Fetcher;
import kr.crownrpg.realtime.api.cache.NoCachedDataException;
import kr.crownrpg.realtime.api.cache.ReadThroughCache;
import kr.crownrpg.realtime.api.network.NetworkStatus;
import kr.crownrpg.realtime.api.store.KeyValueStore;
import kr.crownrpg.realtime.core.cache.CacheEntryCodec.CorruptEntryException;
import kr.crownrpg.realtime.core.cache.CacheEntryCodec.StoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ReadThroughCache} persisted in a {@link KeyValueStore}.
 * <p>
 * Every key is stored under the configured prefix and holds a JSON document with the value, the store time
 * and the ttl. Expired and unreadable entries are removed when read; a sweep over all prefixed keys runs on
 * writes at most once per cleanup interval. Store failures on writes are logged and swallowed, fetcher failures
 * propagate to the caller.
 * <p>
 * Concurrent misses on the same key each call their fetcher unless fetch coalescing is enabled.
 */
public final class PersistentReadThroughCache implements ReadThroughCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersistentReadThroughCache.class);

    private final KeyValueStore store;
    private final NetworkStatus network;
    private final CacheEntryCodec codec;
    private final Clock clock;
    private final CacheSettings settings;

    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMillis = new AtomicLong(Long.MIN_VALUE);

    public PersistentReadThroughCache(KeyValueStore store, NetworkStatus network, ObjectMapper mapper, Clock clock, CacheSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.network = Objects.requireNonNull(network, "network");
        this.codec = new CacheEntryCodec(Objects.requireNonNull(mapper, "mapper"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Preconditions.checkNotBlank(key, "key");
        Preconditions.checkNotNull(type, "type");
        String storageKey = storageKey(key);
        Optional<String> raw;
        try {
            raw = await(store.get(storageKey));
        } catch (RuntimeException e) {
            LOGGER.warn("캐시 조회 실패, 미스로 처리합니다: {}", key, e);
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            StoredEntry entry = codec.decode(raw.get());
            if (!entry.isValidAt(clock.millis())) {
                LOGGER.debug("만료된 캐시 항목을 제거합니다: {}", key);
                removeQuietly(storageKey);
                return Optional.empty();
            }
            return Optional.ofNullable(codec.convert(entry, type));
        } catch (CorruptEntryException e) {
            LOGGER.warn("손상된 캐시 항목을 제거합니다: {} ({})", key, e.getMessage());
            removeQuietly(storageKey);
            return Optional.empty();
        }
    }

    @Override
    public <T> void set(String key, T value, Duration ttl) {
        Preconditions.checkNotBlank(key, "key");
        Preconditions.checkNotNull(value, "value");
        Preconditions.checkPositive(ttl, "ttl");
        long now = clock.millis();
        try {
            await(store.set(storageKey(key), codec.encode(value, now, ttl.toMillis())));
        } catch (RuntimeException e) {
            LOGGER.warn("캐시 저장 실패: {}", key, e);
            return;
        }
        sweepIfDue(now);
    }

    @Override
    public <T> void set(String key, T value) {
        set(key, value, settings.defaultTtl());
    }

    @Override
    public <T> T getOrFetch(String key, Class<T> type, Fetcher<T> fetcher, Duration ttl) {
        Preconditions.checkNotNull(fetcher, "fetcher");
        Preconditions.checkPositive(ttl, "ttl");
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!network.isConnected()) {
            throw new NoCachedDataException(key);
        }
        if (!settings.coalesceFetches()) {
            return fetchAndStore(key, fetcher, ttl);
        }
        return type.cast(coalesced(key, fetcher, ttl));
    }

    @Override
    public <T> T getOrFetch(String key, Class<T> type, Fetcher<T> fetcher) {
        return getOrFetch(key, type, fetcher, settings.defaultTtl());
    }

    @Override
    public void invalidate(String key) {
        Preconditions.checkNotBlank(key, "key");
        removeQuietly(storageKey(key));
    }

    @Override
    public void invalidatePattern(String substring) {
        Preconditions.checkNotNull(substring, "substring");
        List<String> matching = new ArrayList<>();
        for (String storageKey : prefixedKeys()) {
            if (logicalKey(storageKey).contains(substring)) {
                matching.add(storageKey);
            }
        }
        removeAllQuietly(matching);
        LOGGER.debug("패턴 '{}'에 해당하는 캐시 {}개를 제거했습니다", substring, matching.size());
    }

    @Override
    public void clear() {
        List<String> keys = prefixedKeys();
        removeAllQuietly(keys);
        LOGGER.info("캐시 {}개를 비웠습니다", keys.size());
    }

    @Override
    public long sizeInBytes() {
        long total = 0L;
        for (String storageKey : prefixedKeys()) {
            try {
                Optional<String> raw = await(store.get(storageKey));
                if (raw.isPresent()) {
                    total += raw.get().getBytes(StandardCharsets.UTF_8).length;
                }
            } catch (RuntimeException e) {
                LOGGER.warn("캐시 크기 계산 중 조회 실패: {}", storageKey, e);
            }
        }
        return total;
    }

    /**
     * Removes every expired or unreadable entry.
     *
     * @return number of removed entries
     */
    public int cleanupExpired() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        long remainingBytes = 0L;
        for (String storageKey : prefixedKeys()) {
            Optional<String> raw;
            try {
                raw = await(store.get(storageKey));
            } catch (RuntimeException e) {
                LOGGER.warn("캐시 정리 중 조회 실패: {}", storageKey, e);
                continue;
            }
            if (raw.isEmpty()) {
                continue;
            }
            try {
                if (codec.decode(raw.get()).isValidAt(now)) {
                    remainingBytes += raw.get().getBytes(StandardCharsets.UTF_8).length;
                } else {
                    expired.add(storageKey);
                }
            } catch (CorruptEntryException e) {
                expired.add(storageKey);
            }
        }
        removeAllQuietly(expired);
        if (settings.maxSizeBytes() > 0 && remainingBytes > settings.maxSizeBytes()) {
            LOGGER.warn("캐시 크기가 설정된 최대치를 넘었습니다 ({} / {} bytes), 크기 기반 제거는 하지 않습니다",
                    remainingBytes, settings.maxSizeBytes());
        }
        if (!expired.isEmpty()) {
            LOGGER.debug("만료된 캐시 {}개를 정리했습니다", expired.size());
        }
        return expired.size();
    }

    private <T> T fetchAndStore(String key, Fetcher<T> fetcher, Duration ttl) {
        T value;
        try {
            value = fetcher.fetch();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheFetchException(key, e);
        }
        if (value == null) {
            LOGGER.debug("fetcher 가 null 을 반환해 캐시에 저장하지 않습니다: {}", key);
            return null;
        }
        set(key, value, ttl);
        return value;
    }

    private Object coalesced(String key, Fetcher<?> fetcher, Duration ttl) {
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            LOGGER.debug("진행 중인 fetch 결과를 공유합니다: {}", key);
            return await(existing);
        }
        try {
            Object value = fetchAndStore(key, fetcher, ttl);
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private void sweepIfDue(long now) {
        long last = lastSweepMillis.get();
        long interval = settings.cleanupInterval().toMillis();
        if (last != Long.MIN_VALUE && now - last < interval) {
            return;
        }
        if (lastSweepMillis.compareAndSet(last, now)) {
            cleanupExpired();
        }
    }

    private List<String> prefixedKeys() {
        List<String> keys;
        try {
            keys = await(store.getAllKeys());
        } catch (RuntimeException e) {
            LOGGER.warn("캐시 키 목록 조회 실패", e);
            return List.of();
        }
        List<String> prefixed = new ArrayList<>();
        for (String key : keys) {
            if (key.startsWith(settings.keyPrefix())) {
                prefixed.add(key);
            }
        }
        return prefixed;
    }

    private void removeQuietly(String storageKey) {
        try {
            await(store.remove(storageKey));
        } catch (RuntimeException e) {
            LOGGER.warn("캐시 삭제 실패: {}", storageKey, e);
        }
    }

    private void removeAllQuietly(List<String> storageKeys) {
        if (storageKeys.isEmpty()) {
            return;
        }
        try {
            await(store.multiRemove(storageKeys));
        } catch (RuntimeException e) {
            LOGGER.warn("캐시 일괄 삭제 실패 ({}개)", storageKeys.size(), e);
        }
    }

    private String storageKey(String key) {
        return settings.keyPrefix() + key;
    }

    private String logicalKey(String storageKey) {
        return storageKey.substring(settings.keyPrefix().length());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
