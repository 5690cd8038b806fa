package kr.crownrpg.realtime.core.store;

import kr.crownrpg.realtime.api.store.KeyValueStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Reference in-memory {@link KeyValueStore}. Futures complete before the call returns.
 *
 * <p>Good for unit tests and processes without persistent storage.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentSkipListMap<>();

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        Objects.requireNonNull(key, "key");
        return CompletableFuture.completedFuture(Optional.ofNullable(values.get(key)));
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        Objects.requireNonNull(key, "key");
        values.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> getAllKeys() {
        return CompletableFuture.completedFuture(new ArrayList<>(values.keySet()));
    }

    @Override
    public CompletableFuture<Void> multiRemove(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        keys.forEach(values::remove);
        return CompletableFuture.completedFuture(null);
    }

    public int size() {
        return values.size();
    }
}
