package kr.crownrpg.realtime.api.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent local string key-value store. Failures complete the futures with {@link StoreException}.
 */
public interface KeyValueStore {

    CompletableFuture<Optional<String>> get(String key);

    CompletableFuture<Void> set(String key, String value);

    CompletableFuture<Void> remove(String key);

    CompletableFuture<List<String>> getAllKeys();

    CompletableFuture<Void> multiRemove(Collection<String> keys);

    /**
     * 종료 처리
     */
    default void close() {
    }
}
