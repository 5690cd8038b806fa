package kr.crownrpg.realtime.core.store;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    @Test
    void storesAndRemovesValues() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.set("b", "2");
        store.set("a", "1");
        store.set("a", "3");

        assertThat(store.get("a").join()).contains("3");
        assertThat(store.getAllKeys().join()).containsExactly("a", "b");

        store.multiRemove(List.of("a", "zzz"));
        store.remove("b");

        assertThat(store.size()).isZero();
        assertThat(store.get("a").join()).isEmpty();
    }
}
