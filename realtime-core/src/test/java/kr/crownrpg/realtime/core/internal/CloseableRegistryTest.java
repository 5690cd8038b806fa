package kr.crownrpg.realtime.core.internal;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CloseableRegistryTest {

    @Test
    void closesInReverseOrderAndContinuesPastFailures() {
        CloseableRegistry registry = new CloseableRegistry();
        List<String> closed = new ArrayList<>();
        registry.register("first", () -> closed.add("first"));
        registry.register("broken", () -> {
            throw new IllegalStateException("close failed");
        });
        registry.register("last", () -> closed.add("last"));

        registry.closeAllQuietly(LoggerFactory.getLogger(CloseableRegistryTest.class));

        assertThat(closed).containsExactly("last", "first");
        assertThat(registry.size()).isZero();
    }
}
