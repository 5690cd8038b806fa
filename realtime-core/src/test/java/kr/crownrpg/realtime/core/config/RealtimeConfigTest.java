package kr.crownrpg.realtime.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RealtimeConfigTest {

    @TempDir
    Path dataDir;

    @Test
    void loadCopiesDefaultFileOnFirstRun() throws Exception {
        RealtimeConfig config = RealtimeConfig.load(dataDir, getClass().getClassLoader());

        assertThat(Files.exists(dataDir.resolve(RealtimeConfig.FILE_NAME))).isTrue();
        assertThat(config.context().environment()).isEqualTo("prod");
        assertThat(config.context().clientId()).startsWith("client-");
        assertThat(config.redis().port()).isEqualTo(6379);
        assertThat(config.reconnect().maxAttempts()).isEqualTo(10);
        assertThat(config.presence().timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.cache().keyPrefix()).isEqualTo("crown_cache_");
        assertThat(config.cache().coalesceFetches()).isFalse();
        assertThat(config.store().type()).isEqualTo(StoreYamlConfig.StoreType.MEMORY);
    }

    @Test
    void loadReadsExistingFile() throws Exception {
        Files.writeString(dataDir.resolve(RealtimeConfig.FILE_NAME), String.join("\n",
                "realtime:",
                "  environment: staging",
                "  client-id: tablet-7",
                "presence:",
                "  heartbeat-interval-ms: 10000",
                "  timeout-ms: 45000",
                "cache:",
                "  coalesce-fetches: true",
                ""));

        RealtimeConfig config = RealtimeConfig.load(dataDir, getClass().getClassLoader());

        assertThat(config.context().environment()).isEqualTo("staging");
        assertThat(config.context().clientId()).isEqualTo("tablet-7");
        assertThat(config.presence().heartbeatInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.presence().timeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.cache().coalesceFetches()).isTrue();
        assertThat(config.redis().host()).isEqualTo("127.0.0.1");
    }

    @Test
    void emptyRootUsesDefaults() {
        RealtimeConfig config = RealtimeConfig.fromMap(new HashMap<>());

        assertThat(config.events().historySize()).isEqualTo(50);
        assertThat(config.reconnect().initialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.cache().defaultTtl()).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void invalidValuesAreRejectedWithKeyName() {
        assertThatThrownBy(() -> RealtimeConfig.fromMap(Map.of("redis", Map.of("port", 70000))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("redis.port");
        assertThatThrownBy(() -> RealtimeConfig.fromMap(Map.of("reconnect", Map.of("jitter", 1.5))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reconnect.jitter");
        assertThatThrownBy(() -> RealtimeConfig.fromMap(Map.of("events", Map.of("worker-threads", "many"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("events.worker-threads");
    }

    @Test
    void jdbcStoreNeedsUrl() {
        assertThatThrownBy(() -> RealtimeConfig.fromMap(Map.of("store", Map.of("type", "jdbc"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("store.jdbc-url");
        assertThatThrownBy(() -> RealtimeConfig.fromMap(Map.of("store", Map.of("type", "mongo"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("store.type");

        StoreYamlConfig store = RealtimeConfig.fromMap(Map.of("store",
                Map.of("type", "JDBC", "jdbc-url", "jdbc:sqlite:cache.db", "max-pool-size", 2))).store();
        assertThat(store.toPoolConfig())
                .containsEntry("jdbc-url", "jdbc:sqlite:cache.db")
                .containsEntry("max-pool-size", 2);
    }
}
