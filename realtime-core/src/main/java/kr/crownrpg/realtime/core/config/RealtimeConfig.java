package kr.crownrpg.realtime.core.config;

import kr.crownrpg.realtime.api.context.RealtimeContext;
import kr.crownrpg.realtime.core.cache.CacheSettings;
import kr.crownrpg.realtime.core.event.EventStreamSettings;
import kr.crownrpg.realtime.core.presence.PresenceSettings;
import kr.crownrpg.realtime.core.supervisor.ReconnectSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * realtime.yml 을 읽어 각 컴포넌트 설정으로 변환한다.
 * <p>
 * 파일이 없으면 리소스의 기본 realtime.yml 을 복사한 뒤 읽는다. 생략된 값은 기본값을 쓰고, 잘못된 값은
 * 해당 키 이름과 함께 {@link IllegalArgumentException} 으로 거부한다.
 */
public final class RealtimeConfig {

    public static final String FILE_NAME = "realtime.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeConfig.class);

    private final RealtimeContext context;
    private final RedisYamlConfig redis;
    private final ReconnectSettings reconnect;
    private final PresenceSettings presence;
    private final EventStreamSettings events;
    private final CacheSettings cache;
    private final StoreYamlConfig store;

    private RealtimeConfig(RealtimeContext context, RedisYamlConfig redis, ReconnectSettings reconnect, PresenceSettings presence,
                           EventStreamSettings events, CacheSettings cache, StoreYamlConfig store) {
        this.context = context;
        this.redis = redis;
        this.reconnect = reconnect;
        this.presence = presence;
        this.events = events;
        this.cache = cache;
        this.store = store;
    }

    public static RealtimeConfig load(Path dataDir, ClassLoader loader) {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(loader, "loader");
        try {
            if (!Files.exists(dataDir)) Files.createDirectories(dataDir);

            Path file = dataDir.resolve(FILE_NAME);
            if (!Files.exists(file)) {
                try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
                    if (in == null) throw new IllegalStateException("리소스에 기본 " + FILE_NAME + "이 존재하지 않습니다.");
                    try (OutputStream out = Files.newOutputStream(file)) {
                        in.transferTo(out);
                    }
                }
                LOGGER.info("기본 설정 파일을 생성했습니다: {}", file);
            }

            Yaml yaml = new Yaml();
            Map<String, Object> root;
            try (InputStream in = Files.newInputStream(file)) {
                Object obj = yaml.load(in);
                root = (obj instanceof Map<?, ?> m) ? YamlValues.castMap(m) : new HashMap<>();
            }
            return fromMap(root);
        } catch (IOException e) {
            throw new IllegalStateException(FILE_NAME + "을 불러오지 못했습니다.", e);
        }
    }

    public static RealtimeConfig fromMap(Map<String, Object> root) {
        Objects.requireNonNull(root, "root");
        return new RealtimeConfig(
                context(YamlValues.section(root.get("realtime"))),
                RedisYamlConfig.fromMap(YamlValues.section(root.get("redis"))),
                reconnect(YamlValues.section(root.get("reconnect"))),
                presence(YamlValues.section(root.get("presence"))),
                events(YamlValues.section(root.get("events"))),
                cache(YamlValues.section(root.get("cache"))),
                StoreYamlConfig.fromMap(YamlValues.section(root.get("store"))));
    }

    public RealtimeContext context() { return context; }
    public RedisYamlConfig redis() { return redis; }
    public ReconnectSettings reconnect() { return reconnect; }
    public PresenceSettings presence() { return presence; }
    public EventStreamSettings events() { return events; }
    public CacheSettings cache() { return cache; }
    public StoreYamlConfig store() { return store; }

    private static RealtimeContext context(Map<String, Object> section) {
        String environment = YamlValues.trimToEmpty(section.getOrDefault("environment", "prod"));
        String clientId = YamlValues.trimToEmpty(section.get("client-id"));
        if (environment.isBlank()) {
            throw new IllegalArgumentException("realtime.environment 값이 비어 있습니다.");
        }
        if (clientId.isBlank()) {
            clientId = "client-" + UUID.randomUUID();
            LOGGER.info("realtime.client-id 가 없어 임시 식별자를 사용합니다: {}", clientId);
        }
        return RealtimeContext.of(environment, clientId);
    }

    private static ReconnectSettings reconnect(Map<String, Object> section) {
        ReconnectSettings defaults = ReconnectSettings.defaults();
        long initial = YamlValues.toLong(section.get("initial-delay-ms"), defaults.initialDelay().toMillis(), "reconnect.initial-delay-ms");
        long max = YamlValues.toLong(section.get("max-delay-ms"), defaults.maxDelay().toMillis(), "reconnect.max-delay-ms");
        int attempts = YamlValues.toInt(section.get("max-attempts"), defaults.maxAttempts(), "reconnect.max-attempts");
        double jitter = YamlValues.toDouble(section.get("jitter"), defaults.jitterRatio(), "reconnect.jitter");
        if (initial < 0 || max < 0) {
            throw new IllegalArgumentException("reconnect 지연 값은 음수일 수 없습니다.");
        }
        if (attempts <= 0) {
            throw new IllegalArgumentException("reconnect.max-attempts 값은 양수여야 합니다.");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("reconnect.jitter 값은 0 이상 1 이하여야 합니다: " + jitter);
        }
        return new ReconnectSettings(Duration.ofMillis(initial), Duration.ofMillis(max), attempts, jitter);
    }

    private static PresenceSettings presence(Map<String, Object> section) {
        long interval = YamlValues.toLong(section.get("heartbeat-interval-ms"), 30_000L, "presence.heartbeat-interval-ms");
        long timeout = YamlValues.toLong(section.get("timeout-ms"), 0L, "presence.timeout-ms");
        if (interval <= 0) {
            throw new IllegalArgumentException("presence.heartbeat-interval-ms 값은 양수여야 합니다.");
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("presence.timeout-ms 값은 음수일 수 없습니다.");
        }
        // 0 means twice the heartbeat interval
        return new PresenceSettings(Duration.ofMillis(interval), timeout == 0 ? null : Duration.ofMillis(timeout));
    }

    private static EventStreamSettings events(Map<String, Object> section) {
        EventStreamSettings defaults = EventStreamSettings.defaults();
        int workers = YamlValues.toInt(section.get("worker-threads"), defaults.workerThreads(), "events.worker-threads");
        int history = YamlValues.toInt(section.get("history-size"), defaults.historySize(), "events.history-size");
        int dropWarn = YamlValues.toInt(section.get("drop-warn-threshold"), defaults.dropWarnThreshold(), "events.drop-warn-threshold");
        if (workers <= 0) {
            throw new IllegalArgumentException("events.worker-threads 값은 양수여야 합니다.");
        }
        return new EventStreamSettings(workers, history, dropWarn);
    }

    private static CacheSettings cache(Map<String, Object> section) {
        CacheSettings defaults = CacheSettings.defaults();
        String prefix = section.containsKey("key-prefix")
                ? YamlValues.trimToEmpty(section.get("key-prefix"))
                : defaults.keyPrefix();
        long ttlMinutes = YamlValues.toLong(section.get("default-ttl-minutes"), defaults.defaultTtl().toMinutes(), "cache.default-ttl-minutes");
        long maxSizeMb = YamlValues.toLong(section.get("max-size-mb"), defaults.maxSizeBytes() / (1024 * 1024), "cache.max-size-mb");
        long cleanupMs = YamlValues.toLong(section.get("cleanup-interval-ms"), defaults.cleanupInterval().toMillis(), "cache.cleanup-interval-ms");
        boolean coalesce = YamlValues.toBoolean(section.get("coalesce-fetches"), defaults.coalesceFetches());
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("cache.default-ttl-minutes 값은 양수여야 합니다.");
        }
        if (maxSizeMb < 0 || cleanupMs < 0) {
            throw new IllegalArgumentException("cache.max-size-mb / cache.cleanup-interval-ms 값은 음수일 수 없습니다.");
        }
        return new CacheSettings(prefix, Duration.ofMinutes(ttlMinutes), maxSizeMb * 1024 * 1024, Duration.ofMillis(cleanupMs), coalesce);
    }
}
