package kr.crownrpg.realtime.core.config;

import kr.crownrpg.realtime.core.redis.RedisClientFactory;

import java.time.Duration;
import java.util.Map;

public record RedisYamlConfig(String host, int port, boolean ssl, String password, long timeoutMs, int database) {

    public static RedisYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("redis 섹션이 존재하지 않습니다.");
        }
        String host = YamlValues.trimToEmpty(section.getOrDefault("host", "127.0.0.1"));
        int port = YamlValues.toInt(section.get("port"), 6379, "redis.port");
        boolean ssl = YamlValues.toBoolean(section.get("ssl"), false);
        String password = section.get("password") == null ? "" : section.get("password").toString();
        long timeout = YamlValues.toLong(section.get("timeout-ms"), 5000L, "redis.timeout-ms");
        int database = YamlValues.toInt(section.get("database"), 0, "redis.database");
        if (host.isBlank()) {
            throw new IllegalArgumentException("redis.host 값이 비어 있습니다.");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("redis.port 값이 올바르지 않습니다: " + port);
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("redis.timeout-ms 값은 양수여야 합니다.");
        }
        if (database < 0) {
            throw new IllegalArgumentException("redis.database 값은 0 이상이어야 합니다.");
        }
        return new RedisYamlConfig(host, port, ssl, password, timeout, database);
    }

    public RedisClientFactory toClientFactory() {
        return new RedisClientFactory(host, port, ssl, password, Duration.ofMillis(timeoutMs), database);
    }
}
