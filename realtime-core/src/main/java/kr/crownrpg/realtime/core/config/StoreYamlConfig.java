package kr.crownrpg.realtime.core.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@code store} 섹션. {@code type} 은 memory 또는 jdbc.
 */
public record StoreYamlConfig(StoreType type, String jdbcUrl, String username, String password,
                              int maxPoolSize, int minIdle, long connectionTimeoutMs) {

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public static StoreYamlConfig memory() {
        return new StoreYamlConfig(StoreType.MEMORY, "", "", "", 4, 1, 3000L);
    }

    public static StoreYamlConfig fromMap(Map<String, Object> section) {
        if (section == null || section.isEmpty()) {
            return memory();
        }
        String rawType = YamlValues.trimToEmpty(section.getOrDefault("type", "memory")).toUpperCase(Locale.ROOT);
        StoreType type;
        try {
            type = StoreType.valueOf(rawType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("store.type 값은 memory 또는 jdbc 여야 합니다: " + rawType, e);
        }
        String jdbcUrl = YamlValues.trimToEmpty(section.get("jdbc-url"));
        String username = YamlValues.trimToEmpty(section.get("username"));
        String password = section.get("password") == null ? "" : section.get("password").toString();
        int maxPoolSize = YamlValues.toInt(section.get("max-pool-size"), 4, "store.max-pool-size");
        int minIdle = YamlValues.toInt(section.get("min-idle"), 1, "store.min-idle");
        long timeout = YamlValues.toLong(section.get("connection-timeout-ms"), 3000L, "store.connection-timeout-ms");
        if (type == StoreType.JDBC && jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("store.jdbc-url 값이 비어 있습니다.");
        }
        if (maxPoolSize <= 0) {
            throw new IllegalArgumentException("store.max-pool-size 값은 양수여야 합니다.");
        }
        return new StoreYamlConfig(type, jdbcUrl, username, password, maxPoolSize, Math.max(0, minIdle), timeout);
    }

    /**
     * Map handed to {@code HikariConnectionProvider.fromConfig}.
     */
    public Map<String, Object> toPoolConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("jdbc-url", jdbcUrl);
        config.put("username", username);
        config.put("password", password);
        config.put("max-pool-size", maxPoolSize);
        config.put("min-idle", minIdle);
        config.put("connection-timeout-ms", connectionTimeoutMs);
        return config;
    }
}
