package kr.crownrpg.realtime.core.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kr.crownrpg.realtime.api.store.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

/**
 * HikariCP 기반 ConnectionProvider 구현체.
 *
 * config Map 지원 키:
 * - jdbc-url (String) [필수]
 * - username (String)
 * - password (String)
 * - max-pool-size (int) [default 4]
 * - min-idle (int) [default 1]
 * - connection-timeout-ms (long) [default 3000]
 */
public final class HikariConnectionProvider implements ConnectionProvider {

    private final HikariDataSource dataSource;

    private HikariConnectionProvider(HikariDataSource ds) {
        this.dataSource = ds;
    }

    public static HikariConnectionProvider fromConfig(Map<String, Object> config) {
        Objects.requireNonNull(config, "config");

        String jdbcUrl = requireStr(config.get("jdbc-url"), "jdbc-url");
        String username = str(config.get("username"), null);
        String password = str(config.get("password"), null);

        int maxPoolSize = Math.max(1, integer(config.get("max-pool-size"), 4));
        int minIdle = Math.max(0, Math.min(maxPoolSize, integer(config.get("min-idle"), 1)));
        long connTimeout = Math.max(250L, longVal(config.get("connection-timeout-ms"), 3000L));

        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(jdbcUrl);
        if (username != null && !username.isBlank()) {
            hc.setUsername(username);
        }
        if (password != null && !password.isEmpty()) {
            hc.setPassword(password);
        }

        hc.setMaximumPoolSize(maxPoolSize);
        hc.setMinimumIdle(minIdle);
        hc.setConnectionTimeout(connTimeout);
        hc.setPoolName("Crown-Realtime-Hikari");

        return new HikariConnectionProvider(new HikariDataSource(hc));
    }

    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void close() {
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            throw new StoreException("HikariDataSource 종료 실패", e);
        }
    }

    private static String requireStr(Object v, String key) {
        String s = str(v, null);
        if (s == null || s.isBlank()) {
            throw new StoreException("필수 저장소 설정이 없습니다: " + key);
        }
        return s;
    }

    private static String str(Object v, String def) {
        if (v == null) return def;
        return String.valueOf(v);
    }

    private static int integer(Object v, int def) {
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static long longVal(Object v, long def) {
        if (v == null) return def;
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
