package kr.crownrpg.realtime.core.store;

import kr.crownrpg.realtime.api.store.KeyValueStore;
import kr.crownrpg.realtime.api.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * KeyValueStore 구현체 (JDBC).
 *
 * - 테이블: realtime_cache(cache_key, cache_value)
 * - set 은 delete + insert 를 한 트랜잭션으로 처리해 DB 종류에 상관없이 동작한다
 * - 모든 작업은 전달받은 executor 에서 비동기로 실행된다
 * - 키는 최대 {@value #MAX_KEY_LENGTH} 자. 더 긴 키의 set 은 DB 에 가기 전에 StoreException 으로 실패한다
 */
public final class JdbcKeyValueStore implements KeyValueStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcKeyValueStore.class);

    static final String TABLE = "realtime_cache";

    public static final int MAX_KEY_LENGTH = 255;

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE
            + " (cache_key VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL PRIMARY KEY, cache_value TEXT NOT NULL)";
    private static final String SELECT_ONE = "SELECT cache_value FROM " + TABLE + " WHERE cache_key = ?";
    private static final String SELECT_KEYS = "SELECT cache_key FROM " + TABLE + " ORDER BY cache_key";
    private static final String DELETE_ONE = "DELETE FROM " + TABLE + " WHERE cache_key = ?";
    private static final String INSERT_ONE = "INSERT INTO " + TABLE + " (cache_key, cache_value) VALUES (?, ?)";

    private final ConnectionProvider provider;
    private final Executor executor;

    private volatile boolean closed = false;

    public JdbcKeyValueStore(ConnectionProvider provider, Executor executor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Creates the backing table if it does not exist yet.
     */
    public CompletableFuture<Void> initialize() {
        return run("캐시 테이블 생성 실패", c -> {
            try (Statement st = c.createStatement()) {
                st.execute(CREATE_TABLE);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        Objects.requireNonNull(key, "key");
        return run("캐시 조회 실패: " + key, c -> {
            try (PreparedStatement ps = c.prepareStatement(SELECT_ONE)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (key.length() > MAX_KEY_LENGTH) {
            return CompletableFuture.failedFuture(new StoreException(
                    "캐시 키가 너무 깁니다 (" + key.length() + " > " + MAX_KEY_LENGTH + "): " + key.substring(0, 32) + "..."));
        }
        return transaction("캐시 저장 실패: " + key, c -> {
            try (PreparedStatement delete = c.prepareStatement(DELETE_ONE);
                 PreparedStatement insert = c.prepareStatement(INSERT_ONE)) {
                delete.setString(1, key);
                delete.executeUpdate();
                insert.setString(1, key);
                insert.setString(2, value);
                insert.executeUpdate();
            }
        });
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        Objects.requireNonNull(key, "key");
        return run("캐시 삭제 실패: " + key, c -> {
            try (PreparedStatement ps = c.prepareStatement(DELETE_ONE)) {
                ps.setString(1, key);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> getAllKeys() {
        return run("캐시 키 목록 조회 실패", c -> {
            List<String> keys = new ArrayList<>();
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(SELECT_KEYS)) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
            return keys;
        });
    }

    @Override
    public CompletableFuture<Void> multiRemove(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<String> copy = List.copyOf(keys);
        return transaction("캐시 일괄 삭제 실패", c -> {
            try (PreparedStatement ps = c.prepareStatement(DELETE_ONE)) {
                for (String key : copy) {
                    ps.setString(1, key);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        });
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            provider.close();
        } catch (RuntimeException e) {
            LOGGER.warn("커넥션 풀 종료 중 오류", e);
        }
    }

    private <T> CompletableFuture<T> run(String failure, SqlFunction<T> action) {
        ensureOpen();
        return CompletableFuture.supplyAsync(() -> {
            try (Connection c = provider.getConnection()) {
                return action.apply(c);
            } catch (Exception e) {
                throw wrap(e, failure);
            }
        }, executor);
    }

    private CompletableFuture<Void> transaction(String failure, SqlConsumer action) {
        return run(failure, c -> {
            c.setAutoCommit(false);
            try {
                action.accept(c);
                c.commit();
                return null;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        });
    }

    private static void rollbackQuietly(Connection c, Exception original) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            original.addSuppressed(rollbackFailure);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("KeyValueStore is closed");
    }

    private static StoreException wrap(Throwable t, String msg) {
        if (t instanceof StoreException se) return se;
        return new StoreException(msg, t);
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
