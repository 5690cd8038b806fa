package kr.crownrpg.realtime.core.redis;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;

import java.time.Duration;
import java.util.Objects;

/**
 * 설정 값을 받아 Lettuce {@link RedisClient}를 생성하는 팩토리.
 * <p>
 * Lettuce 자체 자동 재연결은 끈다. 재연결은 재연결 감독자가 백오프로 직접 수행한다.
 */
public final class RedisClientFactory {

    private final String host;
    private final int port;
    private final boolean useSsl;
    private final String password;
    private final Duration timeout;
    private final int database;

    public RedisClientFactory(String host, int port, boolean useSsl, String password, Duration timeout, int database) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.useSsl = useSsl;
        this.password = password;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.database = database;
    }

    public RedisClient createClient() {
        RedisClient client = RedisClient.create(createUri());
        client.setOptions(ClientOptions.builder()
                .autoReconnect(false)
                .build());
        return client;
    }

    public RedisURI createUri() {
        RedisURI.Builder builder = RedisURI.builder()
                .withHost(host)
                .withPort(port)
                .withDatabase(database)
                .withTimeout(timeout);

        if (useSsl) {
            builder.withSsl(true);
        }

        if (password != null && !password.isEmpty()) {
            builder.withPassword(password.toCharArray());
        }

        return builder.build();
    }

    public Duration timeout() {
        return timeout;
    }
}
