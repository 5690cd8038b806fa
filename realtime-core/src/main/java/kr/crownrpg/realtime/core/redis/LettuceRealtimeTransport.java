package kr.crownrpg.realtime.core.redis;

import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import kr.crownrpg.realtime.api.context.RealtimeContext;
import kr.crownrpg.realtime.api.event.BroadcastMessage;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.event.ChangeOperation;
import kr.crownrpg.realtime.api.presence.PresenceEventType;
import kr.crownrpg.realtime.api.presence.PresenceMessage;
import kr.crownrpg.realtime.api.transport.ConnectionListener;
import kr.crownrpg.realtime.api.transport.ConnectionState;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.api.transport.TransportException;
import kr.crownrpg.realtime.core.internal.ThreadFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Redis Pub/Sub 위에서 동작하는 실시간 전송 계층.
 * <p>
 * 한 프로세스의 모든 토픽이 publish 연결 하나와 subscribe 연결 하나를 공유한다. Lettuce 자동 재연결은 꺼져 있고,
 * 연결이 끊기면 {@link ConnectionState#DISCONNECTED} 를 통지만 한다.
 */
public final class LettuceRealtimeTransport implements RealtimeTransport, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LettuceRealtimeTransport.class);

    private final RedisClientFactory clientFactory;
    private final RealtimeContext context;
    private final EnvelopeCodec codec;
    private final Clock clock;
    private final ExecutorService connectExecutor;

    private final Object lock = new Object();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, LettuceTransportChannel> channels = new ConcurrentHashMap<>();
    private final AtomicLong droppedInboundCount = new AtomicLong(0);

    private RedisClient client;
    private StatefulRedisConnection<String, String> publishConnection;
    private StatefulRedisPubSubConnection<String, String> subscribeConnection;

    public LettuceRealtimeTransport(RedisClientFactory clientFactory, RealtimeContext context, EnvelopeCodec codec, Clock clock) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.context = Objects.requireNonNull(context, "context");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.connectExecutor = ThreadFactories.fixed(1, "crown-realtime-connect");
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(this::attemptConnect, connectExecutor);
    }

    @Override
    public void disconnect() {
        transitionState(ConnectionState.DISCONNECTED, null, "Redis 실시간 연결을 종료합니다");
        synchronized (lock) {
            cleanup();
        }
    }

    @Override
    public void close() {
        disconnect();
        connectExecutor.shutdownNow();
    }

    @Override
    public ConnectionState connectionState() {
        return state.get();
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeConnectionListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public TransportChannel channel(String topic) {
        String redisChannel = RedisTopics.channel(context.environment(), topic);
        LettuceTransportChannel channel = new LettuceTransportChannel(this, topic, redisChannel);
        LettuceTransportChannel previous = channels.put(redisChannel, channel);
        if (previous != null) {
            LOGGER.debug("토픽 '{}'의 이전 전송 채널을 대체합니다", topic);
        }
        return channel;
    }

    @Override
    public void removeChannel(TransportChannel channel) {
        if (!(channel instanceof LettuceTransportChannel own)) {
            return;
        }
        if (!channels.remove(own.redisChannel(), own)) {
            return;
        }
        StatefulRedisPubSubConnection<String, String> connection = currentSubscribeConnection();
        if (connection == null || !connection.isOpen()) {
            return;
        }
        connection.async().unsubscribe(own.redisChannel()).whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.warn("채널 '{}' 구독 해제 실패", own.redisChannel(), error);
            }
        });
    }

    CompletionStage<Void> subscribe(LettuceTransportChannel channel) {
        StatefulRedisPubSubConnection<String, String> connection = currentSubscribeConnection();
        if (state.get() != ConnectionState.CONNECTED || connection == null || !connection.isOpen()) {
            return CompletableFuture.failedFuture(
                    new TransportException(channel.topic(), "Redis 에 연결되어 있지 않습니다", null));
        }
        Duration timeout = clientFactory.timeout();
        return connection.async().subscribe(channel.redisChannel())
                .toCompletableFuture()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void publish(LettuceTransportChannel channel, String kind, String event, String table, Map<String, Object> payload) {
        StatefulRedisConnection<String, String> connection;
        synchronized (lock) {
            connection = publishConnection;
        }
        if (state.get() != ConnectionState.CONNECTED || connection == null || !connection.isOpen()) {
            throw new TransportException(channel.topic(), "Redis 에 연결되어 있지 않아 발행할 수 없습니다", null);
        }
        TransportEnvelope envelope = new TransportEnvelope(
                context.environment(), context.clientId(), kind, event, table, payload, clock.millis());
        String json = codec.encode(envelope);
        connection.async().publish(channel.redisChannel(), json).whenComplete((receivers, error) -> {
            if (error != null) {
                LOGGER.warn("채널 '{}' 발행 실패", channel.redisChannel(), error);
            }
        });
    }

    RealtimeContext context() {
        return context;
    }

    Instant now() {
        return clock.instant();
    }

    private void attemptConnect() {
        if (state.get() == ConnectionState.CONNECTED) {
            return;
        }
        transitionState(ConnectionState.RECONNECTING, null, "Redis 실시간 연결을 시도합니다");
        RuntimeException failure = null;
        synchronized (lock) {
            try {
                cleanup();
                client = clientFactory.createClient();
                client.addListener(new DisconnectListener());
                publishConnection = client.connect();
                subscribeConnection = client.connectPubSub();
                subscribeConnection.addListener(new RedisPubSubAdapter<>() {
                    @Override
                    public void message(String channel, String message) {
                        dispatchMessage(channel, message);
                    }
                });
            } catch (RuntimeException e) {
                cleanup();
                failure = e;
            }
        }
        // listeners may call back into the registry, so they are never notified under the connection lock
        if (failure != null) {
            transitionState(ConnectionState.DISCONNECTED, failure, "Redis 실시간 연결 실패");
            throw new TransportException("Redis 연결 실패", failure);
        }
        transitionState(ConnectionState.CONNECTED, null, "Redis 실시간 연결이 정상화되었습니다");
    }

    private void handleDisconnected(Throwable cause) {
        if (state.get() != ConnectionState.CONNECTED) {
            return;
        }
        transitionState(ConnectionState.DISCONNECTED, cause, "Redis 실시간 연결이 끊어졌습니다");
    }

    void dispatchMessage(String redisChannel, String json) {
        LettuceTransportChannel channel = channels.get(redisChannel);
        if (channel == null) {
            logDrop("등록되지 않은 채널의 메시지를 드롭합니다: " + redisChannel);
            return;
        }
        TransportEnvelope envelope;
        try {
            envelope = codec.decode(json);
        } catch (IllegalStateException e) {
            LOGGER.warn("채널 '{}'에서 메시지 역직렬화에 실패했습니다", redisChannel, e);
            return;
        }
        if (!EnvelopeRules.shouldProcess(envelope, context)) {
            return;
        }
        try {
            switch (envelope.kind()) {
                case TransportEnvelope.KIND_CHANGE -> channel.deliverChange(toChange(channel.topic(), envelope));
                case TransportEnvelope.KIND_BROADCAST -> channel.deliverBroadcast(new BroadcastMessage(
                        channel.topic(), envelope.event(), envelope.payload(), Instant.ofEpochMilli(envelope.sentAt())));
                case TransportEnvelope.KIND_PRESENCE -> channel.deliverPresence(toPresence(channel.topic(), envelope));
                default -> logDrop("알 수 없는 메시지 종류를 드롭합니다: " + envelope.kind());
            }
        } catch (IllegalArgumentException e) {
            LOGGER.warn("채널 '{}'의 메시지 형식이 잘못되었습니다: {}", redisChannel, e.getMessage());
        }
    }

    private ChangeEvent toChange(String topic, TransportEnvelope envelope) {
        return new ChangeEvent(
                topic,
                envelope.table(),
                ChangeOperation.fromWireName(envelope.event()),
                asMap(envelope.payload().get(TransportEnvelope.BEFORE)),
                asMap(envelope.payload().get(TransportEnvelope.AFTER)),
                clock.instant());
    }

    private PresenceMessage toPresence(String topic, TransportEnvelope envelope) {
        List<Map<String, Object>> presences = new ArrayList<>();
        Object raw = envelope.payload().get(TransportEnvelope.PRESENCES);
        if (raw instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?>) {
                    presences.add(asMap(element));
                } else {
                    LOGGER.warn("토픽 '{}'의 presence 항목 형식이 잘못되어 건너뜁니다: {}", topic, element);
                }
            }
        }
        return new PresenceMessage(topic, PresenceEventType.fromWireName(envelope.event()), presences, clock.instant());
    }

    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            copy.put(String.valueOf(e.getKey()), e.getValue());
        }
        return copy;
    }

    private StatefulRedisPubSubConnection<String, String> currentSubscribeConnection() {
        synchronized (lock) {
            return subscribeConnection;
        }
    }

    private void transitionState(ConnectionState newState, Throwable cause, String message) {
        ConnectionState previous = state.getAndSet(newState);
        if (previous == newState) {
            return;
        }
        switch (newState) {
            case CONNECTED, RECONNECTING -> LOGGER.info("{}", message);
            case DISCONNECTED -> LOGGER.warn("{}", message);
        }
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionStateChanged(newState, cause);
            } catch (RuntimeException e) {
                LOGGER.warn("연결 상태 리스너 실행 중 오류", e);
            }
        }
    }

    private void logDrop(String message) {
        long total = droppedInboundCount.incrementAndGet();
        LOGGER.debug("{} (누적 {}회)", message, total);
    }

    private void cleanup() {
        try {
            if (subscribeConnection != null) {
                subscribeConnection.close();
            }
            if (publishConnection != null) {
                publishConnection.close();
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Redis 연결 종료 중 오류", e);
        } finally {
            subscribeConnection = null;
            publishConnection = null;
            if (client != null) {
                try {
                    client.shutdown();
                } catch (RuntimeException e) {
                    LOGGER.warn("Redis 클라이언트 종료 중 오류", e);
                }
                client = null;
            }
        }
    }

    private final class DisconnectListener implements RedisConnectionStateListener {

        @Override
        public void onRedisDisconnected(RedisChannelHandler<?, ?> connection) {
            handleDisconnected(null);
        }

        @Override
        public void onRedisExceptionCaught(RedisChannelHandler<?, ?> connection, Throwable cause) {
            LOGGER.debug("Redis 연결 예외", cause);
        }
    }
}
