package kr.crownrpg.realtime.core.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.crownrpg.realtime.api.cache.ReadThroughCache;
import kr.crownrpg.realtime.api.channel.ChannelRegistry;
import kr.crownrpg.realtime.api.context.RealtimeContext;
import kr.crownrpg.realtime.api.event.EventStream;
import kr.crownrpg.realtime.api.network.NetworkStatus;
import kr.crownrpg.realtime.api.presence.PresenceTracker;
import kr.crownrpg.realtime.api.store.KeyValueStore;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;
import kr.crownrpg.realtime.core.cache.PersistentReadThroughCache;
import kr.crownrpg.realtime.core.channel.DefaultChannelRegistry;
import kr.crownrpg.realtime.core.config.RealtimeConfig;
import kr.crownrpg.realtime.core.config.StoreYamlConfig;
import kr.crownrpg.realtime.core.event.DefaultEventStream;
import kr.crownrpg.realtime.core.network.TransportNetworkStatus;
import kr.crownrpg.realtime.core.presence.DefaultPresenceTracker;
import kr.crownrpg.realtime.core.redis.EnvelopeCodec;
import kr.crownrpg.realtime.core.redis.LettuceRealtimeTransport;
import kr.crownrpg.realtime.core.scheduler.ExecutorTaskScheduler;
import kr.crownrpg.realtime.core.scheduler.TaskScheduler;
import kr.crownrpg.realtime.core.store.HikariConnectionProvider;
import kr.crownrpg.realtime.core.store.InMemoryKeyValueStore;
import kr.crownrpg.realtime.core.store.JdbcKeyValueStore;
import kr.crownrpg.realtime.core.supervisor.ReconnectionSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * 실시간 코어 조립 클래스.
 * - 설정을 받아 전송 계층, 이벤트 스트림, presence, 채널 레지스트리, 재연결 감독자, 캐시를 만들고 연결한다
 * - 앱은 이걸 생성해서 start/stop 만 호출하면 된다
 * - stop 은 생성 역순으로 자원을 정리하고, 정리 중 오류는 로그만 남긴다
 */
public final class RealtimeCoreBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeCoreBootstrap.class);

    private final RealtimeConfig config;
    private final RealtimeTransport suppliedTransport;
    private final NetworkStatus suppliedNetworkStatus;
    private final Clock clock;

    private CloseableRegistry closeables;
    private RealtimeTransport transport;
    private DefaultEventStream eventStream;
    private DefaultPresenceTracker presenceTracker;
    private DefaultChannelRegistry channelRegistry;
    private ReconnectionSupervisor supervisor;
    private PersistentReadThroughCache cache;
    private boolean started;

    public RealtimeCoreBootstrap(RealtimeConfig config) {
        this(config, null, null, Clock.systemUTC());
    }

    public RealtimeCoreBootstrap(RealtimeConfig config, NetworkStatus networkStatus) {
        this(config, null, networkStatus, Clock.systemUTC());
    }

    public RealtimeCoreBootstrap(RealtimeConfig config, RealtimeTransport transport, Clock clock) {
        this(config, transport, null, clock);
    }

    /**
     * @param transport     transport to use instead of the Redis one built from the config; left open on stop
     * @param networkStatus connectivity check consulted on cache misses; {@code null} falls back to the
     *                      transport connection state
     */
    public RealtimeCoreBootstrap(RealtimeConfig config, RealtimeTransport transport, NetworkStatus networkStatus, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.suppliedTransport = transport;
        this.suppliedNetworkStatus = networkStatus;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        CloseableRegistry registry = new CloseableRegistry();
        try {
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            RealtimeContext context = config.context();

            TaskScheduler scheduler = new ExecutorTaskScheduler(2, "crown-realtime-scheduler");
            registry.register("scheduler", scheduler::shutdown);
            ExecutorService workers = ThreadFactories.fixed(config.events().workerThreads(), "crown-realtime-events");
            registry.register("event-workers", workers::shutdownNow);

            KeyValueStore store = createStore(config.store(), registry);
            registry.register("store", store::close);

            if (suppliedTransport == null) {
                LettuceRealtimeTransport lettuce = new LettuceRealtimeTransport(
                        config.redis().toClientFactory(), context, new EnvelopeCodec(mapper), clock);
                registry.register("transport", lettuce);
                this.transport = lettuce;
            } else {
                this.transport = suppliedTransport;
            }

            this.eventStream = new DefaultEventStream(workers, config.events());
            this.presenceTracker = new DefaultPresenceTracker(scheduler, clock, config.presence());
            this.channelRegistry = new DefaultChannelRegistry(transport, eventStream, presenceTracker);
            registry.register("channels", channelRegistry::closeAll);

            NetworkStatus networkStatus = suppliedNetworkStatus != null
                    ? suppliedNetworkStatus
                    : new TransportNetworkStatus(transport);
            this.cache = new PersistentReadThroughCache(store, networkStatus, mapper, clock, config.cache());

            this.supervisor = new ReconnectionSupervisor(transport, channelRegistry, scheduler, config.reconnect());
            registry.register("supervisor", supervisor::stop);
            supervisor.start();

            this.closeables = registry;
            this.started = true;
            LOGGER.info("실시간 코어를 시작했습니다: environment={}, clientId={}", context.environment(), context.clientId());
        } catch (RuntimeException e) {
            LOGGER.error("실시간 코어 시작 실패", e);
            registry.closeAllQuietly(LOGGER);
            clearComponents();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        closeables.closeAllQuietly(LOGGER);
        closeables = null;
        clearComponents();
        started = false;
        LOGGER.info("실시간 코어를 종료했습니다");
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public RealtimeContext context() {
        return config.context();
    }

    public synchronized ChannelRegistry channels() {
        return require(channelRegistry);
    }

    public synchronized EventStream events() {
        return require(eventStream);
    }

    public synchronized PresenceTracker presence() {
        return require(presenceTracker);
    }

    public synchronized ReadThroughCache cache() {
        return require(cache);
    }

    public synchronized ReconnectionSupervisor supervisor() {
        return require(supervisor);
    }

    public synchronized RealtimeTransport transport() {
        return require(transport);
    }

    private KeyValueStore createStore(StoreYamlConfig storeConfig, CloseableRegistry registry) {
        if (storeConfig.type() == StoreYamlConfig.StoreType.MEMORY) {
            return new InMemoryKeyValueStore();
        }
        ExecutorService storeExecutor = ThreadFactories.fixed(storeConfig.maxPoolSize(), "crown-realtime-store");
        registry.register("store-executor", storeExecutor::shutdownNow);
        JdbcKeyValueStore jdbc = new JdbcKeyValueStore(HikariConnectionProvider.fromConfig(storeConfig.toPoolConfig()), storeExecutor);
        try {
            jdbc.initialize().join();
        } catch (RuntimeException e) {
            jdbc.close();
            throw e;
        }
        return jdbc;
    }

    private void clearComponents() {
        transport = null;
        eventStream = null;
        presenceTracker = null;
        channelRegistry = null;
        supervisor = null;
        cache = null;
    }

    private static <T> T require(T component) {
        if (component == null) throw new IllegalStateException("RealtimeCoreBootstrap not started");
        return component;
    }
}
