package kr.crownrpg.realtime.core.supervisor;

import kr.crownrpg.realtime.api.lifecycle.ManagedLifecycle;
import kr.crownrpg.realtime.api.transport.ConnectionListener;
import kr.crownrpg.realtime.api.transport.ConnectionState;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;
import kr.crownrpg.realtime.api.transport.TransportException;
import kr.crownrpg.realtime.core.channel.ChannelRecovery;
import kr.crownrpg.realtime.core.channel.DefaultChannelRegistry;
import kr.crownrpg.realtime.core.scheduler.ScheduledTask;
import kr.crownrpg.realtime.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Drives reconnection of the shared transport connection and of individual channels.
 * <pre>
 * CONNECTED -> DISCONNECTED -> RECONNECTING (backoff) -> CONNECTED
 * </pre>
 * After the connection is back every channel of the registry is re-opened, which also republishes tracked
 * presence. A channel that fails while the connection is up is retried on its own with the same backoff.
 * When attempts run out the state becomes DISCONNECTED and subscribers are told so once; the connection is then
 * retried every {@code maxDelay} until it comes back or {@link #retryNow()} restarts the backoff.
 */
public final class ReconnectionSupervisor implements ManagedLifecycle, ConnectionListener, ChannelRecovery {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectionSupervisor.class);

    private final RealtimeTransport transport;
    private final DefaultChannelRegistry registry;
    private final TaskScheduler scheduler;
    private final ReconnectSettings settings;
    private final Backoff backoff;

    private final Object lock = new Object();
    private final Map<String, ChannelRetry> channelRetries = new HashMap<>();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempts;
    private boolean exhausted;
    private ScheduledTask reconnectTask;
    private boolean started;
    private boolean stopped;

    public ReconnectionSupervisor(RealtimeTransport transport, DefaultChannelRegistry registry, TaskScheduler scheduler, ReconnectSettings settings) {
        this(transport, registry, scheduler, settings, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconnectionSupervisor(RealtimeTransport transport, DefaultChannelRegistry registry, TaskScheduler scheduler,
                                  ReconnectSettings settings, DoubleSupplier random) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backoff = new Backoff(settings, random);
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (stopped) {
                throw new IllegalStateException("종료된 재연결 감독자는 다시 시작할 수 없습니다");
            }
            if (started) {
                return;
            }
            started = true;
        }
        registry.setRecovery(this);
        transport.addConnectionListener(this);
        LOGGER.info("실시간 전송 연결을 시작합니다");
        attemptConnect();
    }

    @Override
    public void stop() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            cancelReconnect();
            channelRetries.values().forEach(ChannelRetry::cancel);
            channelRetries.clear();
        }
        transport.removeConnectionListener(this);
        registry.setRecovery(ChannelRecovery.NONE);
        LOGGER.info("재연결 감독을 종료합니다");
    }

    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Resets the attempt counter and reconnects immediately unless already connected.
     */
    public void retryNow() {
        synchronized (lock) {
            if (stopped) {
                throw new IllegalStateException("종료된 재연결 감독자입니다");
            }
            if (state == ConnectionState.CONNECTED) {
                return;
            }
            cancelReconnect();
            attempts = 0;
            exhausted = false;
        }
        LOGGER.info("수동 재연결을 요청했습니다");
        attemptConnect();
    }

    int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    @Override
    public void onConnectionStateChanged(ConnectionState newState, Throwable cause) {
        switch (newState) {
            case CONNECTED -> handleConnected();
            case DISCONNECTED -> handleDisconnected(cause);
            case RECONNECTING -> LOGGER.debug("전송 계층이 재연결 중 상태를 보고했습니다");
        }
    }

    @Override
    public void channelFailed(String topic, TransportException error) {
        Duration delay;
        synchronized (lock) {
            if (stopped || state != ConnectionState.CONNECTED) {
                return;
            }
            ChannelRetry retry = channelRetries.computeIfAbsent(topic, key -> new ChannelRetry());
            if (retry.attempts >= settings.maxAttempts()) {
                channelRetries.remove(topic);
                delay = null;
            } else {
                retry.attempts++;
                delay = backoff.delayFor(retry.attempts);
                retry.cancel();
                retry.task = scheduler.schedule(() -> retryChannel(topic), delay);
                LOGGER.info("토픽 '{}' 채널 재구독을 {} ms 후 시도합니다 ({}/{})",
                        topic, delay.toMillis(), retry.attempts, settings.maxAttempts());
            }
        }
        if (delay == null) {
            LOGGER.warn("토픽 '{}' 채널 재구독 시도를 모두 소진했습니다", topic);
            registry.notifyDisconnected(topic);
        }
    }

    @Override
    public void channelRecovered(String topic) {
        synchronized (lock) {
            ChannelRetry retry = channelRetries.remove(topic);
            if (retry != null) {
                retry.cancel();
            }
        }
    }

    @Override
    public void channelClosed(String topic) {
        channelRecovered(topic);
    }

    private void retryChannel(String topic) {
        synchronized (lock) {
            ChannelRetry retry = channelRetries.get(topic);
            if (stopped || retry == null) {
                return;
            }
            retry.task = null;
        }
        registry.reopen(topic);
    }

    private void attemptConnect() {
        synchronized (lock) {
            if (stopped || state == ConnectionState.CONNECTED) {
                return;
            }
            reconnectTask = null;
        }
        try {
            transport.connect().whenComplete((ignored, error) -> {
                if (error == null) {
                    handleConnected();
                } else {
                    LOGGER.warn("실시간 전송 연결 실패: {}", error.getMessage());
                    scheduleReconnect();
                }
            });
        } catch (RuntimeException e) {
            LOGGER.warn("실시간 전송 연결 요청 중 오류", e);
            scheduleReconnect();
        }
    }

    private void handleConnected() {
        synchronized (lock) {
            if (stopped || state == ConnectionState.CONNECTED) {
                return;
            }
            cancelReconnect();
            attempts = 0;
            exhausted = false;
            channelRetries.values().forEach(ChannelRetry::cancel);
            channelRetries.clear();
            transitionState(ConnectionState.CONNECTED, "실시간 전송 연결이 정상화되었습니다");
        }
        registry.resubscribeAll();
    }

    private void handleDisconnected(Throwable cause) {
        synchronized (lock) {
            if (stopped || state != ConnectionState.CONNECTED) {
                return;
            }
            transitionState(ConnectionState.DISCONNECTED, "실시간 전송 연결이 끊어졌습니다");
            if (cause != null) {
                LOGGER.warn("연결 끊김 원인: {}", cause.toString());
            }
            channelRetries.values().forEach(ChannelRetry::cancel);
            channelRetries.clear();
        }
        registry.markReconnecting();
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        boolean notify = false;
        synchronized (lock) {
            if (stopped || state == ConnectionState.CONNECTED || reconnectTask != null) {
                return;
            }
            if (attempts >= settings.maxAttempts()) {
                if (!exhausted) {
                    exhausted = true;
                    notify = true;
                    transitionState(ConnectionState.DISCONNECTED, "재연결 시도를 모두 소진했습니다");
                }
                Duration idleDelay = settings.maxDelay().isZero() ? Duration.ofSeconds(1) : settings.maxDelay();
                LOGGER.debug("{} ms 후 연결 상태를 다시 확인합니다", idleDelay.toMillis());
                reconnectTask = scheduler.schedule(this::attemptConnect, idleDelay);
            } else {
                attempts++;
                Duration delay = backoff.delayFor(attempts);
                transitionState(ConnectionState.RECONNECTING, "실시간 전송 재연결을 준비합니다");
                LOGGER.info("{} ms 후 재연결을 시도합니다 ({}/{})", delay.toMillis(), attempts, settings.maxAttempts());
                reconnectTask = scheduler.schedule(this::attemptConnect, delay);
            }
        }
        if (notify) {
            registry.notifyDisconnected();
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    private void transitionState(ConnectionState newState, String message) {
        ConnectionState previous = state;
        state = newState;
        if (previous == newState) {
            return;
        }
        switch (newState) {
            case CONNECTED, RECONNECTING -> LOGGER.info("{}", message);
            case DISCONNECTED -> LOGGER.warn("{}", message);
        }
    }

    private static final class ChannelRetry {

        private int attempts;
        private ScheduledTask task;

        private void cancel() {
            if (task != null) {
                task.cancel();
                task = null;
            }
        }
    }
}
