package kr.crownrpg.realtime.core.channel;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.channel.ChannelRegistry;
import kr.crownrpg.realtime.api.channel.ChannelSnapshot;
import kr.crownrpg.realtime.api.channel.ChannelState;
import kr.crownrpg.realtime.api.channel.ChannelSubscriber;
import kr.crownrpg.realtime.api.channel.SubscriberHandle;
import kr.crownrpg.realtime.api.channel.SubscriptionStatus;
import kr.crownrpg.realtime.api.topic.Topics;
import kr.crownrpg.realtime.api.transport.RealtimeTransport;
import kr.crownrpg.realtime.api.transport.SubscribeStatus;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.api.transport.TransportException;
import kr.crownrpg.realtime.core.event.DefaultEventStream;
import kr.crownrpg.realtime.core.presence.DefaultPresenceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reference counted topic to channel registry over one shared {@link RealtimeTransport}.
 * <p>
 * Every mutation runs under a single lock. Subscriber and recovery callbacks are queued while the lock is held
 * and delivered after it is released, in the order they were produced. Handles are referenced only weakly;
 * a handle collected without being closed is released with a warning on the next mutation.
 */
public final class DefaultChannelRegistry implements ChannelRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultChannelRegistry.class);

    private final RealtimeTransport transport;
    private final DefaultEventStream eventStream;
    private final DefaultPresenceTracker presenceTracker;

    private final Object lock = new Object();
    private final Map<String, ManagedChannel> channels = new HashMap<>();
    private final ReferenceQueue<DefaultSubscriberHandle> collectedHandles = new ReferenceQueue<>();
    private long nextGeneration = 1L;
    private long nextHandleId = 1L;

    private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private volatile ChannelRecovery recovery = ChannelRecovery.NONE;

    public DefaultChannelRegistry(RealtimeTransport transport, DefaultEventStream eventStream, DefaultPresenceTracker presenceTracker) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eventStream = Objects.requireNonNull(eventStream, "eventStream");
        this.presenceTracker = Objects.requireNonNull(presenceTracker, "presenceTracker");
    }

    public void setRecovery(ChannelRecovery recovery) {
        this.recovery = recovery == null ? ChannelRecovery.NONE : recovery;
    }

    @Override
    public SubscriberHandle subscribe(String topic, ChannelSubscriber subscriber) {
        Topics.validate(topic);
        ChannelSubscriber target = subscriber == null ? ChannelSubscriber.NOOP : subscriber;
        DefaultSubscriberHandle handle;
        synchronized (lock) {
            expungeCollectedHandles();
            ManagedChannel channel = channels.get(topic);
            boolean created = channel == null;
            if (created) {
                channel = new ManagedChannel(topic, nextGeneration++);
                channels.put(topic, channel);
            }
            handle = new DefaultSubscriberHandle(this, topic, channel.generation, nextHandleId++);
            channel.handles.put(handle.id(), new HandleReference(handle, target, collectedHandles));
            if (created) {
                open(channel);
            } else if (channel.state == ChannelState.SUBSCRIBED) {
                enqueueStatus(topic, target, SubscriptionStatus.SUBSCRIBED);
            } else if (channel.state == ChannelState.RECONNECTING) {
                enqueueStatus(topic, target, channel.disconnected
                        ? SubscriptionStatus.DISCONNECTED
                        : SubscriptionStatus.RECONNECTING);
            }
            LOGGER.debug("토픽 '{}' 구독 추가 (refCount={})", topic, channel.refCount());
        }
        drainNotifications();
        return handle;
    }

    @Override
    public boolean unsubscribe(SubscriberHandle handle) {
        Preconditions.checkNotNull(handle, "handle");
        if (!(handle instanceof DefaultSubscriberHandle own) || own.registry() != this) {
            throw new IllegalArgumentException("이 레지스트리에서 발급하지 않은 핸들입니다: " + handle);
        }
        if (!own.markReleased()) {
            return false;
        }
        synchronized (lock) {
            expungeCollectedHandles();
            ManagedChannel channel = channels.get(own.topic());
            if (channel != null && channel.generation == own.generation()) {
                HandleReference ref = channel.handles.remove(own.id());
                if (ref != null) {
                    ref.clear();
                }
                LOGGER.debug("토픽 '{}' 구독 해제 (refCount={})", own.topic(), channel.refCount());
                if (channel.handles.isEmpty()) {
                    teardown(channel);
                }
            }
        }
        drainNotifications();
        return true;
    }

    @Override
    public Optional<ChannelSnapshot> snapshot(String topic) {
        synchronized (lock) {
            ManagedChannel channel = channels.get(topic);
            return channel == null ? Optional.empty() : Optional.of(channel.snapshot());
        }
    }

    @Override
    public Set<String> activeTopics() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new TreeSet<>(channels.keySet()));
        }
    }

    @Override
    public void closeAll() {
        synchronized (lock) {
            for (ManagedChannel channel : new ArrayList<>(channels.values())) {
                teardown(channel);
            }
        }
        drainNotifications();
    }

    /**
     * Moves every open channel to RECONNECTING after the shared connection dropped.
     */
    public void markReconnecting() {
        synchronized (lock) {
            for (ManagedChannel channel : channels.values()) {
                if (channel.state == ChannelState.SUBSCRIBING || channel.state == ChannelState.SUBSCRIBED) {
                    channel.state = ChannelState.RECONNECTING;
                    channel.disconnected = false;
                    presenceTracker.onUnsubscribed(channel.topic);
                    enqueueStatusToAll(channel, SubscriptionStatus.RECONNECTING);
                }
            }
        }
        drainNotifications();
    }

    /**
     * Re-opens every channel that is not confirmed on a fresh transport channel, keeping identity and subscribers.
     *
     * @return number of channels re-opened
     */
    public int resubscribeAll() {
        int count = 0;
        synchronized (lock) {
            for (ManagedChannel channel : new ArrayList<>(channels.values())) {
                if (channel.state == ChannelState.SUBSCRIBING || channel.state == ChannelState.RECONNECTING) {
                    rebind(channel);
                    count++;
                }
            }
        }
        drainNotifications();
        if (count > 0) {
            LOGGER.info("채널 {}개 재구독을 요청했습니다", count);
        }
        return count;
    }

    /**
     * Re-opens a single channel that is waiting in RECONNECTING.
     *
     * @return {@code false} if the topic is gone or not waiting for a retry
     */
    public boolean reopen(String topic) {
        boolean reopened = false;
        synchronized (lock) {
            ManagedChannel channel = channels.get(topic);
            if (channel != null && channel.state == ChannelState.RECONNECTING) {
                rebind(channel);
                reopened = true;
            }
        }
        drainNotifications();
        return reopened;
    }

    /**
     * Tells subscribers of every channel still waiting in RECONNECTING that retries are exhausted.
     */
    public void notifyDisconnected() {
        synchronized (lock) {
            for (ManagedChannel channel : channels.values()) {
                if (channel.state == ChannelState.RECONNECTING) {
                    channel.disconnected = true;
                    enqueueStatusToAll(channel, SubscriptionStatus.DISCONNECTED);
                }
            }
        }
        drainNotifications();
    }

    public void notifyDisconnected(String topic) {
        synchronized (lock) {
            ManagedChannel channel = channels.get(topic);
            if (channel != null && channel.state == ChannelState.RECONNECTING) {
                channel.disconnected = true;
                enqueueStatusToAll(channel, SubscriptionStatus.DISCONNECTED);
            }
        }
        drainNotifications();
    }

    private void open(ManagedChannel channel) {
        channel.state = ChannelState.SUBSCRIBING;
        LOGGER.info("토픽 '{}' 채널을 엽니다 (generation {})", channel.topic, channel.generation);
        bind(channel);
    }

    private void rebind(ManagedChannel channel) {
        releaseTransportChannel(channel);
        if (channel.state != ChannelState.RECONNECTING) {
            channel.state = ChannelState.RECONNECTING;
            presenceTracker.onUnsubscribed(channel.topic);
        }
        bind(channel);
    }

    private void bind(ManagedChannel channel) {
        String topic = channel.topic;
        long generation = channel.generation;
        presenceTracker.register(topic);
        TransportChannel transportChannel;
        try {
            transportChannel = transport.channel(topic);
        } catch (RuntimeException e) {
            failed(channel, new TransportException(topic, "전송 채널 생성 실패: " + topic, e));
            return;
        }
        channel.transportChannel = transportChannel;
        eventStream.attach(topic, transportChannel);
        presenceTracker.attach(topic, transportChannel);
        try {
            transportChannel.subscribe((status, cause) -> onSubscribeStatus(topic, generation, transportChannel, status, cause));
        } catch (RuntimeException e) {
            failed(channel, new TransportException(topic, "채널 구독 요청 실패: " + topic, e));
        }
    }

    private void onSubscribeStatus(String topic, long generation, TransportChannel source, SubscribeStatus status, Throwable cause) {
        synchronized (lock) {
            ManagedChannel channel = channels.get(topic);
            if (channel == null || channel.generation != generation || channel.transportChannel != source) {
                LOGGER.debug("지난 채널의 상태 통지를 무시합니다: 토픽 '{}' {}", topic, status);
                return;
            }
            switch (status) {
                case SUBSCRIBED -> {
                    boolean recovered = channel.state == ChannelState.RECONNECTING;
                    channel.state = ChannelState.SUBSCRIBED;
                    channel.disconnected = false;
                    presenceTracker.onSubscribed(topic);
                    enqueueStatusToAll(channel, SubscriptionStatus.SUBSCRIBED);
                    ChannelRecovery target = recovery;
                    pending.add(() -> target.channelRecovered(topic));
                    if (recovered) {
                        LOGGER.info("토픽 '{}' 채널이 복구되었습니다", topic);
                    } else {
                        LOGGER.debug("토픽 '{}' 채널 구독 완료", topic);
                    }
                }
                case CHANNEL_ERROR, TIMED_OUT -> failed(channel,
                        new TransportException(topic, "채널 구독 실패 (" + status + "): " + topic, cause));
                case CLOSED -> {
                    if (channel.state.isOpen()) {
                        failed(channel, new TransportException(topic, "서버가 채널을 닫았습니다: " + topic, cause));
                    }
                }
            }
        }
        drainNotifications();
    }

    private void failed(ManagedChannel channel, TransportException error) {
        channel.state = ChannelState.RECONNECTING;
        channel.disconnected = false;
        presenceTracker.onUnsubscribed(channel.topic);
        LOGGER.warn("토픽 '{}' 채널 오류, 재시도를 기다립니다: {}", channel.topic, error.getMessage());
        for (HandleReference ref : channel.handles.values()) {
            ChannelSubscriber subscriber = ref.subscriber;
            pending.add(() -> subscriber.onError(channel.topic, error));
            enqueueStatus(channel.topic, subscriber, SubscriptionStatus.RECONNECTING);
        }
        ChannelRecovery target = recovery;
        pending.add(() -> target.channelFailed(channel.topic, error));
    }

    private void teardown(ManagedChannel channel) {
        String topic = channel.topic;
        channel.state = ChannelState.UNSUBSCRIBING;
        channels.remove(topic);
        eventStream.detach(topic);
        presenceTracker.discard(topic);
        releaseTransportChannel(channel);
        channel.state = ChannelState.CLOSED;

        for (HandleReference ref : channel.handleRefs()) {
            DefaultSubscriberHandle handle = ref.get();
            if (handle != null) {
                handle.markReleased();
            }
            ref.clear();
            enqueueStatus(topic, ref.subscriber, SubscriptionStatus.CLOSED);
        }
        channel.handles.clear();

        ChannelRecovery target = recovery;
        pending.add(() -> target.channelClosed(topic));
        LOGGER.info("토픽 '{}' 채널을 닫았습니다 (generation {})", topic, channel.generation);
    }

    private void releaseTransportChannel(ManagedChannel channel) {
        TransportChannel transportChannel = channel.transportChannel;
        channel.transportChannel = null;
        if (transportChannel == null) {
            return;
        }
        try {
            transport.removeChannel(transportChannel);
        } catch (RuntimeException e) {
            LOGGER.warn("토픽 '{}' 전송 채널 해제 실패", channel.topic, e);
        }
    }

    private void expungeCollectedHandles() {
        Reference<? extends DefaultSubscriberHandle> collected;
        while ((collected = collectedHandles.poll()) != null) {
            HandleReference ref = (HandleReference) collected;
            ManagedChannel channel = channels.get(ref.topic);
            if (channel == null || channel.generation != ref.generation) {
                continue;
            }
            if (channel.handles.remove(ref.id, ref)) {
                LOGGER.warn("닫히지 않은 구독 핸들이 수거되어 해제합니다: 토픽 '{}' (handle #{})", ref.topic, ref.id);
                if (channel.handles.isEmpty()) {
                    teardown(channel);
                }
            }
        }
    }

    private void enqueueStatusToAll(ManagedChannel channel, SubscriptionStatus status) {
        for (HandleReference ref : channel.handles.values()) {
            enqueueStatus(channel.topic, ref.subscriber, status);
        }
    }

    private void enqueueStatus(String topic, ChannelSubscriber subscriber, SubscriptionStatus status) {
        pending.add(() -> subscriber.onStatus(topic, status));
    }

    private void drainNotifications() {
        if (Thread.holdsLock(lock)) {
            return;
        }
        while (draining.compareAndSet(false, true)) {
            try {
                Runnable notification;
                while ((notification = pending.poll()) != null) {
                    try {
                        notification.run();
                    } catch (RuntimeException e) {
                        LOGGER.warn("채널 구독자 콜백 실행 중 오류", e);
                    }
                }
            } finally {
                draining.set(false);
            }
            if (pending.isEmpty()) {
                return;
            }
        }
    }
}
