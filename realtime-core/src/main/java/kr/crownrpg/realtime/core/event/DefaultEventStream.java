package kr.crownrpg.realtime.core.event;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.event.BroadcastMessage;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.event.ChangeFilter;
import kr.crownrpg.realtime.api.event.EventStream;
import kr.crownrpg.realtime.api.event.ListenerRegistration;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.core.internal.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Push based event delivery per topic.
 * <p>
 * Events arriving from a transport channel are handed to a per-topic {@link SerialExecutor} over the shared
 * worker pool, so the transport thread never waits for listeners and per-topic arrival order is kept.
 * The registry binds and unbinds transport channels through {@link #attach} and {@link #detach}.
 */
public final class DefaultEventStream implements EventStream {

    /** Broadcast event name that matches every event of the topic. */
    public static final String ANY_EVENT = "*";

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultEventStream.class);

    private final Executor workers;
    private final EventStreamSettings settings;
    private final Map<String, TopicListeners> topics = new ConcurrentHashMap<>();
    private final AtomicLong droppedBroadcastCount = new AtomicLong(0);

    public DefaultEventStream(Executor workers, EventStreamSettings settings) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ListenerRegistration onChange(String topic, ChangeFilter filter, Consumer<ChangeEvent> callback) {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotNull(callback, "callback");
        ChangeFilter effective = filter == null ? ChangeFilter.all() : filter;
        TopicListeners listeners = listeners(topic);
        ChangeRegistration registration = new ChangeRegistration(listeners, effective, callback);
        listeners.changeListeners.add(registration);
        return registration;
    }

    @Override
    public ListenerRegistration onBroadcast(String topic, String eventName, Consumer<BroadcastMessage> callback) {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotBlank(eventName, "eventName");
        Preconditions.checkNotNull(callback, "callback");
        TopicListeners listeners = listeners(topic);
        BroadcastRegistration registration = new BroadcastRegistration(listeners, eventName, callback);
        listeners.broadcastListeners.add(registration);
        return registration;
    }

    @Override
    public void broadcast(String topic, String eventName, Map<String, Object> payload) {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotBlank(eventName, "eventName");
        TopicListeners listeners = topics.get(topic);
        TransportChannel channel = listeners == null ? null : listeners.channel;
        if (channel == null) {
            logDrop("열린 채널이 없어 브로드캐스트를 드롭합니다", topic, null);
            return;
        }
        try {
            channel.send(BroadcastMessage.of(topic, eventName, payload));
        } catch (RuntimeException e) {
            logDrop("브로드캐스트 전송 실패", topic, e);
        }
    }

    @Override
    public List<ChangeEvent> recentChanges(String topic) {
        TopicListeners listeners = topics.get(topic);
        if (listeners == null) {
            return List.of();
        }
        synchronized (listeners.history) {
            return List.copyOf(listeners.history);
        }
    }

    /**
     * Binds the topic's transport channel. Events from previously bound channels are ignored afterwards.
     */
    public void attach(String topic, TransportChannel channel) {
        Objects.requireNonNull(channel, "channel");
        TopicListeners listeners = listeners(topic);
        listeners.channel = channel;
        channel.onChange(event -> dispatchChange(channel, event));
        channel.onBroadcast(message -> dispatchBroadcast(channel, message));
    }

    /**
     * Drops every listener and the event history of the topic.
     */
    public void detach(String topic) {
        TopicListeners listeners = topics.remove(topic);
        if (listeners == null) {
            return;
        }
        listeners.channel = null;
        int count = 0;
        for (ChangeRegistration registration : listeners.changeListeners) {
            registration.active.set(false);
            count++;
        }
        for (BroadcastRegistration registration : listeners.broadcastListeners) {
            registration.active.set(false);
            count++;
        }
        listeners.changeListeners.clear();
        listeners.broadcastListeners.clear();
        synchronized (listeners.history) {
            listeners.history.clear();
        }
        LOGGER.debug("토픽 '{}'의 리스너 {}개를 해제했습니다", topic, count);
    }

    int listenerCount(String topic) {
        TopicListeners listeners = topics.get(topic);
        return listeners == null ? 0 : listeners.changeListeners.size() + listeners.broadcastListeners.size();
    }

    private TopicListeners listeners(String topic) {
        return topics.computeIfAbsent(topic, key -> new TopicListeners(key, new SerialExecutor(workers)));
    }

    private void dispatchChange(TransportChannel source, ChangeEvent event) {
        TopicListeners listeners = topics.get(event.topic());
        if (listeners == null || listeners.channel != source) {
            LOGGER.debug("해제된 채널에서 도착한 변경 이벤트를 무시합니다: {}", event.topic());
            return;
        }
        listeners.record(event, settings.historySize());
        listeners.serial.execute(() -> {
            for (ChangeRegistration registration : listeners.changeListeners) {
                if (!registration.active.get()) {
                    continue;
                }
                try {
                    if (registration.filter.matches(event)) {
                        registration.callback.accept(event);
                    }
                } catch (RuntimeException e) {
                    LOGGER.warn("토픽 '{}'의 변경 리스너 실행 중 오류", event.topic(), e);
                }
            }
        });
    }

    private void dispatchBroadcast(TransportChannel source, BroadcastMessage message) {
        TopicListeners listeners = topics.get(message.topic());
        if (listeners == null || listeners.channel != source) {
            LOGGER.debug("해제된 채널에서 도착한 브로드캐스트를 무시합니다: {}", message.topic());
            return;
        }
        listeners.serial.execute(() -> {
            for (BroadcastRegistration registration : listeners.broadcastListeners) {
                if (!registration.active.get() || !registration.accepts(message.eventName())) {
                    continue;
                }
                try {
                    registration.callback.accept(message);
                } catch (RuntimeException e) {
                    LOGGER.warn("토픽 '{}'의 브로드캐스트 리스너 실행 중 오류 (이벤트 {})", message.topic(), message.eventName(), e);
                }
            }
        });
    }

    private void logDrop(String reason, String topic, Exception cause) {
        long total = droppedBroadcastCount.incrementAndGet();
        if (total % settings.dropWarnThreshold() == 0) {
            LOGGER.warn("{}: 토픽 '{}' (누적 {}회)", reason, topic, total, cause);
        } else {
            LOGGER.debug("{}: 토픽 '{}' (누적 {}회)", reason, topic, total, cause);
        }
    }

    private static final class TopicListeners {

        private final String topic;
        private final SerialExecutor serial;
        private final List<ChangeRegistration> changeListeners = new CopyOnWriteArrayList<>();
        private final List<BroadcastRegistration> broadcastListeners = new CopyOnWriteArrayList<>();
        private final Deque<ChangeEvent> history = new ArrayDeque<>();
        private volatile TransportChannel channel;

        private TopicListeners(String topic, SerialExecutor serial) {
            this.topic = topic;
            this.serial = serial;
        }

        private void record(ChangeEvent event, int capacity) {
            if (capacity == 0) {
                return;
            }
            synchronized (history) {
                if (history.size() >= capacity) {
                    history.pollFirst();
                }
                history.addLast(event);
            }
        }
    }

    private abstract static class Registration implements ListenerRegistration {

        final TopicListeners owner;
        final AtomicBoolean active = new AtomicBoolean(true);

        Registration(TopicListeners owner) {
            this.owner = owner;
        }

        @Override
        public String topic() {
            return owner.topic;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                owner.changeListeners.remove(this);
                owner.broadcastListeners.remove(this);
            }
        }
    }

    private static final class ChangeRegistration extends Registration {

        private final ChangeFilter filter;
        private final Consumer<ChangeEvent> callback;

        private ChangeRegistration(TopicListeners owner, ChangeFilter filter, Consumer<ChangeEvent> callback) {
            super(owner);
            this.filter = filter;
            this.callback = callback;
        }
    }

    private static final class BroadcastRegistration extends Registration {

        private final String eventName;
        private final Consumer<BroadcastMessage> callback;

        private BroadcastRegistration(TopicListeners owner, String eventName, Consumer<BroadcastMessage> callback) {
            super(owner);
            this.eventName = eventName;
            this.callback = callback;
        }

        private boolean accepts(String name) {
            return ANY_EVENT.equals(eventName) || eventName.equals(name);
        }
    }
}
