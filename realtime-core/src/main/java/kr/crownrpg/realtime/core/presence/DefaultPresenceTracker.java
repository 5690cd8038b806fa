package kr.crownrpg.realtime.core.presence;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.presence.PresenceEntry;
import kr.crownrpg.realtime.api.presence.PresenceMessage;
import kr.crownrpg.realtime.api.presence.PresenceTracker;
import kr.crownrpg.realtime.api.presence.PresenceView;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.core.scheduler.ScheduledTask;
import kr.crownrpg.realtime.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Presence tracking bound to the channels opened by the registry.
 * <p>
 * The registry calls {@link #attach} when a transport channel is opened for a topic, {@link #onSubscribed}
 * when the server confirms it and {@link #discard} on teardown. Heartbeats republish self presence at the
 * configured interval; stale peers are pruned lazily on read.
 */
public final class DefaultPresenceTracker implements PresenceTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultPresenceTracker.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final PresenceSettings settings;
    private final Map<String, TopicPresence> topics = new ConcurrentHashMap<>();

    public DefaultPresenceTracker(TaskScheduler scheduler, Clock clock, PresenceSettings settings) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public PresenceView track(String topic, Map<String, Object> selfMetadata) {
        Preconditions.checkNotBlank(topic, "topic");
        TopicPresence presence = topics.get(topic);
        if (presence == null) {
            throw new IllegalStateException("열린 채널이 없는 토픽은 추적할 수 없습니다: " + topic);
        }
        presence.startTracking(selfMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(selfMetadata)));
        return presence.view;
    }

    @Override
    public void untrack(String topic) {
        TopicPresence presence = topics.get(topic);
        if (presence != null) {
            presence.stopTracking(true);
        }
    }

    @Override
    public boolean isTracking(String topic) {
        TopicPresence presence = topics.get(topic);
        return presence != null && presence.isTracking();
    }

    @Override
    public List<PresenceEntry> presence(String topic) {
        TopicPresence presence = topics.get(topic);
        return presence == null ? List.of() : presence.peers();
    }

    /**
     * Makes the topic trackable before a transport channel exists, so self tracking survives a failed
     * channel creation and is published once a later bind is confirmed.
     */
    public void register(String topic) {
        topics.computeIfAbsent(topic, TopicPresence::new);
    }

    /**
     * Binds a freshly opened transport channel. A rebind after reconnect starts a new presence epoch while
     * keeping self tracking, which is republished on the next {@link #onSubscribed}.
     */
    public void attach(String topic, TransportChannel channel) {
        Objects.requireNonNull(channel, "channel");
        TopicPresence presence = topics.computeIfAbsent(topic, TopicPresence::new);
        presence.bind(channel);
        channel.onPresence(message -> presence.apply(channel, message));
    }

    public void onSubscribed(String topic) {
        TopicPresence presence = topics.get(topic);
        if (presence != null) {
            presence.subscribed();
        }
    }

    /**
     * Marks the topic's channel as not subscribed; heartbeats are skipped until the next confirmation.
     */
    public void onUnsubscribed(String topic) {
        TopicPresence presence = topics.get(topic);
        if (presence != null) {
            presence.unsubscribed();
        }
    }

    /**
     * Cancels the heartbeat, withdraws self presence and forgets all state of the topic.
     */
    public void discard(String topic) {
        TopicPresence presence = topics.remove(topic);
        if (presence != null) {
            presence.discard();
        }
    }

    private final class TopicPresence {

        private final String topic;
        private final PresenceState state;
        private final DefaultPresenceView view;
        private final List<Consumer<List<PresenceEntry>>> listeners = new CopyOnWriteArrayList<>();

        private TransportChannel channel;
        private boolean subscribed;
        private Map<String, Object> selfMetadata;
        private ScheduledTask heartbeat;

        private TopicPresence(String topic) {
            this.topic = topic;
            this.state = new PresenceState(topic);
            this.view = new DefaultPresenceView(topic, this::peers, listeners);
        }

        private synchronized void bind(TransportChannel channel) {
            boolean rebind = this.channel != null;
            this.channel = channel;
            this.subscribed = false;
            state.reset();
            if (rebind) {
                LOGGER.debug("토픽 '{}' presence 를 새 채널에 다시 연결했습니다", topic);
            }
        }

        private void apply(TransportChannel source, PresenceMessage message) {
            List<PresenceEntry> snapshot;
            synchronized (this) {
                if (channel != source) {
                    return;
                }
                state.apply(message);
                snapshot = state.prune(clock.instant(), settings.timeout());
            }
            for (Consumer<List<PresenceEntry>> listener : listeners) {
                try {
                    listener.accept(snapshot);
                } catch (RuntimeException e) {
                    LOGGER.warn("토픽 '{}' presence 리스너 실행 중 오류", topic, e);
                }
            }
        }

        private synchronized List<PresenceEntry> peers() {
            return state.prune(clock.instant(), settings.timeout());
        }

        private synchronized boolean isTracking() {
            return selfMetadata != null;
        }

        private synchronized void startTracking(Map<String, Object> metadata) {
            this.selfMetadata = metadata;
            if (subscribed) {
                publish();
            }
            if (heartbeat == null) {
                Duration interval = settings.heartbeatInterval();
                heartbeat = scheduler.scheduleAtFixedRate(this::beat, interval, interval);
            }
        }

        private synchronized void subscribed() {
            subscribed = true;
            if (selfMetadata != null) {
                publish();
            }
        }

        private synchronized void unsubscribed() {
            subscribed = false;
        }

        private synchronized void beat() {
            if (selfMetadata != null && subscribed) {
                publish();
            }
        }

        private void publish() {
            try {
                channel.track(selfMetadata);
            } catch (RuntimeException e) {
                LOGGER.warn("토픽 '{}' presence 발행 실패", topic, e);
            }
        }

        private synchronized void stopTracking(boolean withdraw) {
            if (heartbeat != null) {
                heartbeat.cancel();
                heartbeat = null;
            }
            boolean wasTracking = selfMetadata != null;
            selfMetadata = null;
            if (withdraw && wasTracking && channel != null) {
                try {
                    channel.untrack();
                } catch (RuntimeException e) {
                    LOGGER.warn("토픽 '{}' presence 철회 실패", topic, e);
                }
            }
        }

        private synchronized void discard() {
            stopTracking(subscribed);
            channel = null;
            subscribed = false;
            state.reset();
            listeners.clear();
        }
    }
}
