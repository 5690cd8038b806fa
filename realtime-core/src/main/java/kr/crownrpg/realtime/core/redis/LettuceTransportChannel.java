package kr.crownrpg.realtime.core.redis;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.event.BroadcastMessage;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.presence.PresenceEventType;
import kr.crownrpg.realtime.api.presence.PresenceMessage;
import kr.crownrpg.realtime.api.transport.ChannelStatusListener;
import kr.crownrpg.realtime.api.transport.SubscribeStatus;
import kr.crownrpg.realtime.api.transport.TransportChannel;
import kr.crownrpg.realtime.api.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One topic on the shared Redis Pub/Sub connection.
 */
final class LettuceTransportChannel implements TransportChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(LettuceTransportChannel.class);

    private final LettuceRealtimeTransport transport;
    private final String topic;
    private final String redisChannel;

    private final List<Consumer<ChangeEvent>> changeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<BroadcastMessage>> broadcastListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PresenceMessage>> presenceListeners = new CopyOnWriteArrayList<>();

    private volatile boolean tracked;

    LettuceTransportChannel(LettuceRealtimeTransport transport, String topic, String redisChannel) {
        this.transport = transport;
        this.topic = topic;
        this.redisChannel = redisChannel;
    }

    @Override
    public String topic() {
        return topic;
    }

    String redisChannel() {
        return redisChannel;
    }

    @Override
    public void onChange(Consumer<ChangeEvent> listener) {
        changeListeners.add(Preconditions.checkNotNull(listener, "listener"));
    }

    @Override
    public void onBroadcast(Consumer<BroadcastMessage> listener) {
        broadcastListeners.add(Preconditions.checkNotNull(listener, "listener"));
    }

    @Override
    public void onPresence(Consumer<PresenceMessage> listener) {
        presenceListeners.add(Preconditions.checkNotNull(listener, "listener"));
    }

    @Override
    public void subscribe(ChannelStatusListener statusListener) {
        Preconditions.checkNotNull(statusListener, "statusListener");
        transport.subscribe(this).whenComplete((ignored, error) -> {
            if (error == null) {
                statusListener.onStatus(SubscribeStatus.SUBSCRIBED, null);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            SubscribeStatus status = cause instanceof TimeoutException ? SubscribeStatus.TIMED_OUT : SubscribeStatus.CHANNEL_ERROR;
            LOGGER.debug("채널 '{}' 구독 실패 ({})", redisChannel, status, cause);
            statusListener.onStatus(status, cause);
        });
    }

    @Override
    public void track(Map<String, Object> metadata) {
        PresenceEventType type = tracked ? PresenceEventType.HEARTBEAT : PresenceEventType.JOIN;
        publishPresence(type, metadata);
        tracked = true;
    }

    @Override
    public void untrack() {
        if (!tracked) {
            return;
        }
        tracked = false;
        publishPresence(PresenceEventType.LEAVE, null);
    }

    @Override
    public void send(BroadcastMessage message) {
        Preconditions.checkNotNull(message, "message");
        if (!topic.equals(message.topic())) {
            throw new TransportException(topic, "다른 토픽의 메시지입니다: " + message.topic(), null);
        }
        transport.publish(this, TransportEnvelope.KIND_BROADCAST, message.eventName(), null, message.payload());
    }

    void deliverChange(ChangeEvent event) {
        deliver(changeListeners, event);
    }

    void deliverBroadcast(BroadcastMessage message) {
        deliver(broadcastListeners, message);
    }

    void deliverPresence(PresenceMessage message) {
        deliver(presenceListeners, message);
    }

    private void publishPresence(PresenceEventType type, Map<String, Object> metadata) {
        Map<String, Object> self = new LinkedHashMap<>();
        self.put(PresenceMessage.PEER_ID, transport.context().clientId());
        if (metadata != null) {
            self.put(PresenceMessage.METADATA, metadata);
        }
        self.put(PresenceMessage.HEARTBEAT_AT, transport.now().toEpochMilli());
        transport.publish(this, TransportEnvelope.KIND_PRESENCE, type.name().toLowerCase(Locale.ROOT), null,
                Map.of(TransportEnvelope.PRESENCES, List.of(self)));
    }

    private <T> void deliver(List<Consumer<T>> listeners, T value) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                LOGGER.warn("채널 '{}' 리스너 실행 중 오류", redisChannel, e);
            }
        }
    }
}
