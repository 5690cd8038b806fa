package kr.crownrpg.realtime.api.transport;

import kr.crownrpg.realtime.api.event.BroadcastMessage;
import kr.crownrpg.realtime.api.event.ChangeEvent;
import kr.crownrpg.realtime.api.presence.PresenceMessage;

import java.util.Map;
import java.util.function.Consumer;

/**
 * One topic multiplexed over the shared transport connection.
 * <p>
 * Listener callbacks may arrive on transport threads; implementations must not block them.
 */
public interface TransportChannel {

    String topic();

    void onChange(Consumer<ChangeEvent> listener);

    void onBroadcast(Consumer<BroadcastMessage> listener);

    void onPresence(Consumer<PresenceMessage> listener);

    /**
     * 서버 측 구독을 시작하고 결과를 콜백으로 통지한다.
     */
    void subscribe(ChannelStatusListener statusListener);

    /**
     * Publishes this client's presence. Repeated calls act as heartbeats.
     */
    void track(Map<String, Object> metadata);

    void untrack();

    /**
     * Fire-and-forget broadcast. Implementations may throw; callers are expected to swallow.
     */
    void send(BroadcastMessage message);
}
