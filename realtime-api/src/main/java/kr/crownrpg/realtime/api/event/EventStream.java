package kr.crownrpg.realtime.api.event;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Typed delivery of row-change and broadcast events per topic.
 * <p>
 * Delivery order per topic is the arrival order from the transport; there is no ordering across topics.
 * Listeners stay registered until closed or until the topic's channel is torn down.
 */
public interface EventStream {

    ListenerRegistration onChange(String topic, ChangeFilter filter, Consumer<ChangeEvent> callback);

    ListenerRegistration onBroadcast(String topic, String eventName, Consumer<BroadcastMessage> callback);

    /**
     * 브로드캐스트를 전송한다. 응답/재시도 없음 (best-effort). 실패는 로그만 남긴다.
     */
    void broadcast(String topic, String eventName, Map<String, Object> payload);

    /**
     * Most recent change events received on the topic's current channel, oldest first.
     */
    List<ChangeEvent> recentChanges(String topic);
}
