package kr.crownrpg.realtime.api.presence;

import java.util.List;
import java.util.Map;

/**
 * 토픽별 presence 를 병합/유지하는 계약.
 * <p>
 * 하트비트는 채널과 같은 전송 연결 위에서 주기적으로 발행되며, 채널이 해제되면 함께 취소된다.
 * 하트비트가 타임아웃 안에 갱신되지 않은 피어는 다음 조회 시점에 제외된다.
 */
public interface PresenceTracker {

    /**
     * Starts publishing this client's presence on the topic's open channel.
     *
     * @throws IllegalStateException if no channel is open for the topic
     */
    PresenceView track(String topic, Map<String, Object> selfMetadata);

    /**
     * Stops heartbeats and withdraws self presence, keeping the channel and the merged view.
     */
    void untrack(String topic);

    boolean isTracking(String topic);

    /**
     * Current merged peer set; empty for topics without an open channel.
     */
    List<PresenceEntry> presence(String topic);
}
