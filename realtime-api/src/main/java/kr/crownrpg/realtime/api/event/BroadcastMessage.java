package kr.crownrpg.realtime.api.event;

import kr.crownrpg.realtime.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ephemeral, fire-and-forget message sent to every current subscriber of a topic.
 */
public record BroadcastMessage(String topic, String eventName, Map<String, Object> payload, Instant sentAt) {

    public BroadcastMessage {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotBlank(eventName, "eventName");
        payload = payload == null || payload.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        sentAt = sentAt == null ? Instant.now() : sentAt;
    }

    public static BroadcastMessage of(String topic, String eventName, Map<String, Object> payload) {
        return new BroadcastMessage(topic, eventName, payload, Instant.now());
    }
}
