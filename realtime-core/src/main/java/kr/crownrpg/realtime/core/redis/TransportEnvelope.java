package kr.crownrpg.realtime.core.redis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON message published on a realtime Redis channel.
 *
 * @param kind  {@link #KIND_CHANGE}, {@link #KIND_BROADCAST} or {@link #KIND_PRESENCE}
 * @param event change operation, broadcast event name or presence event type
 * @param table changed table, change messages only
 */
public record TransportEnvelope(
        String environment,
        String fromClientId,
        String kind,
        String event,
        String table,
        Map<String, Object> payload,
        long sentAt
) {

    public static final String KIND_CHANGE = "change";
    public static final String KIND_BROADCAST = "broadcast";
    public static final String KIND_PRESENCE = "presence";

    public static final String BEFORE = "before";
    public static final String AFTER = "after";
    public static final String PRESENCES = "presences";

    public TransportEnvelope {
        payload = payload == null || payload.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
