package kr.crownrpg.realtime.api.presence;

import kr.crownrpg.realtime.api.Preconditions;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Raw presence message as received from the transport.
 * <p>
 * Each element of {@code presences} is an unvalidated map with the keys {@link #PEER_ID}, {@link #METADATA}
 * and {@link #HEARTBEAT_AT}. Validation happens during the merge so that one malformed peer does not reject the
 * whole message.
 */
public record PresenceMessage(String topic, PresenceEventType type, List<Map<String, Object>> presences, Instant receivedAt) {

    /** Peer identifier, non-blank string. */
    public static final String PEER_ID = "peerId";

    /** Opaque peer metadata, must be a map when present. */
    public static final String METADATA = "metadata";

    /** Heartbeat time as epoch millis or ISO-8601 string; defaults to {@code receivedAt}. */
    public static final String HEARTBEAT_AT = "heartbeatAt";

    public PresenceMessage {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotNull(type, "type");
        presences = presences == null ? List.of() : List.copyOf(presences);
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
    }
}
