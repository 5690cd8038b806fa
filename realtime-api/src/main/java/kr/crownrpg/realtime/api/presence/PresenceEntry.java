package kr.crownrpg.realtime.api.presence;

import kr.crownrpg.realtime.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One peer considered active on a topic.
 */
public record PresenceEntry(String peerId, Map<String, Object> metadata, Instant lastHeartbeatAt) {

    public PresenceEntry {
        Preconditions.checkNotBlank(peerId, "peerId");
        Preconditions.checkNotNull(lastHeartbeatAt, "lastHeartbeatAt");
        metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
