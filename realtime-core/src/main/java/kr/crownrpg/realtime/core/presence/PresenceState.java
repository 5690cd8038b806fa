package kr.crownrpg.realtime.core.presence;

import kr.crownrpg.realtime.api.presence.PresenceEntry;
import kr.crownrpg.realtime.api.presence.PresenceMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged peer set of one topic within one epoch.
 * <p>
 * Join and heartbeat upsert by peerId keeping the newest heartbeat. Leave removes the peer and leaves a
 * tombstone at the leave time, so a join that is not newer than the leave is ignored whatever the arrival
 * order. A sync message or {@link #reset()} starts a new epoch.
 * <p>
 * Staleness is judged against the local receipt time of the newest accepted message for a peer, not the
 * sender's heartbeat timestamp, so peers with skewed clocks age at the local rate. The heartbeat timestamp
 * still orders joins against leaves. Not thread safe.
 */
final class PresenceState {

    private final String topic;
    private final Map<String, PresenceEntry> peers = new LinkedHashMap<>();
    private final Map<String, Instant> tombstones = new HashMap<>();
    private final Map<String, Instant> lastSeen = new HashMap<>();

    PresenceState(String topic) {
        this.topic = topic;
    }

    void apply(PresenceMessage message) {
        switch (message.type()) {
            case SYNC -> sync(message);
            case JOIN, HEARTBEAT -> {
                for (Map<String, Object> raw : message.presences()) {
                    PresencePayloads.parse(topic, raw, message.receivedAt())
                            .ifPresent(entry -> upsert(entry, message.receivedAt()));
                }
            }
            case LEAVE -> {
                for (Map<String, Object> raw : message.presences()) {
                    PresencePayloads.parse(topic, raw, message.receivedAt()).ifPresent(this::leave);
                }
            }
        }
    }

    /**
     * Drops peers last heard from outside the window ending at {@code now} and returns the rest by peerId.
     */
    List<PresenceEntry> prune(Instant now, Duration timeout) {
        Iterator<PresenceEntry> it = peers.values().iterator();
        while (it.hasNext()) {
            PresenceEntry entry = it.next();
            Instant seen = lastSeen.getOrDefault(entry.peerId(), entry.lastHeartbeatAt());
            if (!seen.plus(timeout).isAfter(now)) {
                it.remove();
                lastSeen.remove(entry.peerId());
            }
        }
        List<PresenceEntry> result = new ArrayList<>(peers.values());
        result.sort(Comparator.comparing(PresenceEntry::peerId));
        return result;
    }

    void reset() {
        peers.clear();
        tombstones.clear();
        lastSeen.clear();
    }

    private void sync(PresenceMessage message) {
        reset();
        for (Map<String, Object> raw : message.presences()) {
            PresencePayloads.parse(topic, raw, message.receivedAt())
                    .ifPresent(entry -> upsert(entry, message.receivedAt()));
        }
    }

    private void upsert(PresenceEntry incoming, Instant receivedAt) {
        Instant leftAt = tombstones.get(incoming.peerId());
        if (leftAt != null) {
            if (!incoming.lastHeartbeatAt().isAfter(leftAt)) {
                return;
            }
            tombstones.remove(incoming.peerId());
        }
        peers.merge(incoming.peerId(), incoming,
                (current, next) -> next.lastHeartbeatAt().isBefore(current.lastHeartbeatAt()) ? current : next);
        lastSeen.merge(incoming.peerId(), receivedAt, (a, b) -> a.isAfter(b) ? a : b);
    }

    private void leave(PresenceEntry leaving) {
        Instant leftAt = leaving.lastHeartbeatAt();
        tombstones.merge(leaving.peerId(), leftAt, (a, b) -> a.isAfter(b) ? a : b);
        PresenceEntry current = peers.get(leaving.peerId());
        if (current != null && !current.lastHeartbeatAt().isAfter(leftAt)) {
            peers.remove(leaving.peerId());
            lastSeen.remove(leaving.peerId());
        }
    }
}
