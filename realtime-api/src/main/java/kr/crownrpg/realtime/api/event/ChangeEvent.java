package kr.crownrpg.realtime.api.event;

import kr.crownrpg.realtime.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transient row-change notification for a topic.
 * <p>
 * Delivery is at-least-once: the same {@code INSERT} may be seen again after a reconnect, so consumers should
 * apply changes as keyed upserts.
 */
public record ChangeEvent(
        String topic,
        String table,
        ChangeOperation operation,
        Map<String, Object> before,
        Map<String, Object> after,
        Instant receivedAt
) {

    public ChangeEvent {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotNull(operation, "operation");
        table = table == null ? "" : table;
        before = copy(before);
        after = copy(after);
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
    }

    /**
     * Row image relevant for filtering: {@link #after()} for inserts and updates, {@link #before()} for deletes.
     */
    public Map<String, Object> row() {
        return operation == ChangeOperation.DELETE ? before : after;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        // row images may legitimately contain null columns, which Map.copyOf rejects
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
