package kr.crownrpg.realtime.core.presence;

import kr.crownrpg.realtime.api.presence.PresenceEntry;
import kr.crownrpg.realtime.api.presence.PresenceMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts raw presence maps into {@link PresenceEntry} values. Malformed peers are skipped with a warning.
 */
final class PresencePayloads {

    private static final Logger LOGGER = LoggerFactory.getLogger(PresencePayloads.class);

    private PresencePayloads() {
    }

    static Optional<PresenceEntry> parse(String topic, Map<String, Object> raw, Instant fallbackHeartbeat) {
        if (raw == null) {
            LOGGER.warn("토픽 '{}'의 presence 항목이 비어 있어 건너뜁니다", topic);
            return Optional.empty();
        }
        Object peerId = raw.get(PresenceMessage.PEER_ID);
        if (!(peerId instanceof CharSequence || peerId instanceof Number) || peerId.toString().isBlank()) {
            LOGGER.warn("토픽 '{}'의 presence 항목에 유효한 peerId 가 없어 건너뜁니다: {}", topic, raw);
            return Optional.empty();
        }

        Object metadata = raw.get(PresenceMessage.METADATA);
        if (metadata != null && !(metadata instanceof Map<?, ?>)) {
            LOGGER.warn("토픽 '{}'의 피어 '{}' metadata 형식이 잘못되어 건너뜁니다: {}", topic, peerId, metadata);
            return Optional.empty();
        }

        Instant heartbeatAt = parseInstant(raw.get(PresenceMessage.HEARTBEAT_AT), fallbackHeartbeat);
        if (heartbeatAt == null) {
            LOGGER.warn("토픽 '{}'의 피어 '{}' heartbeatAt 값을 해석할 수 없어 건너뜁니다: {}",
                    topic, peerId, raw.get(PresenceMessage.HEARTBEAT_AT));
            return Optional.empty();
        }
        return Optional.of(new PresenceEntry(peerId.toString(), toStringKeys((Map<?, ?>) metadata), heartbeatAt));
    }

    private static Instant parseInstant(Object value, Instant fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            try {
                return Instant.parse(s);
            } catch (DateTimeException e) {
                try {
                    return Instant.ofEpochMilli(Long.parseLong(s));
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private static Map<String, Object> toStringKeys(Map<?, ?> metadata) {
        if (metadata == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : metadata.entrySet()) {
            copy.put(String.valueOf(e.getKey()), e.getValue());
        }
        return copy;
    }
}
