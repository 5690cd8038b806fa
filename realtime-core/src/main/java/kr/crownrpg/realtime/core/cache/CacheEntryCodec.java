package kr.crownrpg.realtime.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Cache entry <-> JSON 문서 변환만 담당.
 * <pre>{"data": ..., "timestamp": epochMillis, "ttl": millis}</pre>
 */
final class CacheEntryCodec {

    static final String DATA = "data";
    static final String TIMESTAMP = "timestamp";
    static final String TTL = "ttl";

    private final ObjectMapper mapper;

    CacheEntryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(Object value, long timestampMillis, long ttlMillis) {
        ObjectNode document = mapper.createObjectNode();
        document.set(DATA, mapper.valueToTree(value));
        document.put(TIMESTAMP, timestampMillis);
        document.put(TTL, ttlMillis);
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode cache entry", e);
        }
    }

    /**
     * @throws CorruptEntryException if the document is not a well formed cache entry
     */
    StoredEntry decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CorruptEntryException("Malformed cache document: " + safe(json), e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptEntryException("Cache document is not an object: " + safe(json), null);
        }
        JsonNode timestamp = root.get(TIMESTAMP);
        JsonNode ttl = root.get(TTL);
        if (timestamp == null || !timestamp.canConvertToLong() || ttl == null || !ttl.canConvertToLong()) {
            throw new CorruptEntryException("Cache document without timestamp/ttl: " + safe(json), null);
        }
        return new StoredEntry(root.get(DATA), timestamp.asLong(), ttl.asLong());
    }

    <T> T convert(StoredEntry entry, Class<T> type) {
        if (entry.data() == null || entry.data().isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(entry.data(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptEntryException("Cache data does not match " + type.getName(), e);
        }
    }

    private static String safe(String s) {
        if (s == null) return "null";
        if (s.length() <= 200) return s;
        return s.substring(0, 200) + "...(truncated)";
    }

    record StoredEntry(JsonNode data, long timestampMillis, long ttlMillis) {

        boolean isValidAt(long nowMillis) {
            return nowMillis - timestampMillis < ttlMillis;
        }
    }

    static final class CorruptEntryException extends RuntimeException {

        CorruptEntryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
