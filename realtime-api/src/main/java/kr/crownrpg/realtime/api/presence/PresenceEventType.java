package kr.crownrpg.realtime.api.presence;

/**
 * Presence message kinds.
 * <ul>
 *     <li>{@link #SYNC}: authoritative snapshot replacing the current view.</li>
 *     <li>{@link #JOIN} / {@link #HEARTBEAT}: incremental upsert by peerId.</li>
 *     <li>{@link #LEAVE}: explicit removal by peerId.</li>
 * </ul>
 */
public enum PresenceEventType {
    SYNC,
    JOIN,
    HEARTBEAT,
    LEAVE;

    public static PresenceEventType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("presence event must not be blank");
        }
        for (PresenceEventType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown presence event: " + name);
    }
}
