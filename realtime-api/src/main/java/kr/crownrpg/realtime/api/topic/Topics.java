package kr.crownrpg.realtime.api.topic;

import kr.crownrpg.realtime.api.Preconditions;

/**
 * Single source of truth for logical topic naming.
 * <p>
 * Topic format: {@code <domain>-<id>} for entity scoped streams (e.g. {@code chat-123}) and a bare domain name
 * for process wide streams (e.g. {@code notifications}). Topic names are case sensitive and must not contain
 * whitespace; transports map them onto their own channel names.
 */
public final class Topics {

    public static final String NOTIFICATIONS = "notifications";
    public static final String GLOBAL_PRESENCE = "global-presence";

    private Topics() {
    }

    public static String chat(String chatId) {
        return compose("chat", chatId);
    }

    /** Presence of participants in a class. */
    public static String classPresence(String classId) {
        return compose("class", classId);
    }

    /** Live class state changes and class broadcasts. */
    public static String liveClass(String classId) {
        return compose("live-class", classId);
    }

    public static String courseProgress(String courseId) {
        return compose("course-progress", courseId);
    }

    public static String forum(String forumId) {
        return compose("forum", forumId);
    }

    public static String compose(String domain, String id) {
        Preconditions.checkNotBlank(domain, "domain");
        Preconditions.checkNotBlank(id, "id");
        String topic = domain.trim() + "-" + id.trim();
        validate(topic);
        return topic;
    }

    /**
     * @throws IllegalArgumentException if the topic is blank or contains whitespace
     */
    public static String validate(String topic) {
        Preconditions.checkNotBlank(topic, "topic");
        for (int i = 0; i < topic.length(); i++) {
            if (Character.isWhitespace(topic.charAt(i))) {
                throw new IllegalArgumentException("topic must not contain whitespace: '" + topic + "'");
            }
        }
        return topic;
    }
}
