package kr.crownrpg.realtime.core.redis;

import kr.crownrpg.realtime.api.Preconditions;
import kr.crownrpg.realtime.api.topic.Topics;

/**
 * Redis PubSub channel naming for realtime topics.
 * <p>
 * Channel format: {@code crown:{environment}:rt:{topic}}. The environment segment isolates traffic between
 * deployments sharing one Redis.
 */
public final class RedisTopics {

    private static final String PREFIX = "crown";
    private static final String SCOPE = "rt";

    private RedisTopics() {
    }

    public static String channel(String environment, String topic) {
        Preconditions.checkNotBlank(environment, "environment");
        Topics.validate(topic);
        return prefix(environment) + topic;
    }

    /**
     * @return the topic carried by {@code channel}, or {@code null} if it belongs to another environment or scope
     */
    public static String topicOf(String environment, String channel) {
        if (channel == null) {
            return null;
        }
        String prefix = prefix(environment);
        if (!channel.startsWith(prefix) || channel.length() == prefix.length()) {
            return null;
        }
        return channel.substring(prefix.length());
    }

    private static String prefix(String environment) {
        return PREFIX + ":" + environment + ":" + SCOPE + ":";
    }
}
