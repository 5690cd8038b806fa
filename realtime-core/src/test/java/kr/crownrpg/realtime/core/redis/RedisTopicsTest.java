package kr.crownrpg.realtime.core.redis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisTopicsTest {

    @Test
    void channelCarriesEnvironmentAndTopic() {
        assertThat(RedisTopics.channel("prod", "chat-123")).isEqualTo("crown:prod:rt:chat-123");
    }

    @Test
    void topicOfReversesChannelForSameEnvironmentOnly() {
        assertThat(RedisTopics.topicOf("prod", "crown:prod:rt:chat-123")).isEqualTo("chat-123");
        assertThat(RedisTopics.topicOf("dev", "crown:prod:rt:chat-123")).isNull();
        assertThat(RedisTopics.topicOf("prod", "crown:prod:rt:")).isNull();
        assertThat(RedisTopics.topicOf("prod", null)).isNull();
    }

    @Test
    void rejectsInvalidTopic() {
        assertThatThrownBy(() -> RedisTopics.channel("prod", "chat 1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisTopics.channel("", "chat-1")).isInstanceOf(IllegalArgumentException.class);
    }
}
