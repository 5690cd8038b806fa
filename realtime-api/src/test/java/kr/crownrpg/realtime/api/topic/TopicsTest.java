package kr.crownrpg.realtime.api.topic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicsTest {

    @Test
    void composesEntityTopics() {
        assertThat(Topics.chat("123")).isEqualTo("chat-123");
        assertThat(Topics.classPresence(" 7 ")).isEqualTo("class-7");
        assertThat(Topics.liveClass("7")).isEqualTo("live-class-7");
        assertThat(Topics.courseProgress("c1")).isEqualTo("course-progress-c1");
        assertThat(Topics.forum("f1")).isEqualTo("forum-f1");
    }

    @Test
    void rejectsBlankOrWhitespaceTopics() {
        assertThatThrownBy(() -> Topics.chat("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Topics.validate("chat 1")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Topics.validate(Topics.NOTIFICATIONS)).isEqualTo("notifications");
    }
}
