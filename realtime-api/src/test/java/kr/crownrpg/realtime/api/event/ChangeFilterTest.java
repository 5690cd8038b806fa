package kr.crownrpg.realtime.api.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeFilterTest {

    @Test
    void parsedFilterComparesStringForms() {
        ChangeFilter filter = ChangeFilter.parse("chat_id=eq.123");

        assertThat(filter.matches(insert(Map.of("chat_id", 123)))).isTrue();
        assertThat(filter.matches(insert(Map.of("chat_id", "123")))).isTrue();
        assertThat(filter.matches(insert(Map.of("chat_id", 124)))).isFalse();
        assertThat(filter.matches(insert(Map.of("other", 123)))).isFalse();
    }

    @Test
    void deleteIsMatchedOnBeforeImage() {
        ChangeEvent delete = new ChangeEvent("chat-123", "messages", ChangeOperation.DELETE,
                Map.of("chat_id", 123), null, Instant.EPOCH);

        assertThat(ChangeFilter.columnEquals("chat_id", 123).matches(delete)).isTrue();
    }

    @Test
    void nullColumnMatchesOnlyNullValue() {
        Map<String, Object> row = new HashMap<>();
        row.put("deleted_at", null);

        assertThat(ChangeFilter.columnEquals("deleted_at", null).matches(insert(row))).isTrue();
        assertThat(ChangeFilter.columnEquals("deleted_at", "x").matches(insert(row))).isFalse();
    }

    @Test
    void filtersCombine() {
        ChangeFilter filter = ChangeFilter.table("messages").and(ChangeFilter.operation(ChangeOperation.INSERT));

        assertThat(filter.matches(insert(Map.of()))).isTrue();
        assertThat(filter.matches(new ChangeEvent("chat-123", "reactions", ChangeOperation.INSERT, null, null, null))).isFalse();
        assertThat(ChangeFilter.all().matches(insert(Map.of()))).isTrue();
    }

    @Test
    void unsupportedExpressionsAreRejected() {
        assertThatThrownBy(() -> ChangeFilter.parse("chat_id=gt.5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChangeFilter.parse("=eq.5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChangeFilter.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static ChangeEvent insert(Map<String, Object> after) {
        return new ChangeEvent("chat-123", "messages", ChangeOperation.INSERT, null, after, Instant.EPOCH);
    }
}
