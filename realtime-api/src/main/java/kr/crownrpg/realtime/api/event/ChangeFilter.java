package kr.crownrpg.realtime.api.event;

import kr.crownrpg.realtime.api.Preconditions;

import java.util.Map;
import java.util.Objects;

/**
 * Predicate over {@link ChangeEvent}s used by {@link EventStream#onChange}.
 * <p>
 * Besides the factory methods, {@link #parse(String)} accepts the row filter syntax
 * {@code column=eq.value} used by hosted change feeds, e.g. {@code chat_id=eq.123}.
 */
@FunctionalInterface
public interface ChangeFilter {

    boolean matches(ChangeEvent event);

    default ChangeFilter and(ChangeFilter other) {
        Preconditions.checkNotNull(other, "other");
        return event -> matches(event) && other.matches(event);
    }

    static ChangeFilter all() {
        return event -> true;
    }

    static ChangeFilter table(String table) {
        Preconditions.checkNotBlank(table, "table");
        return event -> table.equals(event.table());
    }

    static ChangeFilter operation(ChangeOperation operation) {
        Preconditions.checkNotNull(operation, "operation");
        return event -> event.operation() == operation;
    }

    /**
     * Matches when the row image has {@code column} equal to {@code value}, comparing string forms so that
     * {@code 42} and {@code "42"} are equal.
     */
    static ChangeFilter columnEquals(String column, Object value) {
        Preconditions.checkNotBlank(column, "column");
        String expected = value == null ? null : String.valueOf(value);
        return event -> {
            Map<String, Object> row = event.row();
            if (!row.containsKey(column)) {
                return false;
            }
            Object actual = row.get(column);
            return Objects.equals(expected, actual == null ? null : String.valueOf(actual));
        };
    }

    /**
     * Parses {@code column=eq.value}. Only the {@code eq} operator is supported.
     *
     * @throws IllegalArgumentException on any other shape
     */
    static ChangeFilter parse(String expression) {
        Preconditions.checkNotBlank(expression, "expression");
        int assign = expression.indexOf('=');
        if (assign <= 0) {
            throw new IllegalArgumentException("filter must look like column=eq.value: " + expression);
        }
        String column = expression.substring(0, assign).trim();
        String rest = expression.substring(assign + 1);
        if (!rest.startsWith("eq.")) {
            throw new IllegalArgumentException("only the eq operator is supported: " + expression);
        }
        return columnEquals(column, rest.substring(3));
    }
}
