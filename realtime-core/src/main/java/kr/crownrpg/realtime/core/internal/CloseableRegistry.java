package kr.crownrpg.realtime.core.internal;

import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Closes registered resources in reverse registration order.
 */
public final class CloseableRegistry {

    private final Deque<Entry> stack = new ArrayDeque<>();

    public void register(String name, AutoCloseable closeable) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(closeable, "closeable");
        stack.push(new Entry(name, closeable));
    }

    public int size() {
        return stack.size();
    }

    public void closeAllQuietly(Logger logger) {
        while (!stack.isEmpty()) {
            Entry entry = stack.pop();
            try {
                entry.closeable().close();
            } catch (Exception e) {
                if (logger != null) {
                    logger.warn("리소스 종료 실패: {}", entry.name(), e);
                }
            }
        }
    }

    private record Entry(String name, AutoCloseable closeable) {
    }
}
