package kr.crownrpg.realtime.core.event;

/**
 * 이벤트 전달 실행 정책.
 */
public final class EventStreamSettings {

    private final int workerThreads;
    private final int historySize;
    private final int dropWarnThreshold;

    public EventStreamSettings(int workerThreads, int historySize, int dropWarnThreshold) {
        this.workerThreads = Math.max(1, workerThreads);
        this.historySize = Math.max(0, historySize);
        this.dropWarnThreshold = Math.max(1, dropWarnThreshold);
    }

    public static EventStreamSettings defaults() {
        return new EventStreamSettings(4, 50, 20);
    }

    public int workerThreads() {
        return workerThreads;
    }

    public int historySize() {
        return historySize;
    }

    public int dropWarnThreshold() {
        return dropWarnThreshold;
    }
}
