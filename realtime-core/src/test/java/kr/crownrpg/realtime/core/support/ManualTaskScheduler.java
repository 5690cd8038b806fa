package kr.crownrpg.realtime.core.support;

import kr.crownrpg.realtime.core.scheduler.ScheduledTask;
import kr.crownrpg.realtime.core.scheduler.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic scheduler driven by a {@link MutableClock}. Tasks run on the caller of {@link #advance}.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<Task> tasks = new ArrayList<>();
    private long sequence;

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        Task t = new Task(task, clock.instant().plus(delay), null, sequence++);
        tasks.add(t);
        return t;
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        Task t = new Task(task, clock.instant().plus(initialDelay), period, sequence++);
        tasks.add(t);
        return t;
    }

    @Override
    public synchronized void shutdown() {
        tasks.forEach(Task::cancel);
        tasks.clear();
    }

    /**
     * Moves the clock forward, running every task that falls due on the way in time order.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Task next;
            synchronized (this) {
                tasks.removeIf(Task::isCancelled);
                next = tasks.stream()
                        .filter(t -> !t.due.isAfter(target))
                        .min(Comparator.comparing((Task t) -> t.due).thenComparingLong(t -> t.order))
                        .orElse(null);
                if (next == null) {
                    break;
                }
                clock.set(next.due);
                if (next.period == null) {
                    tasks.remove(next);
                } else {
                    next.due = next.due.plus(next.period);
                }
            }
            next.action.run();
        }
        clock.set(target);
    }

    public synchronized int activeTaskCount() {
        tasks.removeIf(Task::isCancelled);
        return tasks.size();
    }

    /**
     * Delay until the earliest pending task, or {@code null} if nothing is scheduled.
     */
    public synchronized Duration nextDelay() {
        tasks.removeIf(Task::isCancelled);
        return tasks.stream()
                .map(t -> Duration.between(clock.instant(), t.due))
                .min(Comparator.naturalOrder())
                .orElse(null);
    }

    private static final class Task implements ScheduledTask {

        private final Runnable action;
        private final Duration period;
        private final long order;
        private Instant due;
        private volatile boolean cancelled;

        private Task(Runnable action, Instant due, Duration period, long order) {
            this.action = action;
            this.due = due;
            this.period = period;
            this.order = order;
        }

        @Override
        public boolean cancel() {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
