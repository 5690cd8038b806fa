package kr.crownrpg.realtime.core.scheduler;

import kr.crownrpg.realtime.core.internal.ThreadFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} over a {@link ScheduledExecutorService} with named daemon threads.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(int threads, String threadPrefix) {
        this(ThreadFactories.scheduled(threads, threadPrefix));
    }

    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        long delayMillis = Math.max(0L, delay.toMillis());
        return new FutureTask(executor.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS));
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        Objects.requireNonNull(task, "task");
        long initialMillis = Math.max(0L, initialDelay.toMillis());
        long periodMillis = Math.max(1L, period.toMillis());
        return new FutureTask(executor.scheduleAtFixedRate(guard(task), initialMillis, periodMillis, TimeUnit.MILLISECONDS));
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    // a periodic task that throws is silently suppressed by the executor, so failures are logged here
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.warn("예약 작업 실행 중 오류", e);
            }
        };
    }

    private static final class FutureTask implements ScheduledTask {

        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
