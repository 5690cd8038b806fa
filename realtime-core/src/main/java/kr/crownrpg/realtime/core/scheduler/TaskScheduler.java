package kr.crownrpg.realtime.core.scheduler;

import java.time.Duration;

/**
 * Delayed and periodic task execution used for heartbeats and reconnect backoff.
 */
public interface TaskScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    void shutdown();
}
