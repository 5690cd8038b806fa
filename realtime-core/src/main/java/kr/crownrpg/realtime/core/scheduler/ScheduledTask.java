package kr.crownrpg.realtime.core.scheduler;

/**
 * Handle of a scheduled task. Cancelling twice is harmless.
 */
public interface ScheduledTask {

    /**
     * @return {@code true} if this call cancelled the task
     */
    boolean cancel();

    boolean isCancelled();
}
