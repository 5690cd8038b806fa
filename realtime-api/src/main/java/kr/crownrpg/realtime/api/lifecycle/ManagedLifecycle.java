package kr.crownrpg.realtime.api.lifecycle;

/**
 * Start/stop contract for long lived realtime components such as the reconnection supervisor.
 * <p>
 * {@code stop} must be safe to call more than once.
 */
public interface ManagedLifecycle {

    void start();

    void stop();
}
