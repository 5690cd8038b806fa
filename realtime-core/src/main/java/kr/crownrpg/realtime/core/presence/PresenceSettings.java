package kr.crownrpg.realtime.core.presence;

import java.time.Duration;

/**
 * Presence 하트비트 정책.
 */
public final class PresenceSettings {

    private static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final Duration heartbeatInterval;
    private final Duration timeout;

    /**
     * @param timeout staleness window; {@code null} means twice the heartbeat interval
     */
    public PresenceSettings(Duration heartbeatInterval, Duration timeout) {
        this.heartbeatInterval = heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()
                ? DEFAULT_HEARTBEAT_INTERVAL
                : heartbeatInterval;
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? this.heartbeatInterval.multipliedBy(2)
                : timeout;
    }

    public static PresenceSettings defaults() {
        return new PresenceSettings(DEFAULT_HEARTBEAT_INTERVAL, null);
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration timeout() {
        return timeout;
    }
}
