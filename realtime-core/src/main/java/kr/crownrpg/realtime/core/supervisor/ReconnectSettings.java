package kr.crownrpg.realtime.core.supervisor;

import java.time.Duration;

/**
 * 재연결 정책을 외부 설정으로 전달하기 위한 옵션.
 */
public final class ReconnectSettings {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final double jitterRatio;

    public ReconnectSettings(Duration initialDelay, Duration maxDelay, int maxAttempts, double jitterRatio) {
        this.initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        Duration max = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        this.maxDelay = max.compareTo(this.initialDelay) < 0 ? this.initialDelay : max;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.jitterRatio = Math.min(1.0, Math.max(0.0, jitterRatio));
    }

    public static ReconnectSettings defaults() {
        return new ReconnectSettings(Duration.ofSeconds(1), Duration.ofSeconds(30), 10, 0.2);
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public double jitterRatio() {
        return jitterRatio;
    }
}
