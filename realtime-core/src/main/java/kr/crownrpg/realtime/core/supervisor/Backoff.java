package kr.crownrpg.realtime.core.supervisor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter: {@code min(max, initial * 2^(attempt-1)) * (1 ± jitter)}.
 */
final class Backoff {

    private final ReconnectSettings settings;
    private final DoubleSupplier random;

    /**
     * @param random source of values in {@code [0, 1)}
     */
    Backoff(ReconnectSettings settings, DoubleSupplier random) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");
    }

    Duration delayFor(int attempt) {
        long initial = settings.initialDelay().toMillis();
        long max = settings.maxDelay().toMillis();
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long base = (long) Math.min(max, initial * Math.pow(2, exponent));
        double jitter = settings.jitterRatio() * (random.getAsDouble() * 2.0 - 1.0);
        long delay = Math.round(base * (1.0 + jitter));
        return Duration.ofMillis(Math.max(0L, Math.min(max, delay)));
    }
}
