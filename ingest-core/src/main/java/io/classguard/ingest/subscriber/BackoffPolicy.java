package io.classguard.ingest.subscriber;

import java.time.Duration;

/**
 * Exponential backoff: the initial delay doubles on every attempt up to a cap.
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    public BackoffPolicy(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
    }

    /**
     * Delay before retry number {@code attempt} (1-based): initial, 2x, 4x, ... capped.
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        if (exponent >= 31) {
            return maxDelay;
        }
        long millis = initialDelay.toMillis();
        long factor = 1L << exponent;
        if (millis > 0 && factor > maxDelay.toMillis() / millis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis * factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }

    @Override
    public String toString() {
        return "BackoffPolicy{initial=" + initialDelay.toMillis() + "ms, max=" + maxDelay.toMillis() + "ms}";
    }
}
