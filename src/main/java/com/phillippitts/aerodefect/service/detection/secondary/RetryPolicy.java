package com.phillippitts.aerodefect.service.detection.secondary;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff.
 *
 * <p>The delay before retry {@code n} (1-based, so the wait between the first and second attempt is
 * retry 1) is {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}, then spread by
 * {@code +/- jitter} of itself.
 *
 * @param maxAttempts total attempts including the first call; at least 1
 * @param baseDelay   delay before the first retry
 * @param maxDelay    upper bound for the un-jittered delay
 * @param jitter      fractional spread in [0,1]; 0 gives a fixed schedule
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be in [0,1], got " + jitter);
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * @param attemptsMade attempts already performed
     * @return true when another attempt is allowed
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Un-jittered delay before retry {@code retryNumber}.
     */
    public Duration nominalDelay(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1, got " + retryNumber);
        }
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(retryNumber - 1, 30);
        long raw = base > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : base << shift;
        return Duration.ofMillis(Math.min(raw, cap));
    }

    /**
     * Jittered delay before retry {@code retryNumber}.
     *
     * @param random source of uniform values in [0,1)
     */
    public Duration delayBeforeRetry(int retryNumber, DoubleSupplier random) {
        long nominal = nominalDelay(retryNumber).toMillis();
        if (jitter == 0.0 || nominal == 0) {
            return Duration.ofMillis(nominal);
        }
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(nominal * factor)));
    }
}
