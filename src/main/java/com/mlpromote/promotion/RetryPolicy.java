package com.mlpromote.promotion;

import java.time.Duration;

import com.mlpromote.runtime.AppConfig;

/**
 * Bounded exponential backoff for transient serving failures.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy fromConfig(AppConfig.RetryConfig config) {
        return new RetryPolicy(
                config.getMaxAttempts(),
                Duration.ofMillis(config.getInitialBackoffMs()),
                config.getBackoffMultiplier(),
                Duration.ofMillis(config.getMaxBackoffMs()));
    }

    /**
     * Delay before the attempt following {@code failedAttempt} (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
