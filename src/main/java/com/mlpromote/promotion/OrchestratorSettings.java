package com.mlpromote.promotion;

import java.time.Duration;

import com.mlpromote.runtime.AppConfig;

public record OrchestratorSettings(
        Duration pollInterval, RetryPolicy retryPolicy, int schedulerThreads, Duration statusCallTimeout) {

    private static final Duration DEFAULT_STATUS_CALL_TIMEOUT = Duration.ofSeconds(30);

    public OrchestratorSettings {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy is required");
        }
        if (statusCallTimeout == null) {
            statusCallTimeout = DEFAULT_STATUS_CALL_TIMEOUT;
        }
        if (statusCallTimeout.isZero() || statusCallTimeout.isNegative()) {
            throw new IllegalArgumentException("statusCallTimeout must be positive");
        }
        schedulerThreads = Math.max(2, schedulerThreads);
    }

    public OrchestratorSettings(Duration pollInterval, RetryPolicy retryPolicy, int schedulerThreads) {
        this(pollInterval, retryPolicy, schedulerThreads, DEFAULT_STATUS_CALL_TIMEOUT);
    }

    public static OrchestratorSettings fromConfig(AppConfig.OrchestratorConfig config) {
        return new OrchestratorSettings(
                Duration.ofMillis(config.getPollIntervalMs()),
                RetryPolicy.fromConfig(config.getRetry()),
                config.getSchedulerThreads(),
                Duration.ofMillis(config.getStatusCallTimeoutMs()));
    }
}
