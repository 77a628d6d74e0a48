package com.mlpromote.gate;

/**
 * Gate thresholds of one environment. Latency is compared against the p95 of the validation run;
 * a mean latency above {@code latencyWarningMs} only raises a warning.
 */
public record EnvironmentPolicy(
        String environment,
        double minAccuracy,
        double maxLatencyMs,
        double maxErrorRate,
        boolean requiresHumanApproval,
        double latencyWarningMs) {
    public static final double DEFAULT_LATENCY_WARNING_MS = 1000.0;

    public EnvironmentPolicy(
            String environment, double minAccuracy, double maxLatencyMs, double maxErrorRate, boolean requiresHumanApproval) {
        this(environment, minAccuracy, maxLatencyMs, maxErrorRate, requiresHumanApproval, DEFAULT_LATENCY_WARNING_MS);
    }
}
