package com.mlpromote.validation;

import java.util.LinkedHashMap;
import java.util.Map;

public record ValidationMetrics(
        double p50LatencyMs,
        double p95LatencyMs,
        double p99LatencyMs,
        double meanLatencyMs,
        double accuracy,
        double errorRate,
        int invocations) {

    public Map<String, Double> asMap() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("p50_latency_ms", p50LatencyMs);
        metrics.put("p95_latency_ms", p95LatencyMs);
        metrics.put("p99_latency_ms", p99LatencyMs);
        metrics.put("mean_latency_ms", meanLatencyMs);
        metrics.put("accuracy", accuracy);
        metrics.put("error_rate", errorRate);
        metrics.put("invocations", (double) invocations);
        return metrics;
    }
}
