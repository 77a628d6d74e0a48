package com.mlpromote.environment;

/**
 * Data capture and scheduled model monitoring for an endpoint. Captured traffic is sampled at
 * {@code dataCaptureSamplingPercent}; the monitoring job runs every {@code scheduleIntervalMinutes}.
 */
public record MonitoringPolicy(boolean enabled, int dataCaptureSamplingPercent, long scheduleIntervalMinutes) {

    public MonitoringPolicy {
        if (dataCaptureSamplingPercent < 0 || dataCaptureSamplingPercent > 100) {
            throw new IllegalArgumentException("dataCaptureSamplingPercent must be within [0, 100]: " + dataCaptureSamplingPercent);
        }
        if (enabled && scheduleIntervalMinutes < 1) {
            throw new IllegalArgumentException("scheduleIntervalMinutes must be at least 1: " + scheduleIntervalMinutes);
        }
    }

    public static MonitoringPolicy disabled() {
        return new MonitoringPolicy(false, 100, 60);
    }

    public String describe() {
        return enabled
                ? "capture " + dataCaptureSamplingPercent + "%, schedule every " + scheduleIntervalMinutes + "m"
                : "disabled";
    }
}
