package com.mlpromote.environment;

import java.util.Locale;
import java.util.Objects;

public record ResourceProfile(
        String instanceClass,
        int initialReplicas,
        int minReplicas,
        int maxReplicas,
        AutoscalingPolicy autoscaling,
        MonitoringPolicy monitoring) {
    static final int MAX_SIZE_FACTOR = 1024;

    public ResourceProfile {
        Objects.requireNonNull(instanceClass, "instanceClass");
        autoscaling = autoscaling == null ? AutoscalingPolicy.disabled() : autoscaling;
        monitoring = monitoring == null ? MonitoringPolicy.disabled() : monitoring;
        if (minReplicas < 1 || maxReplicas < minReplicas) {
            throw new IllegalArgumentException("replica bounds must satisfy 1 <= min <= max (min=" + minReplicas + ", max=" + maxReplicas + ")");
        }
        if (initialReplicas < minReplicas || initialReplicas > maxReplicas) {
            throw new IllegalArgumentException("initialReplicas " + initialReplicas + " outside [" + minReplicas + ", " + maxReplicas + "]");
        }
    }

    /**
     * Relative size of one instance, read from the multiplier in front of {@code xlarge}
     * ({@code ml.m5.4xlarge} is 4). Classes without a multiplier count as 1; multipliers are
     * capped at {@value #MAX_SIZE_FACTOR}.
     */
    public int sizeFactor() {
        String normalized = instanceClass.toLowerCase(Locale.ROOT);
        int suffix = normalized.lastIndexOf("xlarge");
        if (suffix <= 0) {
            return 1;
        }
        int start = suffix;
        while (start > 0 && Character.isDigit(normalized.charAt(start - 1))) {
            start--;
        }
        if (start == suffix) {
            return 1;
        }
        String digits = normalized.substring(start, suffix);
        if (digits.length() > 4) {
            return MAX_SIZE_FACTOR;
        }
        return Math.min(MAX_SIZE_FACTOR, Math.max(1, Integer.parseInt(digits)));
    }
}
