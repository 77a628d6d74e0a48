package com.mlpromote.environment;

public record AutoscalingPolicy(
        boolean enabled,
        double targetInvocationsPerInstance,
        int scaleInCooldownSeconds,
        int scaleOutCooldownSeconds) {

    public static AutoscalingPolicy disabled() {
        return new AutoscalingPolicy(false, 70.0, 300, 60);
    }
}
