package com.mlpromote.promotion;

import java.time.Instant;
import java.util.Objects;

public record PromotionRequest(
        String artifactVersionId,
        String targetEnvironment,
        String requestedBy,
        Trigger trigger,
        Instant requestedAt) {

    public PromotionRequest {
        Objects.requireNonNull(artifactVersionId, "artifactVersionId");
        Objects.requireNonNull(targetEnvironment, "targetEnvironment");
        requestedBy = requestedBy == null || requestedBy.isBlank() ? "system" : requestedBy;
        trigger = trigger == null ? Trigger.MANUAL : trigger;
    }

    public static PromotionRequest manual(String artifactVersionId, String targetEnvironment, String requestedBy, Instant requestedAt) {
        return new PromotionRequest(artifactVersionId, targetEnvironment, requestedBy, Trigger.MANUAL, requestedAt);
    }

    public enum Trigger {
        BUILD,
        MANUAL
    }
}
