package com.mlpromote.promotion;

import java.time.Instant;

public record PromotionEvent(
        EventType type,
        String runId,
        String artifactVersionId,
        String environment,
        PromotionState from,
        PromotionState to,
        String detail,
        Instant timestamp) {

    public enum EventType {
        TRANSITION,
        APPROVAL_REQUESTED,
        PROMOTION_SUCCEEDED,
        PROMOTION_FAILED,
        ROLLBACK_FAILED
    }
}
