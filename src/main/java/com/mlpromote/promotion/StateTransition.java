package com.mlpromote.promotion;

import java.time.Instant;

public record StateTransition(
        PromotionState from,
        PromotionState to,
        String environment,
        Instant timestamp,
        String detail) {
}
