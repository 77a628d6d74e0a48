package com.mlpromote.promotion;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a promotion run and the transitions allowed between them. {@link #FAILED} is
 * terminal unless a rollback follows it.
 */
public enum PromotionState {
    REQUESTED,
    DEPLOYING,
    AWAITING_READY,
    VALIDATING,
    AWAITING_APPROVAL,
    PROMOTED,
    FAILED,
    ROLLBACK,
    ROLLED_BACK,
    ROLLBACK_FAILED;

    public boolean isTerminal() {
        return this == PROMOTED || this == FAILED || this == ROLLED_BACK || this == ROLLBACK_FAILED;
    }

    public boolean isCancellable() {
        return this == REQUESTED || this == DEPLOYING || this == AWAITING_READY || this == VALIDATING || this == AWAITING_APPROVAL;
    }

    public boolean canTransitionTo(PromotionState next) {
        return successors().contains(next);
    }

    public Set<PromotionState> successors() {
        return switch (this) {
            case REQUESTED -> EnumSet.of(DEPLOYING, FAILED);
            case DEPLOYING -> EnumSet.of(AWAITING_READY, FAILED);
            case AWAITING_READY -> EnumSet.of(VALIDATING, FAILED);
            case VALIDATING -> EnumSet.of(PROMOTED, FAILED, AWAITING_APPROVAL);
            case AWAITING_APPROVAL -> EnumSet.of(DEPLOYING, PROMOTED, FAILED);
            case FAILED -> EnumSet.of(ROLLBACK);
            case ROLLBACK -> EnumSet.of(ROLLED_BACK, ROLLBACK_FAILED);
            case PROMOTED, ROLLED_BACK, ROLLBACK_FAILED -> EnumSet.noneOf(PromotionState.class);
        };
    }
}
