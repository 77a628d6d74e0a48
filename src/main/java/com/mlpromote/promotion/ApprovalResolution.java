package com.mlpromote.promotion;

/**
 * How a pending approval was settled. {@code epoch} ties the resolution to one approval request
 * so a stale timer cannot settle a later one.
 */
record ApprovalResolution(Outcome outcome, String actor, String reason, int epoch) {

    enum Outcome {
        APPROVED,
        REJECTED,
        TIMED_OUT,
        CANCELLED
    }

    String describe() {
        return switch (outcome) {
            case APPROVED -> "approved by " + actor;
            case REJECTED -> "rejected by " + actor + (reason == null || reason.isBlank() ? "" : ": " + reason);
            case TIMED_OUT -> reason;
            case CANCELLED -> "cancelled: " + reason;
        };
    }
}
