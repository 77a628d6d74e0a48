package com.mlpromote.promotion;

/**
 * Raised at submission when a run for the same artifact version and environment is still active.
 */
public class ConflictException extends RuntimeException {
    private final String activeRunId;

    public ConflictException(String message, String activeRunId) {
        super(message);
        this.activeRunId = activeRunId;
    }

    public String activeRunId() {
        return activeRunId;
    }
}
