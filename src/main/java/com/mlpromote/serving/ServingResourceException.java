package com.mlpromote.serving;

/**
 * Failure reported by a {@link ServingResourceManager}. Subclasses tell whether retrying can help.
 */
public class ServingResourceException extends RuntimeException {

    public ServingResourceException(String message) {
        super(message);
    }

    public ServingResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
