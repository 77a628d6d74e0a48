package com.mlpromote.serving;

/**
 * Temporary platform condition such as throttling; the same call may succeed later.
 */
public class TransientResourceException extends ServingResourceException {

    public TransientResourceException(String message) {
        super(message);
    }

    public TransientResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
