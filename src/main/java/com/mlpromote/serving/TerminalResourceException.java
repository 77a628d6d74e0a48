package com.mlpromote.serving;

/**
 * Permanent failure such as an invalid configuration or an exhausted quota.
 */
public class TerminalResourceException extends ServingResourceException {

    public TerminalResourceException(String message) {
        super(message);
    }

    public TerminalResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
