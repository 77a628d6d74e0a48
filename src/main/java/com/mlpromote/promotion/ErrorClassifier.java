package com.mlpromote.promotion;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.mlpromote.serving.TransientResourceException;

/**
 * Maps collaborator failures onto the retry taxonomy. Anything not explicitly transient is
 * terminal.
 */
public class ErrorClassifier {

    public ErrorClass classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransientResourceException) {
            return ErrorClass.TRANSIENT;
        }
        return ErrorClass.TERMINAL;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    public enum ErrorClass {
        TRANSIENT,
        TERMINAL
    }
}
