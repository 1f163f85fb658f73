package com.phillippitts.livefacts.exception;

/**
 * Base exception for all liveFacts application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LiveFactsException extends RuntimeException {

    public LiveFactsException(String message) {
        super(message);
    }

    public LiveFactsException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveFactsException(Throwable cause) {
        super(cause);
    }
}
