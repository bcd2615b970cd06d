package com.workspacepilot.orchestrator.backend;

import java.util.OptionalInt;

/**
 * Thrown when a backend call is rejected or the backend is unreachable.
 *
 * Carries the HTTP status when there was a response; transport failures
 * have none.
 */
public class BackendException extends RuntimeException {

    private final Integer statusCode;

    public BackendException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
