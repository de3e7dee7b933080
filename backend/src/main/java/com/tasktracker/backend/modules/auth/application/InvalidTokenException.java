package com.tasktracker.backend.modules.auth.application;

/**
 * Internal signal from token parsing and validation. {@link AuthService} translates
 * it into the public error classes; it never reaches a controller.
 */
public class InvalidTokenException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        WRONG_KIND,
        EXPIRED,
        REVOKED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        this(reason, message, null);
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
