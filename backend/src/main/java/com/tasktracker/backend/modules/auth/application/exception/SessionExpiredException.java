package com.tasktracker.backend.modules.auth.application.exception;

import com.tasktracker.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * The presented refresh token can no longer be used; the client has to log in again.
 */
public class SessionExpiredException extends ProblemException {

    public static final String SESSION_EXPIRED = "SESSION_EXPIRED";

    public SessionExpiredException() {
        this(null);
    }

    public SessionExpiredException(Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, SESSION_EXPIRED, "Session expired, please log in again", cause);
    }
}
