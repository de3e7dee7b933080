package com.tasktracker.backend.modules.auth.application.exception;

import com.tasktracker.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * 401 for bad credentials and for missing, invalid or expired access tokens.
 * Login failures share one code and one message whatever check failed.
 */
public class AuthenticationFailedException extends ProblemException {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String ACCESS_TOKEN_INVALID = "ACCESS_TOKEN_INVALID";
    public static final String ACCESS_TOKEN_EXPIRED = "ACCESS_TOKEN_EXPIRED";
    public static final String AUTHENTICATION_REQUIRED = "AUTHENTICATION_REQUIRED";

    private static final String CREDENTIALS_DETAIL = "Invalid username or password";
    private static final String TOKEN_DETAIL = "Authentication required";

    private AuthenticationFailedException(String code, String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, code, detail, cause);
    }

    public static AuthenticationFailedException invalidCredentials() {
        return new AuthenticationFailedException(INVALID_CREDENTIALS, CREDENTIALS_DETAIL, null);
    }

    public static AuthenticationFailedException invalidAccessToken(Throwable cause) {
        return new AuthenticationFailedException(ACCESS_TOKEN_INVALID, TOKEN_DETAIL, cause);
    }

    public static AuthenticationFailedException expiredAccessToken(Throwable cause) {
        return new AuthenticationFailedException(ACCESS_TOKEN_EXPIRED, TOKEN_DETAIL, cause);
    }

    public static AuthenticationFailedException authenticationRequired() {
        return new AuthenticationFailedException(AUTHENTICATION_REQUIRED, TOKEN_DETAIL, null);
    }
}
