package com.tasktracker.backend.modules.auth.application.exception;

import com.tasktracker.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class CredentialValidationException extends ProblemException {

    public static final String PASSWORD_TOO_SHORT = "PASSWORD_TOO_SHORT";
    public static final String PASSWORD_TOO_LONG = "PASSWORD_TOO_LONG";

    public CredentialValidationException(String code, String detail) {
        super(HttpStatus.BAD_REQUEST, code, detail);
    }
}
