package com.tasktracker.backend.modules.auth.application.exception;

import com.tasktracker.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Stored or configured credential material is unusable: a password hash that is
 * not a bcrypt digest, or a signing key that cannot sign. Not user-actionable.
 * The internal message is for logs; clients only see a generic detail.
 */
public class CredentialIntegrityException extends ProblemException {

    public static final String CREDENTIAL_INTEGRITY_ERROR = "CREDENTIAL_INTEGRITY_ERROR";
    public static final String SIGNING_KEY_MISCONFIGURED = "SIGNING_KEY_MISCONFIGURED";

    private final String internalMessage;

    public CredentialIntegrityException(String code, String internalMessage) {
        this(code, internalMessage, null);
    }

    public CredentialIntegrityException(String code, String internalMessage, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, "Unexpected server error", cause);
        this.internalMessage = internalMessage;
    }

    public String getInternalMessage() {
        return internalMessage;
    }

    @Override
    public String getMessage() {
        return getCode() + ": " + internalMessage;
    }
}
