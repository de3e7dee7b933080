package com.tasktracker.backend.modules.auth.domain;

import java.util.Optional;

/**
 * Discriminator carried in every token's {@code kind} claim. An access token is
 * never accepted where a refresh token is expected, and the other way round.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value.toString())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
