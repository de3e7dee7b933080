package com.tasktracker.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.tasktracker.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.tasktracker.backend.modules.auth.application.JwtTokenService.TokenPair;

/**
 * Token pair as returned to clients. Lifetimes are in seconds.
 */
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        IssuedToken access = pair.access();
        IssuedToken refresh = pair.refresh();
        return new TokenPairResponse(
                access.value(),
                DEFAULT_TOKEN_TYPE,
                access.expiresAt().getEpochSecond() - access.issuedAt().getEpochSecond(),
                refresh.value(),
                refresh.expiresAt().getEpochSecond() - refresh.issuedAt().getEpochSecond(),
                OffsetDateTime.ofInstant(access.issuedAt(), ZoneOffset.UTC)
        );
    }
}
