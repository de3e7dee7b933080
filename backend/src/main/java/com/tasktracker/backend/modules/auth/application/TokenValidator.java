package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;

import com.tasktracker.backend.modules.auth.application.JwtTokenService.TokenClaims;
import com.tasktracker.backend.modules.auth.domain.TokenKind;

import org.springframework.stereotype.Component;

/**
 * Checks a presented token in a fixed order and stops at the first failure:
 * signature, kind, expiry, then (refresh tokens only) the revocation registry.
 * Read-only; concurrent validations of the same token are independent.
 */
@Component
public class TokenValidator {

    private final JwtTokenService jwtTokenService;
    private final TokenRevocationRegistry revocationRegistry;
    private final Clock clock;

    public TokenValidator(JwtTokenService jwtTokenService, TokenRevocationRegistry revocationRegistry, Clock clock) {
        this.jwtTokenService = jwtTokenService;
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    public TokenClaims validate(String token, TokenKind expectedKind) {
        TokenClaims claims = jwtTokenService.parse(token);

        if (claims.kind() != expectedKind) {
            throw new InvalidTokenException(InvalidTokenException.Reason.WRONG_KIND,
                    "Expected " + expectedKind.claimValue() + " token");
        }

        Instant now = clock.instant();
        if (!now.isBefore(claims.expiresAt())) {
            throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "Token expired");
        }

        if (expectedKind == TokenKind.REFRESH && revocationRegistry.isRevoked(claims.tokenId())) {
            throw new InvalidTokenException(InvalidTokenException.Reason.REVOKED, "Token revoked");
        }
        return claims;
    }
}
