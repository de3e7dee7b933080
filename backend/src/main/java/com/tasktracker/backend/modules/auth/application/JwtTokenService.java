package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.tasktracker.backend.modules.auth.domain.TokenKind;
import com.tasktracker.backend.modules.auth.domain.UserAccount;
import com.tasktracker.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.RequiredTypeException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and decodes HS256 tokens. Issuing depends only on the user, the clock and
 * the signing key, plus a random token id; the service keeps no other state.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_KIND = "kind";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_SESSION_VERSION = "sv";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:1800000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    /**
     * Issues a refresh token and an access token bound to it. The access token's
     * {@code sid} claim names the refresh token so either one can end the session.
     */
    public TokenPair issueTokenPair(UserAccount user) {
        IssuedToken refresh = issueRefreshToken(user.getId(), user.getSessionVersion());
        IssuedToken access = issueAccessToken(user.getId(), user.getUsername(), refresh.tokenId());
        return new TokenPair(access, refresh);
    }

    public IssuedToken issueAccessToken(Long userId, String username, String sessionId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(accessTokenTtlMillis);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_KIND, TokenKind.ACCESS.claimValue())
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_SESSION_ID, sessionId)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, tokenId, TokenKind.ACCESS, now, expiresAt);
    }

    public IssuedToken issueRefreshToken(Long userId, int sessionVersion) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(refreshTokenTtlMillis);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_KIND, TokenKind.REFRESH.claimValue())
                .claim(CLAIM_SESSION_VERSION, sessionVersion)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, tokenId, TokenKind.REFRESH, now, expiresAt);
    }

    /**
     * Verifies the signature and decodes the claims. Expiry is reported through
     * {@link TokenClaims#expiresAt()} and left to the caller, so that logout can still
     * identify an expired token.
     *
     * @throws InvalidTokenException with reason MALFORMED if the token is not one of ours
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Token is empty");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            // thrown only after the signature has been verified
            claims = e.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Token could not be verified", e);
        }
        return toTokenClaims(claims);
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    private TokenClaims toTokenClaims(Claims claims) {
        try {
            Long userId = Long.valueOf(claims.getSubject());
            TokenKind kind = TokenKind.fromClaim(claims.get(CLAIM_KIND))
                    .orElseThrow(() -> new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Missing kind claim"));
            if (claims.getId() == null || claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Missing registered claims");
            }
            Number sessionVersion = claims.get(CLAIM_SESSION_VERSION, Number.class);
            return new TokenClaims(
                    userId,
                    claims.getId(),
                    kind,
                    claims.get(CLAIM_USERNAME, String.class),
                    claims.get(CLAIM_SESSION_ID, String.class),
                    sessionVersion != null ? sessionVersion.intValue() : null,
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (NumberFormatException | RequiredTypeException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Unexpected claim format", e);
        }
    }

    public record IssuedToken(String value, String tokenId, TokenKind kind, Instant issuedAt, Instant expiresAt) {
    }

    public record TokenPair(IssuedToken access, IssuedToken refresh) {
    }

    /**
     * Decoded token payload. {@code username} and {@code sessionId} are set on access
     * tokens, {@code sessionVersion} on refresh tokens.
     */
    public record TokenClaims(
            Long userId,
            String tokenId,
            TokenKind kind,
            String username,
            String sessionId,
            Integer sessionVersion,
            Instant issuedAt,
            Instant expiresAt
    ) {
    }
}
