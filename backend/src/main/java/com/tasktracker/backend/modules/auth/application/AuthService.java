package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

import com.tasktracker.backend.global.security.JwtAuthenticationPrincipal;
import com.tasktracker.backend.modules.auth.application.JwtTokenService.TokenClaims;
import com.tasktracker.backend.modules.auth.application.JwtTokenService.TokenPair;
import com.tasktracker.backend.modules.auth.application.exception.AuthenticationFailedException;
import com.tasktracker.backend.modules.auth.application.exception.CredentialIntegrityException;
import com.tasktracker.backend.modules.auth.application.exception.SessionExpiredException;
import com.tasktracker.backend.modules.auth.domain.RevocationReason;
import com.tasktracker.backend.modules.auth.domain.TokenKind;
import com.tasktracker.backend.modules.auth.domain.UserAccount;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.tasktracker.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.tasktracker.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.tasktracker.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Login, refresh, logout and password change, plus the per-request access check.
 *
 * <p>Every failure leaves this class as one of the public error types: bad
 * credentials and bad access tokens as {@link AuthenticationFailedException}, unusable
 * refresh tokens as {@link SessionExpiredException}. Each state change is a single
 * committed statement, so a client disconnecting mid-request never undoes a
 * rotation or revocation.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final TokenValidator tokenValidator;
    private final TokenRevocationRegistry revocationRegistry;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService,
            TokenValidator tokenValidator,
            TokenRevocationRegistry revocationRegistry,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.tokenValidator = tokenValidator;
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request) {
        Optional<UserAccount> candidate = userAccountRepository.findByUsername(request.username());

        if (candidate.isEmpty() || !candidate.get().hasUsableCredentials()) {
            passwordHasher.verifyAgainstDummy(request.password());
            log.info("Login failed for username '{}'", request.username());
            throw AuthenticationFailedException.invalidCredentials();
        }

        UserAccount user = candidate.get();
        if (!verifyStoredPassword(user, request.password())) {
            log.info("Login failed for username '{}'", request.username());
            throw AuthenticationFailedException.invalidCredentials();
        }

        TokenPair tokens = jwtTokenService.issueTokenPair(user);
        log.info("User {} logged in", user.getId());
        return new LoginResponse(TokenPairResponse.from(tokens), UserProfileResponse.from(user));
    }

    /**
     * Exchanges a refresh token for a new pair. The presented token is revoked as
     * part of the exchange; of several concurrent requests with the same token only
     * one gets a new pair.
     */
    public TokenPairResponse refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = tokenValidator.validate(refreshToken, TokenKind.REFRESH);
        } catch (InvalidTokenException e) {
            log.info("Refresh rejected: {}", e.getReason());
            throw new SessionExpiredException(e);
        }

        UserAccount user = userAccountRepository.findById(claims.userId()).orElse(null);
        if (user == null || !user.isActive() || !Objects.equals(claims.sessionVersion(), user.getSessionVersion())) {
            revocationRegistry.revoke(claims.tokenId(), claims.userId(), RevocationReason.EXPLICIT_INVALIDATION,
                    claims.expiresAt());
            log.info("Refresh rejected for user {}: session invalidated", claims.userId());
            throw new SessionExpiredException();
        }

        if (!revocationRegistry.tryRevoke(claims.tokenId(), user.getId(), RevocationReason.ROTATED, claims.expiresAt())) {
            log.warn("Refresh token {} of user {} was already rotated, rejecting reuse", claims.tokenId(), user.getId());
            throw new SessionExpiredException();
        }

        TokenPair tokens = jwtTokenService.issueTokenPair(user);
        log.debug("Rotated refresh token {} of user {}", claims.tokenId(), user.getId());
        return TokenPairResponse.from(tokens);
    }

    /**
     * Ends the session of a refresh token. Never fails: unknown, expired or already
     * revoked tokens are ignored.
     */
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        try {
            TokenClaims claims = jwtTokenService.parse(refreshToken);
            if (claims.kind() != TokenKind.REFRESH || isExpired(claims.expiresAt())) {
                return;
            }
            revocationRegistry.revoke(claims.tokenId(), claims.userId(), RevocationReason.LOGOUT, claims.expiresAt());
            log.info("User {} logged out", claims.userId());
        } catch (InvalidTokenException e) {
            log.debug("Ignoring logout with unusable refresh token: {}", e.getReason());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Logout could not be recorded", e);
        }
    }

    /**
     * Ends the session an access token belongs to, i.e. revokes the refresh token
     * named by its {@code sid} claim. Never fails.
     */
    public void logoutByAccessToken(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return;
        }
        try {
            TokenClaims claims = jwtTokenService.parse(accessToken);
            if (claims.kind() != TokenKind.ACCESS || claims.sessionId() == null) {
                return;
            }
            // both tokens of a pair share their issue instant
            Instant refreshExpiresAt = claims.issuedAt().plusMillis(jwtTokenService.getRefreshTokenTtlMillis());
            if (isExpired(refreshExpiresAt)) {
                return;
            }
            revocationRegistry.revoke(claims.sessionId(), claims.userId(), RevocationReason.LOGOUT, refreshExpiresAt);
            log.info("User {} logged out", claims.userId());
        } catch (InvalidTokenException e) {
            log.debug("Ignoring logout with unusable access token: {}", e.getReason());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Logout could not be recorded", e);
        }
    }

    /**
     * Invalidates every outstanding refresh token of the user.
     */
    public void logoutAll(Long userId) {
        userAccountRepository.incrementSessionVersion(userId, OffsetDateTime.now(clock));
        log.info("All sessions of user {} ended", userId);
    }

    /**
     * Replaces the password after re-checking the current one. On success all of the
     * user's refresh tokens are invalidated, so every device has to log in again.
     */
    public void changePassword(Long userId, ChangePasswordRequest request) {
        UserAccount user = userAccountRepository.findById(userId)
                .filter(UserAccount::hasUsableCredentials)
                .orElseThrow(AuthenticationFailedException::invalidCredentials);

        if (!verifyStoredPassword(user, request.currentPassword())) {
            log.info("Password change rejected for user {}: current password mismatch", userId);
            throw AuthenticationFailedException.invalidCredentials();
        }

        passwordHasher.checkPolicy(request.newPassword());
        String newHash = passwordHasher.hash(request.newPassword());
        userAccountRepository.updatePasswordHash(userId, newHash, OffsetDateTime.now(clock));
        log.info("Password changed for user {}, other sessions invalidated", userId);
    }

    /**
     * Gate for protected routes. Expired and otherwise invalid tokens produce the
     * same message and differ only in their error code. The account is reloaded on
     * every call, so a deactivated user is locked out before the token expires.
     */
    public JwtAuthenticationPrincipal requireAuth(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw AuthenticationFailedException.authenticationRequired();
        }
        TokenClaims claims;
        try {
            claims = tokenValidator.validate(accessToken, TokenKind.ACCESS);
        } catch (InvalidTokenException e) {
            if (e.getReason() == InvalidTokenException.Reason.EXPIRED) {
                throw AuthenticationFailedException.expiredAccessToken(e);
            }
            throw AuthenticationFailedException.invalidAccessToken(e);
        }
        boolean active = userAccountRepository.findById(claims.userId())
                .map(UserAccount::isActive)
                .orElse(false);
        if (!active) {
            log.info("Access token of user {} rejected: account missing or inactive", claims.userId());
            throw AuthenticationFailedException.authenticationRequired();
        }
        return new JwtAuthenticationPrincipal(claims.userId(), claims.username(), claims.sessionId());
    }

    public UserProfileResponse loadProfile(Long userId) {
        return userAccountRepository.findById(userId)
                .filter(UserAccount::isActive)
                .map(UserProfileResponse::from)
                .orElseThrow(AuthenticationFailedException::authenticationRequired);
    }

    private boolean verifyStoredPassword(UserAccount user, String password) {
        try {
            return passwordHasher.verify(password, user.getPasswordHash());
        } catch (CredentialIntegrityException e) {
            log.error("Password hash of user {} is corrupt: {}", user.getId(), e.getInternalMessage());
            throw e;
        }
    }

    private boolean isExpired(Instant expiresAt) {
        return !clock.instant().isBefore(expiresAt);
    }
}
