package com.tasktracker.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.tasktracker.backend.global.security.JwtAuthenticationPrincipal;
import com.tasktracker.backend.modules.auth.application.AuthService;
import com.tasktracker.backend.modules.auth.application.JwtTokenService;
import com.tasktracker.backend.modules.auth.application.PasswordHasher;
import com.tasktracker.backend.modules.auth.application.TokenRevocationRegistry;
import com.tasktracker.backend.modules.auth.application.TokenValidator;
import com.tasktracker.backend.modules.auth.application.exception.AuthenticationFailedException;
import com.tasktracker.backend.modules.auth.application.exception.CredentialIntegrityException;
import com.tasktracker.backend.modules.auth.application.exception.CredentialValidationException;
import com.tasktracker.backend.modules.auth.application.exception.SessionExpiredException;
import com.tasktracker.backend.modules.auth.domain.RevocationReason;
import com.tasktracker.backend.modules.auth.domain.UserAccount;
import com.tasktracker.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.RevokedTokenRepository;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.tasktracker.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.tasktracker.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.tasktracker.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final String PASSWORD = "correct-horse";

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private RevokedTokenRepository revokedTokenRepository;

    private final Map<String, RevocationReason> revoked = new HashMap<>();
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);

    private MutableClock clock;
    private AuthService authService;
    private UserAccount alice;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        PasswordHasher passwordHasher = new PasswordHasher(encoder, Runnable::run, Duration.ofSeconds(5));
        JwtTokenService jwtTokenService = new JwtTokenService(
                new JwtTokenProvider(JwtTokenServiceTest.SECRET), 1_800_000L, 604_800_000L, clock);
        TokenRevocationRegistry registry = new TokenRevocationRegistry(revokedTokenRepository, clock);
        TokenValidator tokenValidator = new TokenValidator(jwtTokenService, registry, clock);
        authService = new AuthService(userAccountRepository, passwordHasher, jwtTokenService, tokenValidator, registry, clock);

        alice = new UserAccount("alice", "alice@example.com", encoder.encode(PASSWORD));
        ReflectionTestUtils.setField(alice, "id", 1L);

        lenient().when(userAccountRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        lenient().when(userAccountRepository.findById(1L)).thenReturn(Optional.of(alice));
        lenient().when(userAccountRepository.updatePasswordHash(eq(1L), anyString(), any())).thenAnswer(invocation -> {
            ReflectionTestUtils.setField(alice, "passwordHash", invocation.getArgument(1));
            bumpSessionVersion();
            return 1;
        });
        lenient().when(userAccountRepository.incrementSessionVersion(eq(1L), any())).thenAnswer(invocation -> {
            bumpSessionVersion();
            return 1;
        });
        lenient().when(revokedTokenRepository.insertIfAbsent(anyString(), anyLong(), anyString(), any(), any()))
                .thenAnswer(invocation -> revoked.putIfAbsent(invocation.getArgument(0),
                        RevocationReason.valueOf(invocation.getArgument(2))) == null ? 1 : 0);
        lenient().when(revokedTokenRepository.existsById(anyString()))
                .thenAnswer(invocation -> revoked.containsKey(invocation.<String>getArgument(0)));
    }

    @Test
    void loginIssuesUsablePair() {
        LoginResponse response = authService.login(new LoginRequest("alice", PASSWORD));

        assertThat(response.user().username()).isEqualTo("alice");
        assertThat(response.tokens().tokenType()).isEqualTo("Bearer");
        assertThat(response.tokens().expiresIn()).isEqualTo(1800);
        assertThat(response.tokens().refreshExpiresIn()).isEqualTo(604800);

        JwtAuthenticationPrincipal principal = authService.requireAuth(response.tokens().accessToken());
        assertThat(principal.userId()).isEqualTo(1L);
        assertThat(principal.username()).isEqualTo("alice");
        assertThat(principal.sessionId()).isNotBlank();
    }

    @Test
    @DisplayName("login failures look the same whatever went wrong")
    void loginFailuresAreIndistinguishable() {
        UserAccount inactive = new UserAccount("carol", "carol@example.com", encoder.encode(PASSWORD));
        inactive.setActive(false);
        lenient().when(userAccountRepository.findByUsername("carol")).thenReturn(Optional.of(inactive));

        AuthenticationFailedException wrongPassword = loginFailure("alice", "wrong-password");
        AuthenticationFailedException unknownUser = loginFailure("mallory", PASSWORD);
        AuthenticationFailedException inactiveUser = loginFailure("carol", PASSWORD);
        AuthenticationFailedException wrongCase = loginFailure("Alice", PASSWORD);

        for (AuthenticationFailedException ex : new AuthenticationFailedException[]{unknownUser, inactiveUser, wrongCase}) {
            assertThat(ex.getCode()).isEqualTo(wrongPassword.getCode()).isEqualTo(AuthenticationFailedException.INVALID_CREDENTIALS);
            assertThat(ex.getDetailMessage()).isEqualTo(wrongPassword.getDetailMessage());
            assertThat(ex.getHttpStatus()).isEqualTo(wrongPassword.getHttpStatus());
        }
    }

    @Test
    void corruptStoredHashIsAnIntegrityError() {
        ReflectionTestUtils.setField(alice, "passwordHash", "not-a-bcrypt-digest");

        assertThatThrownBy(() -> authService.login(new LoginRequest("alice", PASSWORD)))
                .isInstanceOf(CredentialIntegrityException.class);
    }

    @Test
    void refreshRotatesAndOldTokenStopsWorking() {
        TokenPairResponse first = login().tokens();

        TokenPairResponse second = authService.refresh(first.refreshToken());

        assertThat(second.refreshToken()).isNotEqualTo(first.refreshToken());
        assertThat(second.accessToken()).isNotEqualTo(first.accessToken());
        assertThat(revoked).containsValue(RevocationReason.ROTATED);
        assertThatThrownBy(() -> authService.refresh(first.refreshToken()))
                .isInstanceOf(SessionExpiredException.class);
        assertThat(authService.refresh(second.refreshToken()).refreshToken()).isNotBlank();
    }

    @Test
    void refreshRejectsEverythingButALiveRefreshToken() {
        TokenPairResponse tokens = login().tokens();

        assertThatThrownBy(() -> authService.refresh(tokens.accessToken())).isInstanceOf(SessionExpiredException.class);
        assertThatThrownBy(() -> authService.refresh("garbage")).isInstanceOf(SessionExpiredException.class);
        assertThatThrownBy(() -> authService.refresh("")).isInstanceOf(SessionExpiredException.class);

        clock.advance(Duration.ofDays(7));
        assertThatThrownBy(() -> authService.refresh(tokens.refreshToken())).isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void refreshForDeactivatedAccountFailsAndRevokesToken() {
        TokenPairResponse tokens = login().tokens();
        alice.setActive(false);

        assertThatThrownBy(() -> authService.refresh(tokens.refreshToken())).isInstanceOf(SessionExpiredException.class);
        assertThat(revoked).containsValue(RevocationReason.EXPLICIT_INVALIDATION);
    }

    @Test
    void logoutRevokesRefreshTokenAndIsIdempotent() {
        TokenPairResponse tokens = login().tokens();

        authService.logout(tokens.refreshToken());
        authService.logout(tokens.refreshToken());

        assertThat(revoked).containsValue(RevocationReason.LOGOUT);
        assertThatThrownBy(() -> authService.refresh(tokens.refreshToken())).isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void logoutNeverFails() {
        TokenPairResponse tokens = login().tokens();

        assertThatCode(() -> authService.logout(null)).doesNotThrowAnyException();
        assertThatCode(() -> authService.logout("garbage")).doesNotThrowAnyException();
        assertThatCode(() -> authService.logout(tokens.accessToken())).doesNotThrowAnyException();

        clock.advance(Duration.ofDays(8));
        assertThatCode(() -> authService.logout(tokens.refreshToken())).doesNotThrowAnyException();
        assertThat(revoked).isEmpty();
    }

    @Test
    void logoutSurvivesRegistryOutage() {
        TokenPairResponse tokens = login().tokens();
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(revokedTokenRepository).insertIfAbsent(anyString(), anyLong(), anyString(), any(), any());

        assertThatCode(() -> authService.logout(tokens.refreshToken())).doesNotThrowAnyException();
    }

    @Test
    void logoutSurvivesUnavailableTransactionManager() {
        TokenPairResponse tokens = login().tokens();
        doThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"))
                .when(revokedTokenRepository).insertIfAbsent(anyString(), anyLong(), anyString(), any(), any());

        assertThatCode(() -> authService.logout(tokens.refreshToken())).doesNotThrowAnyException();
        assertThatCode(() -> authService.logoutByAccessToken(tokens.accessToken())).doesNotThrowAnyException();
    }

    @Test
    void logoutWithAccessTokenEndsItsSession() {
        TokenPairResponse tokens = login().tokens();

        authService.logoutByAccessToken(tokens.accessToken());

        assertThatThrownBy(() -> authService.refresh(tokens.refreshToken())).isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void accessTokenStaysValidUntilExpiryAfterLogout() {
        TokenPairResponse tokens = login().tokens();

        authService.logout(tokens.refreshToken());

        assertThat(authService.requireAuth(tokens.accessToken()).userId()).isEqualTo(1L);
    }

    @Test
    void logoutAllInvalidatesEveryRefreshToken() {
        TokenPairResponse phone = login().tokens();
        TokenPairResponse laptop = login().tokens();

        authService.logoutAll(1L);

        assertThatThrownBy(() -> authService.refresh(phone.refreshToken())).isInstanceOf(SessionExpiredException.class);
        assertThatThrownBy(() -> authService.refresh(laptop.refreshToken())).isInstanceOf(SessionExpiredException.class);
        assertThat(login().tokens().refreshToken()).isNotBlank();
    }

    @Test
    void changePasswordRequiresCurrentPassword() {
        assertThatThrownBy(() -> authService.changePassword(1L, new ChangePasswordRequest("wrong-password", "new-password-1")))
                .isInstanceOf(AuthenticationFailedException.class)
                .extracting("code").isEqualTo(AuthenticationFailedException.INVALID_CREDENTIALS);
        verify(userAccountRepository, never()).updatePasswordHash(anyLong(), anyString(), any());
    }

    @Test
    void changePasswordRejectsShortPasswordAndKeepsOldOne() {
        assertThatThrownBy(() -> authService.changePassword(1L, new ChangePasswordRequest(PASSWORD, "short")))
                .isInstanceOf(CredentialValidationException.class)
                .extracting("code").isEqualTo(CredentialValidationException.PASSWORD_TOO_SHORT);

        verify(userAccountRepository, never()).updatePasswordHash(anyLong(), anyString(), any());
        assertThat(authService.login(new LoginRequest("alice", PASSWORD)).user().id()).isEqualTo(1L);
    }

    @Test
    void changePasswordSwapsCredentialsAndEndsOtherSessions() {
        TokenPairResponse before = login().tokens();

        authService.changePassword(1L, new ChangePasswordRequest(PASSWORD, "new-password-1"));

        assertThat(loginFailure("alice", PASSWORD).getCode()).isEqualTo(AuthenticationFailedException.INVALID_CREDENTIALS);
        assertThat(authService.login(new LoginRequest("alice", "new-password-1")).user().username()).isEqualTo("alice");
        assertThatThrownBy(() -> authService.refresh(before.refreshToken())).isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void requireAuthReportsExpiredAndInvalidWithSameMessage() {
        TokenPairResponse tokens = login().tokens();

        AuthenticationFailedException missing = authFailure("  ");
        AuthenticationFailedException wrongKind = authFailure(tokens.refreshToken());
        AuthenticationFailedException garbage = authFailure("garbage");
        clock.advance(Duration.ofMinutes(30));
        AuthenticationFailedException expired = authFailure(tokens.accessToken());

        assertThat(missing.getCode()).isEqualTo(AuthenticationFailedException.AUTHENTICATION_REQUIRED);
        assertThat(wrongKind.getCode()).isEqualTo(AuthenticationFailedException.ACCESS_TOKEN_INVALID);
        assertThat(garbage.getCode()).isEqualTo(AuthenticationFailedException.ACCESS_TOKEN_INVALID);
        assertThat(expired.getCode()).isEqualTo(AuthenticationFailedException.ACCESS_TOKEN_EXPIRED);
        assertThat(expired.getDetailMessage()).isEqualTo(garbage.getDetailMessage());
    }

    @Test
    void requireAuthRejectsDeactivatedAccountBeforeTokenExpires() {
        TokenPairResponse tokens = login().tokens();
        assertThat(authService.requireAuth(tokens.accessToken()).userId()).isEqualTo(1L);

        alice.setActive(false);
        bumpSessionVersion();

        AuthenticationFailedException rejected = authFailure(tokens.accessToken());
        assertThat(rejected.getCode()).isEqualTo(AuthenticationFailedException.AUTHENTICATION_REQUIRED);
    }

    @Test
    void requireAuthRejectsDeletedAccount() {
        TokenPairResponse tokens = login().tokens();
        lenient().when(userAccountRepository.findById(1L)).thenReturn(Optional.empty());

        assertThat(authFailure(tokens.accessToken()).getCode())
                .isEqualTo(AuthenticationFailedException.AUTHENTICATION_REQUIRED);
    }

    @Test
    void loadProfileRequiresActiveAccount() {
        assertThat(authService.loadProfile(1L).email()).isEqualTo("alice@example.com");

        alice.setActive(false);

        assertThatThrownBy(() -> authService.loadProfile(1L))
                .isInstanceOf(AuthenticationFailedException.class)
                .extracting("code").isEqualTo(AuthenticationFailedException.AUTHENTICATION_REQUIRED);
    }

    @Test
    @DisplayName("login, use, rotate, reuse, logout, refresh")
    void fullSessionLifecycle() {
        TokenPairResponse first = login().tokens();
        assertThat(authService.requireAuth(first.accessToken()).userId()).isEqualTo(1L);

        clock.advance(Duration.ofMinutes(10));
        TokenPairResponse second = authService.refresh(first.refreshToken());
        assertThat(authService.requireAuth(second.accessToken()).userId()).isEqualTo(1L);

        assertThatThrownBy(() -> authService.refresh(first.refreshToken())).isInstanceOf(SessionExpiredException.class);

        authService.logout(second.refreshToken());
        assertThatThrownBy(() -> authService.refresh(second.refreshToken())).isInstanceOf(SessionExpiredException.class);
    }

    private LoginResponse login() {
        return authService.login(new LoginRequest("alice", PASSWORD));
    }

    private AuthenticationFailedException loginFailure(String username, String password) {
        try {
            authService.login(new LoginRequest(username, password));
        } catch (AuthenticationFailedException ex) {
            return ex;
        }
        throw new AssertionError("login of '" + username + "' should have failed");
    }

    private AuthenticationFailedException authFailure(String token) {
        try {
            authService.requireAuth(token);
        } catch (AuthenticationFailedException ex) {
            return ex;
        }
        throw new AssertionError("token should have been rejected");
    }

    private void bumpSessionVersion() {
        ReflectionTestUtils.setField(alice, "sessionVersion", alice.getSessionVersion() + 1);
    }
}
