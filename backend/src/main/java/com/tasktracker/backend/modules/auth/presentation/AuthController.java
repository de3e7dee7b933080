package com.tasktracker.backend.modules.auth.presentation;

import com.tasktracker.backend.global.security.BearerTokenResolver;
import com.tasktracker.backend.global.security.JwtAuthenticationPrincipal;
import com.tasktracker.backend.modules.auth.application.AuthService;
import com.tasktracker.backend.modules.auth.application.exception.SessionExpiredException;
import com.tasktracker.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.tasktracker.backend.modules.auth.presentation.dto.LogoutRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.RefreshRequest;
import com.tasktracker.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.tasktracker.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Login, token rotation and password management")
public class AuthController {

    private final AuthService authService;
    private final BearerTokenResolver tokenResolver;
    private final AuthCookieWriter cookieWriter;

    public AuthController(AuthService authService, BearerTokenResolver tokenResolver, AuthCookieWriter cookieWriter) {
        this.authService = authService;
        this.tokenResolver = tokenResolver;
        this.cookieWriter = cookieWriter;
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Issues an access/refresh token pair and sets them as HttpOnly cookies.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "400", description = "Missing username or password"),
            @ApiResponse(responseCode = "401", description = "Invalid username or password"),
            @ApiResponse(responseCode = "503", description = "Password hashing capacity exhausted, retry later")
    })
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletResponse response) {
        LoginResponse result = authService.login(request);
        cookieWriter.writeTokens(response, result.tokens());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate tokens", description = "Exchanges a refresh token for a new pair. Each refresh token works once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair"),
            @ApiResponse(responseCode = "401", description = "Session expired, log in again")
    })
    public ResponseEntity<TokenPairResponse> refresh(
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse response
    ) {
        String refreshToken = tokenResolver
                .resolveRefreshToken(httpRequest, request != null ? request.refreshToken() : null)
                .orElseThrow(SessionExpiredException::new);
        TokenPairResponse tokens = authService.refresh(refreshToken);
        cookieWriter.writeTokens(response, tokens);
        return ResponseEntity.ok(tokens);
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Ends the current session. Always succeeds.")
    @ApiResponse(responseCode = "204", description = "Logged out")
    public ResponseEntity<Void> logout(
            @RequestBody(required = false) LogoutRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse response
    ) {
        String bodyToken = request != null ? request.refreshToken() : null;
        tokenResolver.resolveRefreshToken(httpRequest, bodyToken).ifPresent(authService::logout);
        tokenResolver.resolveAccessToken(httpRequest).ifPresent(authService::logoutByAccessToken);
        cookieWriter.clearTokens(response);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/logout-all")
    @Operation(summary = "Log out everywhere", description = "Invalidates every refresh token of the caller.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "All sessions ended"),
            @ApiResponse(responseCode = "401", description = "Authentication required")
    })
    public ResponseEntity<Void> logoutAll(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            HttpServletResponse response
    ) {
        authService.logoutAll(principal.userId());
        cookieWriter.clearTokens(response);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change password", description = "Other sessions must log in again afterwards.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "New password violates the password policy"),
            @ApiResponse(responseCode = "401", description = "Current password is wrong or not authenticated")
    })
    public ResponseEntity<Void> changePassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        authService.changePassword(principal.userId(), request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    @Operation(summary = "Current user")
    public ResponseEntity<UserProfileResponse> me(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}
