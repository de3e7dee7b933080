package com.tasktracker.backend.modules.auth.presentation;

import java.time.Duration;

import com.tasktracker.backend.global.security.BearerTokenResolver;
import com.tasktracker.backend.modules.auth.presentation.dto.TokenPairResponse;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Mirrors issued tokens into HttpOnly cookies for browser clients. Cookie lifetimes
 * follow the token lifetimes.
 */
@Component
public class AuthCookieWriter {

    private final boolean secure;
    private final String sameSite;

    public AuthCookieWriter(
            @Value("${app.auth.cookie.secure:false}") boolean secure,
            @Value("${app.auth.cookie.same-site:Lax}") String sameSite
    ) {
        this.secure = secure;
        this.sameSite = sameSite;
    }

    public void writeTokens(HttpServletResponse response, TokenPairResponse tokens) {
        addCookie(response, BearerTokenResolver.ACCESS_TOKEN_COOKIE, tokens.accessToken(),
                Duration.ofSeconds(tokens.expiresIn()));
        addCookie(response, BearerTokenResolver.REFRESH_TOKEN_COOKIE, tokens.refreshToken(),
                Duration.ofSeconds(tokens.refreshExpiresIn()));
    }

    public void clearTokens(HttpServletResponse response) {
        addCookie(response, BearerTokenResolver.ACCESS_TOKEN_COOKIE, "", Duration.ZERO);
        addCookie(response, BearerTokenResolver.REFRESH_TOKEN_COOKIE, "", Duration.ZERO);
    }

    private void addCookie(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(sameSite)
                .path("/")
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
