package com.tasktracker.backend.global.security;

import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * Finds tokens on an incoming request. Clients may use the Authorization header or
 * the HttpOnly cookies set at login; the explicit header wins when both are sent.
 */
@Component
public class BearerTokenResolver {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";

    private static final String BEARER_PREFIX = "Bearer ";

    public Optional<String> resolveAccessToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return StringUtils.hasText(token) ? Optional.of(token) : Optional.empty();
        }
        return cookieValue(request, ACCESS_TOKEN_COOKIE);
    }

    /**
     * @param bodyValue refresh token sent in the JSON body, may be null
     */
    public Optional<String> resolveRefreshToken(HttpServletRequest request, String bodyValue) {
        if (StringUtils.hasText(bodyValue)) {
            return Optional.of(bodyValue.trim());
        }
        return cookieValue(request, REFRESH_TOKEN_COOKIE);
    }

    private Optional<String> cookieValue(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || !StringUtils.hasText(cookie.getValue())) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }
}
