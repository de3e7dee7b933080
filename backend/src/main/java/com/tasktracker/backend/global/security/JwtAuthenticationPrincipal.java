package com.tasktracker.backend.global.security;

/**
 * The authenticated caller of a request. {@code sessionId} is the id of the refresh
 * token issued together with the access token that authenticated the request.
 */
public record JwtAuthenticationPrincipal(Long userId, String username, String sessionId) {
}
