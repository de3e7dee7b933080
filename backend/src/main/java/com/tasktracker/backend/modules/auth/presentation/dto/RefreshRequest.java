package com.tasktracker.backend.modules.auth.presentation.dto;

/**
 * Body of {@code /auth/refresh}. The token may be omitted when it travels in the
 * {@code refresh_token} cookie instead.
 */
public record RefreshRequest(String refreshToken) {
}
