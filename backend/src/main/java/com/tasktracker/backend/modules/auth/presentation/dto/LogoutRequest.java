package com.tasktracker.backend.modules.auth.presentation.dto;

public record LogoutRequest(String refreshToken) {
}
