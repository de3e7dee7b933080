package com.tasktracker.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.tasktracker.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        Long id,
        String username,
        String email,
        boolean isActive,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(UserAccount user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isActive(),
                user.getCreatedAt()
        );
    }
}
