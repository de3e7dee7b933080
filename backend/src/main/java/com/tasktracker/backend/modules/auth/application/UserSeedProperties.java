package com.tasktracker.backend.modules.auth.application;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.seed")
public record UserSeedProperties(boolean enabled, List<SeedUser> users) {

    public UserSeedProperties {
        users = users == null ? List.of() : List.copyOf(users);
    }

    public record SeedUser(String username, String email, String password) {
    }
}
