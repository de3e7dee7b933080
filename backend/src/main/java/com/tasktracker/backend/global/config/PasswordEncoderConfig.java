package com.tasktracker.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class PasswordEncoderConfig {

    // cost factor; each +1 doubles the work per hash
    @Bean
    public PasswordEncoder passwordEncoder(@Value("${app.auth.password-hashing.strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
