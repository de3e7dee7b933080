package com.tasktracker.backend.modules.auth.application;

import com.tasktracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the configured seed users on startup when they do not exist yet.
 * Intended for local and demo environments.
 */
@Component
@ConditionalOnProperty(value = "app.seed.enabled", havingValue = "true")
public class UserAccountSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(UserAccountSeeder.class);

    private final UserSeedProperties properties;
    private final UserAccountRepository userAccountRepository;
    private final UserAccountService userAccountService;

    public UserAccountSeeder(
            UserSeedProperties properties,
            UserAccountRepository userAccountRepository,
            UserAccountService userAccountService
    ) {
        this.properties = properties;
        this.userAccountRepository = userAccountRepository;
        this.userAccountService = userAccountService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        for (UserSeedProperties.SeedUser seed : properties.users()) {
            if (userAccountRepository.existsByUsername(seed.username())) {
                continue;
            }
            userAccountService.createAccount(seed.username(), seed.email(), seed.password());
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} user account(s)", created);
        }
    }
}
