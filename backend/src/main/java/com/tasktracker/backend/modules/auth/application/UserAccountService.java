package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.tasktracker.backend.modules.auth.domain.UserAccount;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Account lifecycle operations the authentication flows depend on but do not own:
 * provisioning (seeding, admin tooling) and deactivation.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final Clock clock;

    public UserAccountService(UserAccountRepository userAccountRepository, PasswordHasher passwordHasher, Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.clock = clock;
    }

    @Transactional
    public UserAccount createAccount(String username, String email, String rawPassword) {
        if (userAccountRepository.existsByUsername(username)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "USERNAME_TAKEN");
        }
        passwordHasher.checkPolicy(rawPassword);
        UserAccount account = userAccountRepository.save(new UserAccount(username, email, passwordHasher.hash(rawPassword)));
        log.info("Created account {} for '{}'", account.getId(), username);
        return account;
    }

    /**
     * Marks the account inactive. Login fails from now on and every outstanding
     * refresh token stops working; access tokens lapse at their natural expiry.
     */
    public void deactivate(Long userId) {
        int updated = userAccountRepository.deactivate(userId, OffsetDateTime.now(clock));
        if (updated == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        log.info("Deactivated account {}", userId);
    }
}
