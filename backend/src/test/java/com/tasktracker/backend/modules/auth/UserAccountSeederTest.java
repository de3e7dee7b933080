package com.tasktracker.backend.modules.auth;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import com.tasktracker.backend.modules.auth.application.UserAccountSeeder;
import com.tasktracker.backend.modules.auth.application.UserAccountService;
import com.tasktracker.backend.modules.auth.application.UserSeedProperties;
import com.tasktracker.backend.modules.auth.application.UserSeedProperties.SeedUser;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class UserAccountSeederTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private UserAccountService userAccountService;

    @Test
    void createsOnlyMissingUsers() {
        UserSeedProperties properties = new UserSeedProperties(true, List.of(
                new SeedUser("user1", "user1@example.com", "correctpw"),
                new SeedUser("user2", "user2@example.com", "correctpw")
        ));
        when(userAccountRepository.existsByUsername("user1")).thenReturn(true);
        when(userAccountRepository.existsByUsername("user2")).thenReturn(false);

        new UserAccountSeeder(properties, userAccountRepository, userAccountService)
                .run(new DefaultApplicationArguments());

        verify(userAccountService, never()).createAccount("user1", "user1@example.com", "correctpw");
        verify(userAccountService).createAccount("user2", "user2@example.com", "correctpw");
    }

    @Test
    void nothingConfiguredMeansNothingCreated() {
        new UserAccountSeeder(new UserSeedProperties(true, null), userAccountRepository, userAccountService)
                .run(new DefaultApplicationArguments());

        verify(userAccountService, never()).createAccount(anyString(), anyString(), anyString());
    }
}
