package com.tasktracker.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.tasktracker.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Credential store. Both updates are single-row statements, so they are atomic
 * without any application-level locking.
 */
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    // case sensitive on purpose: "Alice" and "alice" are different accounts
    Optional<UserAccount> findByUsername(String username);

    boolean existsByUsername(String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            update UserAccount ua
               set ua.passwordHash = :passwordHash,
                   ua.sessionVersion = ua.sessionVersion + 1,
                   ua.updatedAt = :updatedAt
             where ua.id = :userId
            """)
    int updatePasswordHash(@Param("userId") Long userId,
                           @Param("passwordHash") String passwordHash,
                           @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            update UserAccount ua
               set ua.sessionVersion = ua.sessionVersion + 1,
                   ua.updatedAt = :updatedAt
             where ua.id = :userId
            """)
    int incrementSessionVersion(@Param("userId") Long userId,
                                @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            update UserAccount ua
               set ua.active = false,
                   ua.sessionVersion = ua.sessionVersion + 1,
                   ua.updatedAt = :updatedAt
             where ua.id = :userId
            """)
    int deactivate(@Param("userId") Long userId,
                   @Param("updatedAt") OffsetDateTime updatedAt);
}
