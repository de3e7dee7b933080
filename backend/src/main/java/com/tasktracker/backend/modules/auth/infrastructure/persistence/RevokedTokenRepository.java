package com.tasktracker.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.tasktracker.backend.modules.auth.domain.RevokedToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RevokedTokenRepository extends JpaRepository<RevokedToken, String> {

    /**
     * Records a revocation unless the token id is already present.
     *
     * @return 1 if this call inserted the row, 0 if the token was already revoked.
     *         Concurrent callers for the same token id never both see 1.
     */
    @Modifying
    @Query(value = """
            insert into revoked_token (token_id, user_id, reason, revoked_at, expires_at)
            values (:tokenId, :userId, :reason, :revokedAt, :expiresAt)
            on conflict (token_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("tokenId") String tokenId,
                       @Param("userId") Long userId,
                       @Param("reason") String reason,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying
    @Query("delete from RevokedToken rt where rt.expiresAt < :cutoff")
    int deleteByExpiresAtBefore(@Param("cutoff") OffsetDateTime cutoff);
}
