package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.tasktracker.backend.modules.auth.domain.RevocationReason;
import com.tasktracker.backend.modules.auth.infrastructure.persistence.RevokedTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only set of revoked refresh-token ids.
 *
 * <p>Tokens stay stateless; this registry is the only server-side record and it
 * only holds tokens that were ended early. Entries are pruned once the token they
 * describe would have expired anyway.
 */
@Service
public class TokenRevocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(TokenRevocationRegistry.class);

    private final RevokedTokenRepository revokedTokenRepository;
    private final Clock clock;

    public TokenRevocationRegistry(RevokedTokenRepository revokedTokenRepository, Clock clock) {
        this.revokedTokenRepository = revokedTokenRepository;
        this.clock = clock;
    }

    /**
     * Revokes the token. Revoking an already revoked token is a no-op.
     */
    @Transactional
    public void revoke(String tokenId, Long userId, RevocationReason reason, Instant expiresAt) {
        tryRevoke(tokenId, userId, reason, expiresAt);
    }

    /**
     * Check-not-revoked and revoke as one statement.
     *
     * @return true if this call revoked the token, false if it was already revoked
     */
    @Transactional
    public boolean tryRevoke(String tokenId, Long userId, RevocationReason reason, Instant expiresAt) {
        int inserted = revokedTokenRepository.insertIfAbsent(
                tokenId,
                userId,
                reason.name(),
                OffsetDateTime.now(clock),
                OffsetDateTime.ofInstant(expiresAt, ZoneOffset.UTC)
        );
        if (inserted > 0) {
            log.debug("Revoked token {} of user {} ({})", tokenId, userId, reason);
            return true;
        }
        return false;
    }

    @Transactional(readOnly = true)
    public boolean isRevoked(String tokenId) {
        return revokedTokenRepository.existsById(tokenId);
    }

    /**
     * Removes entries whose token expired before {@code before}. Safe to run alongside
     * revocations and lookups; a stale entry is harmless, only wasted space.
     *
     * @return number of entries removed
     */
    @Transactional
    public int sweepExpired(Instant before) {
        return revokedTokenRepository.deleteByExpiresAtBefore(OffsetDateTime.ofInstant(before, ZoneOffset.UTC));
    }
}
