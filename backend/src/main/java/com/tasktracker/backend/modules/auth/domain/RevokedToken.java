package com.tasktracker.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Entry in the revocation registry, keyed by the refresh token's {@code jti}.
 * Rows are append-only; they are deleted once {@code expiresAt} has passed because
 * the token would be rejected on expiry anyway.
 */
@Entity
@Table(name = "revoked_token", indexes = {
        @Index(name = "idx_revoked_token_expires_at", columnList = "expires_at")
})
public class RevokedToken {

    @Id
    @Column(name = "token_id", nullable = false, updatable = false, length = 64)
    private String tokenId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private RevocationReason reason;

    @Column(name = "revoked_at", nullable = false)
    private OffsetDateTime revokedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    protected RevokedToken() {
    }

    public RevokedToken(String tokenId, Long userId, RevocationReason reason, OffsetDateTime revokedAt, OffsetDateTime expiresAt) {
        this.tokenId = tokenId;
        this.userId = userId;
        this.reason = reason;
        this.revokedAt = revokedAt;
        this.expiresAt = expiresAt;
    }

    public String getTokenId() {
        return tokenId;
    }

    public Long getUserId() {
        return userId;
    }

    public RevocationReason getReason() {
        return reason;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}
