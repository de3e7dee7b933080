package com.tasktracker.backend.modules.auth.domain;

/**
 * Why a refresh token was revoked before its natural expiry.
 *
 * <ul>
 *   <li>LOGOUT: the user ended the session.</li>
 *   <li>ROTATED: the token was exchanged for a new pair and is single use.</li>
 *   <li>EXPLICIT_INVALIDATION: the server ended the session, e.g. after a password
 *   change or deactivation made the token stale.</li>
 * </ul>
 */
public enum RevocationReason {
    LOGOUT,
    ROTATED,
    EXPLICIT_INVALIDATION
}
