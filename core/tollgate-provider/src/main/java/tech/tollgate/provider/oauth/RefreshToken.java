package tech.tollgate.provider.oauth;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stores refresh tokens for long-lived grants.
 *
 * Features:
 * - Token rotation: Each use issues a new refresh token
 * - Family tracking: All tokens in a family are invalidated on reuse detection
 * - Revocation: Tokens can be explicitly revoked
 *
 * Security: Only the token hash is stored, not the actual token.
 */
public class RefreshToken {

    public String id;

    /**
     * SHA-256 hash of the refresh token.
     */
    public String tokenHash;

    public String clientId;

    public String resourceOwnerId;

    /**
     * Scopes of the original grant. A refresh may narrow but never widen them.
     */
    public Set<String> scopes = new LinkedHashSet<>();

    /**
     * Token family for refresh token rotation.
     *
     * All tokens in a family are invalidated if reuse is detected
     * (i.e., an old token is used after a newer one was issued).
     */
    public String tokenFamily;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean revoked = false;

    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one (for rotation tracking).
     */
    public String replacedBy;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !revoked && !isExpired(now);
    }

    /**
     * A revoked token that was replaced by rotation is being presented again.
     */
    public boolean isRotatedAway() {
        return revoked && replacedBy != null;
    }

    public RefreshToken copy() {
        RefreshToken copy = new RefreshToken();
        copy.id = id;
        copy.tokenHash = tokenHash;
        copy.clientId = clientId;
        copy.resourceOwnerId = resourceOwnerId;
        copy.scopes = new LinkedHashSet<>(scopes);
        copy.tokenFamily = tokenFamily;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.revoked = revoked;
        copy.revokedAt = revokedAt;
        copy.replacedBy = replacedBy;
        return copy;
    }
}
