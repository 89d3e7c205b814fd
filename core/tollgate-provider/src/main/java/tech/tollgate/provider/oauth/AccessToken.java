package tech.tollgate.provider.oauth;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Issued access token. Only the SHA-256 hash of the bearer value is stored.
 */
public class AccessToken {

    public String id;

    public String tokenHash;

    public String clientId;

    /**
     * Null only when a client_credentials client has no owning user.
     */
    public String resourceOwnerId;

    public Set<String> scopes = new LinkedHashSet<>();

    public Instant createdAt;

    public Instant expiresAt;

    /**
     * Hash of the refresh token issued together with this access token, if any.
     * Revoking that refresh token revokes this access token too.
     */
    public String sourceRefreshTokenHash;

    public boolean revoked = false;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !revoked && !isExpired(now);
    }

    public AccessToken copy() {
        AccessToken copy = new AccessToken();
        copy.id = id;
        copy.tokenHash = tokenHash;
        copy.clientId = clientId;
        copy.resourceOwnerId = resourceOwnerId;
        copy.scopes = new LinkedHashSet<>(scopes);
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.sourceRefreshTokenHash = sourceRefreshTokenHash;
        copy.revoked = revoked;
        return copy;
    }
}
