package tech.tollgate.provider.oauth;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Authorization code issued by the authorize step.
 *
 * Authorization codes are:
 * - Short-lived (default: 60 seconds)
 * - Single-use (consumed by the first successful exchange)
 * - Bound to client, resource owner, redirect URI, scopes and PKCE challenge
 */
public class AuthorizationCode {

    public String id;

    /**
     * The opaque code value handed to the client.
     */
    public String code;

    public String clientId;

    public String resourceOwnerId;

    /**
     * Redirect URI the code was issued for. The exchange must present the
     * identical string.
     */
    public String redirectUri;

    /**
     * Whether the authorization request named the redirect URI itself rather
     * than relying on the client's single registered one.
     */
    public boolean redirectUriExplicit = true;

    public Set<String> scopes = new LinkedHashSet<>();

    /**
     * PKCE code challenge, null when the request carried none.
     */
    public String codeChallenge;

    /**
     * PKCE challenge method (S256 or plain).
     */
    public String codeChallengeMethod;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean consumed = false;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !consumed && !isExpired(now);
    }

    public AuthorizationCode copy() {
        AuthorizationCode copy = new AuthorizationCode();
        copy.id = id;
        copy.code = code;
        copy.clientId = clientId;
        copy.resourceOwnerId = resourceOwnerId;
        copy.redirectUri = redirectUri;
        copy.redirectUriExplicit = redirectUriExplicit;
        copy.scopes = new LinkedHashSet<>(scopes);
        copy.codeChallenge = codeChallenge;
        copy.codeChallengeMethod = codeChallengeMethod;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.consumed = consumed;
        return copy;
    }
}
