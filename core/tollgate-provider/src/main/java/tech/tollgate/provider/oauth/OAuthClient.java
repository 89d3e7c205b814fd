package tech.tollgate.provider.oauth;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * OAuth2 client registration.
 *
 * <p>Supports two client types:
 * <ul>
 *   <li>PUBLIC: For SPAs and mobile apps (no secret, PKCE required)</li>
 *   <li>CONFIDENTIAL: For server-side apps (authenticates with a secret)</li>
 * </ul>
 *
 * <p>Registrations are created and removed by an external management
 * surface; the provider only reads them.
 */
public class OAuthClient {

    /**
     * Public client identifier used in OAuth flows.
     */
    public String clientId;

    /**
     * Human-readable name, shown on consent screens.
     */
    public String name;

    public ClientType clientType = ClientType.CONFIDENTIAL;

    /**
     * Argon2id hash of the client secret (CONFIDENTIAL clients only).
     * Never logged.
     */
    public String clientSecretHash;

    /**
     * Registered redirect URIs. Matched by exact string comparison.
     */
    public List<String> redirectUris = new ArrayList<>();

    /**
     * Allowed grant types.
     */
    public Set<GrantType> grantTypes = new LinkedHashSet<>();

    /**
     * Scopes this client may request. Empty means the provider-wide scope set.
     */
    public Set<String> allowedScopes = new LinkedHashSet<>();

    /**
     * CORS origins for browser-based clients. Only consulted when the
     * client-allowed-origins origin policy is active.
     */
    public List<String> allowedOrigins = new ArrayList<>();

    /**
     * The user that owns this registration. Client credentials tokens are
     * issued on this user's behalf.
     */
    public String ownerId;

    /**
     * Trusted first-party clients skip the consent step.
     */
    public boolean skipAuthorization = false;

    public boolean active = true;

    public OAuthClient() {
    }

    public boolean isRedirectUriAllowed(String uri) {
        if (redirectUris == null || uri == null) {
            return false;
        }
        return redirectUris.contains(uri);
    }

    public boolean isOriginAllowed(String origin) {
        if (allowedOrigins == null || origin == null) {
            return false;
        }
        return allowedOrigins.contains(origin);
    }

    public boolean isGrantTypeAllowed(GrantType grantType) {
        if (grantTypes == null || grantType == null) {
            return false;
        }
        return grantTypes.contains(grantType);
    }

    public boolean isPublic() {
        return clientType == ClientType.PUBLIC;
    }

    public boolean isConfidential() {
        return clientType == ClientType.CONFIDENTIAL;
    }

    /**
     * Scopes this client may be granted, falling back to the provider-wide set.
     */
    public Set<String> permittedScopes(Set<String> providerScopes) {
        if (allowedScopes == null || allowedScopes.isEmpty()) {
            return providerScopes;
        }
        return allowedScopes;
    }

    public OAuthClient copy() {
        OAuthClient copy = new OAuthClient();
        copy.clientId = clientId;
        copy.name = name;
        copy.clientType = clientType;
        copy.clientSecretHash = clientSecretHash;
        copy.redirectUris = new ArrayList<>(redirectUris);
        copy.grantTypes = new LinkedHashSet<>(grantTypes);
        copy.allowedScopes = new LinkedHashSet<>(allowedScopes);
        copy.allowedOrigins = new ArrayList<>(allowedOrigins);
        copy.ownerId = ownerId;
        copy.skipAuthorization = skipAuthorization;
        copy.active = active;
        return copy;
    }

    public enum ClientType {
        /**
         * Public client (SPA, mobile app).
         * No client secret, PKCE required.
         */
        PUBLIC,

        /**
         * Confidential client (server-side app).
         * Has client secret.
         */
        CONFIDENTIAL
    }
}
