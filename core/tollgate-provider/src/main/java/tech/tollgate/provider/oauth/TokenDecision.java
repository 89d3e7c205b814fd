package tech.tollgate.provider.oauth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Approved token request. Exactly one of {@code code} and
 * {@code refreshToken} is set for the authorization_code and refresh_token
 * grants; neither is set for client_credentials.
 *
 * @param resourceOwnerId the user the tokens act for, may be null for client_credentials
 * @param scopes          scopes to grant, already narrowed to what was requested
 */
public record TokenDecision(
    GrantType grantType,
    OAuthClient client,
    String resourceOwnerId,
    Set<String> scopes,
    AuthorizationCode code,
    RefreshToken refreshToken
) {

    public TokenDecision {
        scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }
}
