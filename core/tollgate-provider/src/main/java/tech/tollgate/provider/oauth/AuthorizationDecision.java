package tech.tollgate.provider.oauth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Approved authorization request, ready to be turned into a code.
 */
public record AuthorizationDecision(
    OAuthClient client,
    String redirectUri,
    boolean redirectUriExplicit,
    Set<String> scopes,
    String codeChallenge,
    String codeChallengeMethod
) {

    public AuthorizationDecision {
        scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }
}
