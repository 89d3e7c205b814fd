package tech.tollgate.provider.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tollgate.provider.common.Result;
import tech.tollgate.provider.common.errors.OAuthDenial;
import tech.tollgate.provider.common.errors.OAuthErrorKind;
import tech.tollgate.provider.config.OAuthSettings;
import tech.tollgate.provider.oauth.cors.OriginPolicy;
import tech.tollgate.provider.security.ClientSecretHasher;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether authorization and token requests may proceed.
 *
 * <p>The validator only reads from the registry and the store; it never
 * issues, consumes or revokes anything. Every refusal is returned as a
 * {@link Result.Failure} whose {@link OAuthDenial#detail()} names the check
 * that failed. The wire error derived from the denial kind is deliberately
 * generic, so the detail is for logs only.
 */
@ApplicationScoped
public class RequestValidator {

    private static final Logger LOG = Logger.getLogger(RequestValidator.class);

    static final String RESPONSE_TYPE_CODE = "code";

    private ClientRegistry clientRegistry;
    private TokenStore tokenStore;
    private OriginPolicy originPolicy;
    private ClientSecretHasher secretHasher;
    private PkceService pkceService;
    private OAuthSettings settings;
    private Clock clock;

    @Inject
    public RequestValidator(ClientRegistry clientRegistry,
                            TokenStore tokenStore,
                            OriginPolicy originPolicy,
                            ClientSecretHasher secretHasher,
                            PkceService pkceService,
                            OAuthSettings settings,
                            Clock clock) {
        this.clientRegistry = clientRegistry;
        this.tokenStore = tokenStore;
        this.originPolicy = originPolicy;
        this.secretHasher = secretHasher;
        this.pkceService = pkceService;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== Authorization Requests ====================

    /**
     * Resolve the client and redirect URI of an authorization request.
     *
     * <p>Until this succeeds, nothing about the request can be trusted enough
     * to redirect to, so callers render its failures directly.
     */
    public Result<RedirectTarget> validateRedirectTarget(String clientId, String redirectUri) {
        if (isBlank(clientId)) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST, "client_id missing");
        }
        Optional<OAuthClient> clientOpt = findActiveClient(clientId);
        if (clientOpt.isEmpty()) {
            LOG.warnf("Authorization request with unknown client_id: %s", clientId);
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "unknown or inactive client " + clientId);
        }
        OAuthClient client = clientOpt.get();

        String resolved = redirectUri;
        boolean explicit = true;
        if (isBlank(redirectUri)) {
            if (client.redirectUris.size() != 1) {
                return Result.failure(OAuthErrorKind.INVALID_REDIRECT_URI,
                    "redirect_uri omitted and client " + clientId + " has " + client.redirectUris.size() + " registered");
            }
            resolved = client.redirectUris.get(0);
            explicit = false;
        } else if (!client.isRedirectUriAllowed(redirectUri)) {
            LOG.warnf("Authorization request with invalid redirect_uri: %s for client %s", redirectUri, clientId);
            return Result.failure(OAuthErrorKind.INVALID_REDIRECT_URI, "redirect_uri not registered: " + redirectUri);
        }

        if (!isAllowedScheme(resolved)) {
            LOG.warnf("Authorization request with disallowed redirect_uri scheme: %s for client %s", resolved, clientId);
            return Result.failure(OAuthErrorKind.INVALID_REDIRECT_URI, "redirect_uri scheme not allowed: " + resolved);
        }
        return Result.success(new RedirectTarget(client, resolved, explicit));
    }

    /**
     * Validate an authorization code request.
     *
     * @param requestedScope space-delimited scope, null for the default scopes
     * @param codeChallengeMethod null means "plain"
     */
    public Result<AuthorizationDecision> validateAuthorizationRequest(String clientId,
                                                                      String redirectUri,
                                                                      String responseType,
                                                                      String requestedScope,
                                                                      String codeChallenge,
                                                                      String codeChallengeMethod) {
        return validateRedirectTarget(clientId, redirectUri).flatMap(target -> {
            OAuthClient client = target.client();

            if (isBlank(responseType)) {
                return Result.failure(OAuthErrorKind.INVALID_REQUEST, "response_type missing");
            }
            if (!RESPONSE_TYPE_CODE.equals(responseType)) {
                return Result.failure(OAuthErrorKind.UNSUPPORTED_RESPONSE_TYPE,
                    "response_type not supported: " + responseType);
            }
            if (!client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE)) {
                return Result.failure(OAuthErrorKind.UNAUTHORIZED_CLIENT,
                    "client " + clientId + " may not use authorization_code");
            }

            Set<String> scopes = requestedScope == null ? settings.defaultScopes() : Scopes.parse(requestedScope);
            if (scopes.isEmpty()) {
                return Result.failure(OAuthErrorKind.INVALID_SCOPE, "empty scope requested");
            }
            Set<String> permitted = client.permittedScopes(settings.scopes());
            if (!Scopes.isSubset(scopes, permitted)) {
                return Result.failure(OAuthErrorKind.INVALID_SCOPE,
                    "requested " + scopes + " exceeds permitted " + permitted);
            }

            boolean pkceNeeded = settings.pkceRequired() || client.isPublic();
            String method = null;
            if (codeChallenge != null || pkceNeeded) {
                if (isBlank(codeChallenge)) {
                    return Result.failure(OAuthErrorKind.INVALID_REQUEST, "code_challenge required");
                }
                method = codeChallengeMethod == null ? PkceService.METHOD_PLAIN : codeChallengeMethod;
                if (!pkceService.isSupportedMethod(method)) {
                    return Result.failure(OAuthErrorKind.INVALID_REQUEST,
                        "code_challenge_method not supported: " + method);
                }
                if (!pkceService.isValidCodeChallenge(codeChallenge)) {
                    return Result.failure(OAuthErrorKind.INVALID_REQUEST, "code_challenge malformed");
                }
            }

            return Result.success(new AuthorizationDecision(
                client,
                target.redirectUri(),
                target.explicit(),
                scopes,
                codeChallenge,
                method
            ));
        });
    }

    // ==================== Client Authentication ====================

    /**
     * Authenticate the client of a token, revocation or introspection request.
     *
     * <p>A confidential client must present its secret. A public client must
     * not present one.
     */
    public Result<OAuthClient> authenticateClient(ClientCredentials credentials) {
        if (credentials == null || isBlank(credentials.clientId())) {
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "no client credentials presented");
        }
        String clientId = credentials.clientId();
        Optional<OAuthClient> clientOpt = findActiveClient(clientId);
        if (clientOpt.isEmpty()) {
            LOG.infof("Token request failed: client_id not found: %s", clientId);
            secretHasher.verifyDecoy(credentials.clientSecret());
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "unknown or inactive client " + clientId);
        }
        OAuthClient client = clientOpt.get();

        if (client.isPublic()) {
            if (credentials.clientSecret() != null) {
                LOG.warnf("Public client %s presented a client secret", clientId);
                return Result.failure(OAuthErrorKind.INVALID_CLIENT, "public client presented a secret");
            }
            return Result.success(client);
        }

        if (isBlank(credentials.clientSecret())) {
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "confidential client " + clientId + " presented no secret");
        }
        if (!secretHasher.verify(credentials.clientSecret(), client.clientSecretHash)) {
            LOG.warnf("Invalid client secret for OAuth client: %s", clientId);
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "client secret mismatch for " + clientId);
        }
        return Result.success(client);
    }

    // ==================== Token Requests ====================

    /**
     * Validate a token request.
     *
     * @param codeOrRefreshToken the code for authorization_code, the refresh token
     *                           for refresh_token, ignored for client_credentials
     * @param requestedScope     optional; may only narrow what the grant allows
     */
    public Result<TokenDecision> validateTokenRequest(String grantType,
                                                      ClientCredentials credentials,
                                                      String codeOrRefreshToken,
                                                      String redirectUri,
                                                      String codeVerifier,
                                                      String requestedScope) {
        if (isBlank(grantType)) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST, "grant_type missing");
        }
        Optional<GrantType> typeOpt = GrantType.fromValue(grantType);
        if (typeOpt.isEmpty()) {
            return Result.failure(OAuthErrorKind.UNSUPPORTED_GRANT_TYPE, "grant_type not supported: " + grantType);
        }
        GrantType type = typeOpt.get();

        return authenticateClient(credentials).flatMap(client -> {
            if (!client.isGrantTypeAllowed(type)) {
                LOG.warnf("%s grant not allowed for OAuth client: %s", type.value(), client.clientId);
                return Result.failure(OAuthErrorKind.UNAUTHORIZED_GRANT,
                    "client " + client.clientId + " may not use " + type.value());
            }
            return switch (type) {
                case AUTHORIZATION_CODE -> validateCodeGrant(client, codeOrRefreshToken, redirectUri, codeVerifier, requestedScope);
                case REFRESH_TOKEN -> validateRefreshGrant(client, codeOrRefreshToken, requestedScope);
                case CLIENT_CREDENTIALS -> validateClientCredentialsGrant(client, requestedScope);
            };
        });
    }

    private Result<TokenDecision> validateCodeGrant(OAuthClient client,
                                                    String codeValue,
                                                    String redirectUri,
                                                    String codeVerifier,
                                                    String requestedScope) {
        if (isBlank(codeValue)) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST, "code missing");
        }
        Optional<AuthorizationCode> codeOpt = tokenStore.findCode(codeValue);
        if (codeOpt.isEmpty()) {
            LOG.warn("Token request with invalid authorization code");
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "code not found");
        }
        AuthorizationCode code = codeOpt.get();
        Instant now = clock.instant();

        if (code.consumed) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "code already consumed: " + code.id);
        }
        if (code.isExpired(now)) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "code expired: " + code.id);
        }
        if (!code.clientId.equals(client.clientId)) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT,
                "code " + code.id + " issued to " + code.clientId + ", presented by " + client.clientId);
        }
        if (redirectUri == null) {
            if (code.redirectUriExplicit) {
                return Result.failure(OAuthErrorKind.INVALID_GRANT, "redirect_uri required for code " + code.id);
            }
        } else if (!redirectUri.equals(code.redirectUri)) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "redirect_uri differs from issuance for code " + code.id);
        }
        if (code.codeChallenge != null) {
            if (codeVerifier == null) {
                return Result.failure(OAuthErrorKind.INVALID_GRANT, "code_verifier missing for code " + code.id);
            }
            if (!pkceService.verifyCodeChallenge(codeVerifier, code.codeChallenge, code.codeChallengeMethod)) {
                LOG.warnf("PKCE verification failed for client %s", client.clientId);
                return Result.failure(OAuthErrorKind.INVALID_GRANT, "code_verifier mismatch for code " + code.id);
            }
        }

        return narrowScopes(code.scopes, requestedScope).map(scopes ->
            new TokenDecision(GrantType.AUTHORIZATION_CODE, client, code.resourceOwnerId, scopes, code, null));
    }

    private Result<TokenDecision> validateRefreshGrant(OAuthClient client, String refreshTokenValue, String requestedScope) {
        if (isBlank(refreshTokenValue)) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST, "refresh_token missing");
        }
        Optional<RefreshToken> tokenOpt = tokenStore.findRefreshToken(OpaqueTokens.hash(refreshTokenValue));
        if (tokenOpt.isEmpty()) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "refresh token not found");
        }
        RefreshToken token = tokenOpt.get();

        if (!token.clientId.equals(client.clientId)) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT,
                "refresh token " + token.id + " issued to " + token.clientId + ", presented by " + client.clientId);
        }
        if (token.isRotatedAway()) {
            LOG.warnf("Refresh token reuse detected for client %s, token family %s", client.clientId, token.tokenFamily);
            return Result.failure(new OAuthDenial(
                OAuthErrorKind.INVALID_GRANT,
                "rotated refresh token " + token.id + " presented again",
                Map.of(OAuthDenial.TOKEN_FAMILY, token.tokenFamily)
            ));
        }
        if (token.revoked) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "refresh token revoked: " + token.id);
        }
        if (token.isExpired(clock.instant())) {
            return Result.failure(OAuthErrorKind.INVALID_GRANT, "refresh token expired: " + token.id);
        }

        return narrowScopes(token.scopes, requestedScope).map(scopes ->
            new TokenDecision(GrantType.REFRESH_TOKEN, client, token.resourceOwnerId, scopes, null, token));
    }

    private Result<TokenDecision> validateClientCredentialsGrant(OAuthClient client, String requestedScope) {
        if (!client.isConfidential()) {
            return Result.failure(OAuthErrorKind.UNAUTHORIZED_CLIENT,
                "client_credentials requires a confidential client: " + client.clientId);
        }
        Set<String> permitted = client.permittedScopes(settings.scopes());
        Set<String> scopes = requestedScope == null ? settings.defaultScopes() : Scopes.parse(requestedScope);
        if (scopes.isEmpty() || !Scopes.isSubset(scopes, permitted)) {
            return Result.failure(OAuthErrorKind.INVALID_SCOPE,
                "requested " + scopes + " exceeds permitted " + permitted);
        }
        return Result.success(new TokenDecision(GrantType.CLIENT_CREDENTIALS, client, client.ownerId, scopes, null, null));
    }

    /**
     * A token request may repeat or narrow the granted scopes, never widen them.
     */
    private Result<Set<String>> narrowScopes(Set<String> granted, String requestedScope) {
        if (requestedScope == null) {
            return Result.success(granted);
        }
        Set<String> requested = Scopes.parse(requestedScope);
        if (requested.isEmpty() || !Scopes.isSubset(requested, granted)) {
            return Result.failure(OAuthErrorKind.INVALID_SCOPE,
                "requested " + requested + " exceeds granted " + granted);
        }
        return Result.success(requested);
    }

    // ==================== CORS ====================

    /**
     * Ask the origin policy whether {@code origin} may read responses for
     * {@code clientId}. An absent origin is never allowed and the policy is
     * not consulted for it. A failing policy counts as a refusal.
     */
    public boolean isOriginAllowed(String clientId, String origin) {
        if (isBlank(origin)) {
            return false;
        }
        try {
            return originPolicy.isOriginAllowed(clientId, origin);
        } catch (RuntimeException e) {
            LOG.errorf(e, "CORS: Origin policy failed for client %s, origin %s", clientId, origin);
            return false;
        }
    }

    // ==================== Helpers ====================

    private Optional<OAuthClient> findActiveClient(String clientId) {
        return clientRegistry.findClient(clientId).filter(client -> client.active);
    }

    private boolean isAllowedScheme(String redirectUri) {
        try {
            String scheme = new URI(redirectUri).getScheme();
            return scheme != null && settings.allowedRedirectUriSchemes().contains(scheme.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            LOG.debugf("Unparseable redirect_uri %s: %s", redirectUri, e.getMessage());
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
