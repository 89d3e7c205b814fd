package tech.tollgate.provider.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tollgate.provider.common.Result;
import tech.tollgate.provider.common.errors.OAuthDenial;
import tech.tollgate.provider.common.errors.OAuthErrorKind;
import tech.tollgate.provider.config.OAuthSettings;
import tech.tollgate.provider.oauth.cors.CorsHeaders;
import tech.tollgate.provider.shared.EntityType;
import tech.tollgate.provider.shared.TsidGenerator;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs authorization, token, revocation and introspection requests end to
 * end: validation, issuance, persistence and response assembly.
 *
 * <p>Every call returns a {@link GrantOutcome}; nothing is thrown for a
 * refused request or a store failure. An authorization code is consumed in
 * the store before any token derived from it is created, so a replayed code
 * can never yield a second token, even when the replays race.
 */
@ApplicationScoped
public class GrantOrchestrator {

    private static final Logger LOG = Logger.getLogger(GrantOrchestrator.class);

    public static final String TOKEN_TYPE_BEARER = "Bearer";
    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String PRAGMA = "Pragma";
    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

    private static final String[] AUTHORIZE_PARAMETERS = {
        "response_type", "scope", "state", "code_challenge", "code_challenge_method", "allow"
    };
    private static final String[] TOKEN_PARAMETERS = {
        "grant_type", "code", "redirect_uri", "refresh_token", "code_verifier", "scope", "client_id", "client_secret"
    };
    private static final String[] TOKEN_MANAGEMENT_PARAMETERS = {
        "token", "token_type_hint", "client_id", "client_secret"
    };

    private RequestValidator validator;
    private TokenStore tokenStore;
    private OAuthSettings settings;
    private Clock clock;

    @Inject
    public GrantOrchestrator(RequestValidator validator, TokenStore tokenStore, OAuthSettings settings, Clock clock) {
        this.validator = validator;
        this.tokenStore = tokenStore;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== Authorization Endpoint ====================

    /**
     * Handle an authorization request for an authenticated resource owner.
     *
     * <p>Errors are redirected back to the client with {@code error},
     * {@code error_description} and {@code state}, except when the client or
     * redirect URI cannot be trusted; those are answered with 400 directly.
     * A GET that has not been approved yet answers with the consent details
     * instead of a code, unless the client skips the consent step.
     *
     * @param resourceOwnerId the authenticated user, never null
     */
    public GrantOutcome authorize(GrantRequest request, String resourceOwnerId) {
        Objects.requireNonNull(resourceOwnerId, "resourceOwnerId");
        String clientId = request.parameter("client_id");
        String redirectUri = request.parameter("redirect_uri");
        String state = request.parameter("state");
        transition(GrantState.START, "authorize", clientId);

        String repeatedTarget = request.repeatedParameter("client_id", "redirect_uri");
        if (repeatedTarget != null) {
            return rejectDirectly(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "repeated parameter " + repeatedTarget));
        }
        Result<RedirectTarget> targetResult = validator.validateRedirectTarget(clientId, redirectUri);
        if (targetResult.isFailure()) {
            return rejectDirectly(targetResult.denial());
        }
        RedirectTarget target = targetResult.value();

        String repeated = request.repeatedParameter(AUTHORIZE_PARAMETERS);
        if (repeated != null) {
            return rejectWithRedirect(target.redirectUri(),
                OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "repeated parameter " + repeated), state);
        }

        Result<AuthorizationDecision> result = validator.validateAuthorizationRequest(
            clientId,
            redirectUri,
            request.parameter("response_type"),
            request.parameter("scope"),
            request.parameter("code_challenge"),
            request.parameter("code_challenge_method")
        );
        if (result.isFailure()) {
            return rejectWithRedirect(target.redirectUri(), result.denial(), state);
        }
        AuthorizationDecision decision = result.value();
        transition(GrantState.VALIDATED, "authorize", clientId);

        String allow = request.parameter("allow");
        boolean approved = decision.client().skipAuthorization || Boolean.parseBoolean(allow);
        if (!approved) {
            if (allow == null && "GET".equalsIgnoreCase(request.httpMethod())) {
                transition(GrantState.AWAITING_CONSENT, "authorize", clientId);
                return GrantOutcome.awaitingConsent(GrantResponse.status(200)
                    .body(consentDetails(decision, state))
                    .build());
            }
            LOG.infof("Resource owner %s denied authorization for client %s", resourceOwnerId, clientId);
            return rejectWithRedirect(decision.redirectUri(),
                OAuthDenial.of(OAuthErrorKind.ACCESS_DENIED, "resource owner denied consent"), state);
        }

        Instant now = clock.instant();
        AuthorizationCode code = new AuthorizationCode();
        code.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        code.code = OpaqueTokens.generate();
        code.clientId = decision.client().clientId;
        code.resourceOwnerId = resourceOwnerId;
        code.redirectUri = decision.redirectUri();
        code.redirectUriExplicit = decision.redirectUriExplicit();
        code.scopes.addAll(decision.scopes());
        code.codeChallenge = decision.codeChallenge();
        code.codeChallengeMethod = decision.codeChallengeMethod();
        code.createdAt = now;
        code.expiresAt = now.plus(settings.authorizationCodeExpiry());

        try {
            tokenStore.putCode(code);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to store authorization code %s for client %s", code.id, clientId);
            OAuthDenial denial = OAuthDenial.of(OAuthErrorKind.SERVER_ERROR, "code store failed: " + e.getMessage());
            transition(GrantState.STORE_FAILURE, "authorize", clientId);
            return GrantOutcome.storeFailure(redirectWithError(decision.redirectUri(), denial, state), denial);
        }
        transition(GrantState.ISSUED, "authorize", clientId);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", code.code);
        if (state != null) {
            params.put("state", state);
        }
        LOG.infof("Authorization code %s issued for client %s, resource owner %s", code.id, clientId, resourceOwnerId);
        transition(GrantState.RESPONDED, "authorize", clientId);
        return GrantOutcome.responded(redirect(decision.redirectUri(), params));
    }

    // ==================== Token Endpoint ====================

    /**
     * Exchange an authorization code, refresh token or client credentials for
     * tokens.
     *
     * <p>The CORS header is only added to a successful response, and only when
     * the request carried an {@code Origin} the origin policy allows.
     */
    public GrantOutcome exchangeToken(GrantRequest request) {
        String grantType = request.formField("grant_type");
        transition(GrantState.START, "token", grantType);

        if (!"POST".equalsIgnoreCase(request.httpMethod())) {
            return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "token request must be POST"), false);
        }
        String repeated = request.repeatedParameter(TOKEN_PARAMETERS);
        if (repeated != null) {
            return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "repeated parameter " + repeated), false);
        }
        Result<ClientCredentials> credentialsResult = ClientCredentials.fromRequest(request);
        if (credentialsResult.isFailure()) {
            return rejectToken(credentialsResult.denial(), isBasicAttempt(request));
        }
        ClientCredentials credentials = credentialsResult.value();

        String presented = GrantType.REFRESH_TOKEN.value().equals(grantType)
            ? request.formField("refresh_token")
            : request.formField("code");
        Result<TokenDecision> result = validator.validateTokenRequest(
            grantType,
            credentials,
            presented,
            request.formField("redirect_uri"),
            request.formField("code_verifier"),
            request.formField("scope")
        );
        if (result.isFailure()) {
            revokeFamilyOnReuse(result.denial());
            return rejectToken(result.denial(), credentials.basicAuth());
        }
        TokenDecision decision = result.value();
        OAuthClient client = decision.client();
        transition(GrantState.VALIDATED, "token", client.clientId);

        Instant now = clock.instant();
        AccessToken accessToken;
        RefreshToken refreshToken = null;
        String accessTokenValue = OpaqueTokens.generate();
        String refreshTokenValue = null;

        try {
            if (decision.grantType() == GrantType.AUTHORIZATION_CODE
                    && !tokenStore.consumeCodeAtomic(decision.code().code, now)) {
                LOG.warnf("Authorization code %s was consumed by a concurrent request", decision.code().id);
                return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_GRANT,
                    "code consumed concurrently: " + decision.code().id), credentials.basicAuth());
            }

            String tokenFamily = null;
            String sourceRefreshHash = null;
            RefreshToken rotatedFrom = null;
            if (decision.grantType() == GrantType.REFRESH_TOKEN) {
                RefreshToken previous = decision.refreshToken();
                tokenFamily = previous.tokenFamily;
                if (settings.rotateRefreshTokens()) {
                    refreshTokenValue = OpaqueTokens.generate();
                    rotatedFrom = previous;
                } else {
                    refreshTokenValue = presented;
                    sourceRefreshHash = previous.tokenHash;
                }
            } else if (decision.grantType() != GrantType.CLIENT_CREDENTIALS
                    && client.isGrantTypeAllowed(GrantType.REFRESH_TOKEN)) {
                refreshTokenValue = OpaqueTokens.generate();
                tokenFamily = TsidGenerator.generate(EntityType.TOKEN_FAMILY);
            }

            if (refreshTokenValue != null && sourceRefreshHash == null) {
                refreshToken = newRefreshToken(decision, refreshTokenValue, tokenFamily, now);
                sourceRefreshHash = refreshToken.tokenHash;
            }
            accessToken = newAccessToken(decision, accessTokenValue, sourceRefreshHash, now);
            if (rotatedFrom == null) {
                tokenStore.putTokens(accessToken, refreshToken);
            } else if (!tokenStore.rotateAndPutTokens(rotatedFrom.tokenHash, accessToken, refreshToken, now)) {
                LOG.warnf("Refresh token %s was rotated by a concurrent request", rotatedFrom.id);
                return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_GRANT,
                    "refresh token rotated concurrently: " + rotatedFrom.id), credentials.basicAuth());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to store tokens for client %s", client.clientId);
            transition(GrantState.STORE_FAILURE, "token", client.clientId);
            OAuthDenial denial = OAuthDenial.of(OAuthErrorKind.SERVER_ERROR, "token store failed: " + e.getMessage());
            return GrantOutcome.storeFailure(tokenError(denial, false), denial);
        }
        transition(GrantState.ISSUED, "token", client.clientId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", accessTokenValue);
        body.put("token_type", TOKEN_TYPE_BEARER);
        body.put("expires_in", settings.accessTokenExpiry().toSeconds());
        if (refreshTokenValue != null) {
            body.put("refresh_token", refreshTokenValue);
        }
        body.put("scope", Scopes.format(decision.scopes()));

        LOG.infof("Access token %s issued to client %s via %s", accessToken.id, client.clientId, decision.grantType().value());
        transition(GrantState.RESPONDED, "token", client.clientId);
        return GrantOutcome.responded(withCors(noStore(GrantResponse.status(200)).body(body), request, client.clientId).build());
    }

    // ==================== Revocation Endpoint ====================

    /**
     * Revoke an access or refresh token (RFC 7009). Unknown tokens, and
     * tokens issued to another client, still answer 200.
     */
    public GrantOutcome revoke(GrantRequest request) {
        return withAuthenticatedClient(request, "revoke", (client, token) -> {
            String tokenHash = OpaqueTokens.hash(token);
            boolean owned = tokenStore.findAccessToken(tokenHash).map(t -> t.clientId.equals(client.clientId))
                .or(() -> tokenStore.findRefreshToken(tokenHash).map(t -> t.clientId.equals(client.clientId)))
                .orElse(false);
            if (owned) {
                tokenStore.revoke(tokenHash, clock.instant());
                LOG.infof("Token revoked by client %s", client.clientId);
            } else {
                LOG.debugf("Revocation by client %s ignored: token unknown or not owned", client.clientId);
            }
            return GrantResponse.status(200);
        });
    }

    // ==================== Introspection Endpoint ====================

    /**
     * Report whether an access token is active (RFC 7662). Anything else,
     * including a refresh token, is reported as inactive.
     */
    public GrantOutcome introspect(GrantRequest request) {
        return withAuthenticatedClient(request, "introspect", (client, token) -> {
            Instant now = clock.instant();
            Optional<AccessToken> accessToken = tokenStore.findAccessToken(OpaqueTokens.hash(token))
                .filter(t -> t.isValid(now));
            Map<String, Object> body = new LinkedHashMap<>();
            if (accessToken.isEmpty()) {
                body.put("active", false);
            } else {
                AccessToken t = accessToken.get();
                body.put("active", true);
                body.put("scope", Scopes.format(t.scopes));
                body.put("client_id", t.clientId);
                if (t.resourceOwnerId != null) {
                    body.put("username", t.resourceOwnerId);
                }
                body.put("exp", t.expiresAt.getEpochSecond());
                body.put("token_type", TOKEN_TYPE_BEARER);
            }
            return noStore(GrantResponse.status(200)).body(body);
        });
    }

    @FunctionalInterface
    private interface TokenManagementStep {
        GrantResponse.Builder apply(OAuthClient client, String token);
    }

    private GrantOutcome withAuthenticatedClient(GrantRequest request, String endpoint, TokenManagementStep step) {
        transition(GrantState.START, endpoint, null);
        if (!"POST".equalsIgnoreCase(request.httpMethod())) {
            return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, endpoint + " request must be POST"), false);
        }
        String repeated = request.repeatedParameter(TOKEN_MANAGEMENT_PARAMETERS);
        if (repeated != null) {
            return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "repeated parameter " + repeated), false);
        }
        Result<ClientCredentials> credentialsResult = ClientCredentials.fromRequest(request);
        if (credentialsResult.isFailure()) {
            return rejectToken(credentialsResult.denial(), isBasicAttempt(request));
        }
        ClientCredentials credentials = credentialsResult.value();
        Result<OAuthClient> clientResult = validator.authenticateClient(credentials);
        if (clientResult.isFailure()) {
            return rejectToken(clientResult.denial(), credentials.basicAuth());
        }
        OAuthClient client = clientResult.value();

        String token = request.formField("token");
        if (token == null || token.isBlank()) {
            return rejectToken(OAuthDenial.of(OAuthErrorKind.INVALID_REQUEST, "token missing"), credentials.basicAuth());
        }
        transition(GrantState.VALIDATED, endpoint, client.clientId);

        GrantResponse.Builder response;
        try {
            response = step.apply(client, token);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Token store failed during %s for client %s", endpoint, client.clientId);
            transition(GrantState.STORE_FAILURE, endpoint, client.clientId);
            OAuthDenial denial = OAuthDenial.of(OAuthErrorKind.SERVER_ERROR, endpoint + " failed: " + e.getMessage());
            return GrantOutcome.storeFailure(tokenError(denial, false), denial);
        }
        transition(GrantState.RESPONDED, endpoint, client.clientId);
        return GrantOutcome.responded(withCors(response, request, client.clientId).build());
    }

    // ==================== Helpers ====================

    private AccessToken newAccessToken(TokenDecision decision, String value, String sourceRefreshHash, Instant now) {
        AccessToken token = new AccessToken();
        token.id = TsidGenerator.generate(EntityType.ACCESS_TOKEN);
        token.tokenHash = OpaqueTokens.hash(value);
        token.clientId = decision.client().clientId;
        token.resourceOwnerId = decision.resourceOwnerId();
        token.scopes.addAll(decision.scopes());
        token.createdAt = now;
        token.expiresAt = now.plus(settings.accessTokenExpiry());
        token.sourceRefreshTokenHash = sourceRefreshHash;
        return token;
    }

    private RefreshToken newRefreshToken(TokenDecision decision, String value, String tokenFamily, Instant now) {
        RefreshToken token = new RefreshToken();
        token.id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);
        token.tokenHash = OpaqueTokens.hash(value);
        token.clientId = decision.client().clientId;
        token.resourceOwnerId = decision.resourceOwnerId();
        // A narrowed refresh keeps the breadth of the original grant available.
        token.scopes.addAll(decision.refreshToken() != null ? decision.refreshToken().scopes : decision.scopes());
        token.tokenFamily = tokenFamily;
        token.createdAt = now;
        token.expiresAt = now.plus(settings.refreshTokenExpiry());
        return token;
    }

    private void revokeFamilyOnReuse(OAuthDenial denial) {
        Object family = denial.details().get(OAuthDenial.TOKEN_FAMILY);
        if (family == null) {
            return;
        }
        try {
            int revoked = tokenStore.revokeTokenFamily(family.toString(), clock.instant());
            LOG.warnf("Refresh token reuse: revoked %d tokens in family %s", revoked, family);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to revoke refresh token family %s", family);
        }
    }

    private GrantResponse.Builder withCors(GrantResponse.Builder response, GrantRequest request, String clientId) {
        String origin = request.origin();
        if (origin == null) {
            return response;
        }
        if (settings.corsRequireHttps() && !CorsHeaders.isHttps(origin)) {
            LOG.debugf("CORS: Ignoring non-https origin %s for client %s", origin, clientId);
            return response;
        }
        if (validator.isOriginAllowed(clientId, origin)) {
            return CorsHeaders.allowOrigin(response, origin);
        }
        return response;
    }

    private GrantOutcome rejectDirectly(OAuthDenial denial) {
        logDenial(denial);
        transition(GrantState.REJECTED, "authorize", null);
        return GrantOutcome.rejected(GrantResponse.status(400).body(denial.toBody()).build(), denial);
    }

    private GrantOutcome rejectWithRedirect(String redirectUri, OAuthDenial denial, String state) {
        logDenial(denial);
        transition(GrantState.REJECTED, "authorize", null);
        return GrantOutcome.rejected(redirectWithError(redirectUri, denial, state), denial);
    }

    private GrantOutcome rejectToken(OAuthDenial denial, boolean basicAuth) {
        logDenial(denial);
        transition(GrantState.REJECTED, "token", null);
        return GrantOutcome.rejected(tokenError(denial, basicAuth), denial);
    }

    private GrantResponse tokenError(OAuthDenial denial, boolean basicAuth) {
        GrantResponse.Builder response = noStore(GrantResponse.status(denial.httpStatus())).body(denial.toBody());
        if (denial.kind() == OAuthErrorKind.INVALID_CLIENT && basicAuth) {
            response.header(WWW_AUTHENTICATE, "Basic realm=\"oauth\"");
        }
        return response.build();
    }

    private GrantResponse redirectWithError(String redirectUri, OAuthDenial denial, String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", denial.error());
        params.put("error_description", denial.description());
        if (state != null) {
            params.put("state", state);
        }
        return redirect(redirectUri, params);
    }

    private GrantResponse redirect(String redirectUri, Map<String, String> params) {
        StringBuilder url = new StringBuilder(redirectUri);
        char separator = redirectUri.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            url.append(separator).append(param.getKey()).append('=').append(urlEncode(param.getValue()));
            separator = '&';
        }
        return GrantResponse.status(302).header(GrantResponse.LOCATION, url.toString()).build();
    }

    private Map<String, Object> consentDetails(AuthorizationDecision decision, String state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("client_id", decision.client().clientId);
        body.put("client_name", decision.client().name);
        body.put("redirect_uri", decision.redirectUri());
        body.put("scope", Scopes.format(decision.scopes()));
        if (state != null) {
            body.put("state", state);
        }
        return body;
    }

    private static GrantResponse.Builder noStore(GrantResponse.Builder response) {
        return response.header(CACHE_CONTROL, "no-store").header(PRAGMA, "no-cache");
    }

    private static boolean isBasicAttempt(GrantRequest request) {
        String authorization = request.header(GrantRequest.AUTHORIZATION);
        return authorization != null && authorization.regionMatches(true, 0, "Basic ", 0, 6);
    }

    private void logDenial(OAuthDenial denial) {
        LOG.infof("Grant request refused: %s (%s)", denial.error(), denial.detail());
    }

    private void transition(GrantState state, String endpoint, String subject) {
        LOG.debugf("%s %s -> %s", endpoint, subject != null ? subject : "-", state);
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
