package tech.tollgate.provider.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tollgate.provider.common.errors.OAuthErrorKind;
import tech.tollgate.provider.config.OAuthSettings;
import tech.tollgate.provider.oauth.OAuthFixtures.MutableClock;
import tech.tollgate.provider.oauth.cors.CorsHeaders;
import tech.tollgate.provider.oauth.cors.OriginPolicy;
import tech.tollgate.provider.oauth.memory.InMemoryClientRegistry;
import tech.tollgate.provider.oauth.memory.InMemoryTokenStore;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static tech.tollgate.provider.oauth.OAuthFixtures.*;

/**
 * Unit tests for GrantOrchestrator.
 * Drives complete grants through the real validator and in-memory store.
 */
class GrantOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
    private static final String STATE = "random_state_string";

    private InMemoryClientRegistry registry;
    private InMemoryTokenStore store;
    private OriginPolicy originPolicy;
    private MutableClock clock;
    private OAuthSettings settings;
    private GrantOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryClientRegistry();
        store = new InMemoryTokenStore();
        originPolicy = mock(OriginPolicy.class);
        clock = new MutableClock(NOW);
        settings = OAuthSettings.builder()
            .allowedRedirectUriSchemes(List.of("https"))
            .pkceRequired(false)
            .build();
        orchestrator = orchestrator(store, settings);

        registry.register(confidentialClient("app"));
    }

    private GrantOrchestrator orchestrator(TokenStore tokenStore, OAuthSettings settings) {
        RequestValidator validator = new RequestValidator(
            registry, tokenStore, originPolicy, HASHER, new PkceService(), settings, clock);
        return new GrantOrchestrator(validator, tokenStore, settings, clock);
    }

    // ========================================
    // AUTHORIZE
    // ========================================

    @Test
    @DisplayName("authorize should redirect with a code and echo state unchanged")
    void authorize_shouldRedirectWithCodeAndState() {
        String state = "a b&c=d/é";
        GrantOutcome outcome = orchestrator.authorize(approvedAuthorization("app", "read write", state).build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.RESPONDED);
        assertThat(outcome.response().status()).isEqualTo(302);
        Map<String, String> query = redirectQuery(outcome);
        assertThat(query.get("code")).isNotBlank();
        assertThat(query.get("state")).isEqualTo(state);

        AuthorizationCode code = store.findCode(query.get("code")).orElseThrow();
        assertThat(code.clientId).isEqualTo("app");
        assertThat(code.resourceOwnerId).isEqualTo(RESOURCE_OWNER);
        assertThat(code.scopes).containsExactly("read", "write");
        assertThat(code.expiresAt).isEqualTo(NOW.plusSeconds(60));
        assertThat(code.id).startsWith("acd_");
    }

    @Test
    @DisplayName("authorize should append to a redirect URI that already has a query")
    void authorize_shouldAppendToExistingQuery() {
        OAuthClient client = confidentialClient("query");
        client.redirectUris = new ArrayList<>(List.of("https://example.org/cb?tenant=1"));
        registry.register(client);

        GrantOutcome outcome = orchestrator.authorize(post()
            .form("client_id", "query")
            .form("response_type", "code")
            .form("allow", "true")
            .build(), RESOURCE_OWNER);

        assertThat(location(outcome)).startsWith("https://example.org/cb?tenant=1&code=");
    }

    @Test
    @DisplayName("authorize should answer 400 without redirecting when the redirect URI is not registered")
    void authorize_shouldNotRedirect_whenRedirectUriUntrusted() {
        GrantOutcome outcome = orchestrator.authorize(post()
            .form("client_id", "app")
            .form("response_type", "code")
            .form("redirect_uri", CLIENT_URI + "/")
            .form("state", STATE)
            .form("allow", "true")
            .build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.REJECTED);
        assertThat(outcome.response().status()).isEqualTo(400);
        assertThat(outcome.response().hasHeader("Location")).isFalse();
        assertThat(outcome.response().body()).containsEntry("error", "invalid_request");
    }

    @Test
    @DisplayName("authorize should answer 400 for an unknown client")
    void authorize_shouldNotRedirect_whenClientUnknown() {
        GrantOutcome outcome = orchestrator.authorize(approvedAuthorization("ghost").build(), RESOURCE_OWNER);

        assertThat(outcome.response().status()).isEqualTo(400);
        assertThat(outcome.response().body()).containsEntry("error", "invalid_client");
    }

    @Test
    @DisplayName("authorize should redirect other errors with error, description and state")
    void authorize_shouldRedirectErrors_whenTargetTrusted() {
        GrantOutcome outcome = orchestrator.authorize(
            approvedAuthorization("app", "read admin", STATE).build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.REJECTED);
        assertThat(outcome.denial().kind()).isEqualTo(OAuthErrorKind.INVALID_SCOPE);
        Map<String, String> query = redirectQuery(outcome);
        assertThat(query).containsEntry("error", "invalid_scope");
        assertThat(query).containsKey("error_description");
        assertThat(query).containsEntry("state", STATE);
        assertThat(query.get("error_description")).doesNotContain("admin");
    }

    @Test
    @DisplayName("authorize should reject repeated parameters")
    void authorize_shouldRejectRepeatedParameters() {
        GrantOutcome outcome = orchestrator.authorize(approvedAuthorization("app")
            .form("scope", "read")
            .build(), RESOURCE_OWNER);

        assertThat(redirectQuery(outcome)).containsEntry("error", "invalid_request");
    }

    @Test
    @DisplayName("authorize should return the consent details for an unapproved GET")
    void authorize_shouldAwaitConsent_forUnapprovedGet() {
        GrantOutcome outcome = orchestrator.authorize(get()
            .query("client_id", "app")
            .query("response_type", "code")
            .query("redirect_uri", CLIENT_URI)
            .query("state", STATE)
            .build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.AWAITING_CONSENT);
        assertThat(outcome.response().status()).isEqualTo(200);
        assertThat(outcome.response().body())
            .containsEntry("client_id", "app")
            .containsEntry("scope", "read write")
            .containsEntry("state", STATE);
    }

    @Test
    @DisplayName("authorize should issue a code straight away for clients that skip consent")
    void authorize_shouldSkipConsent_whenClientTrusted() {
        OAuthClient client = confidentialClient("trusted");
        client.skipAuthorization = true;
        registry.register(client);

        GrantOutcome outcome = orchestrator.authorize(get()
            .query("client_id", "trusted")
            .query("response_type", "code")
            .build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.RESPONDED);
        assertThat(redirectQuery(outcome)).containsKey("code");
    }

    @Test
    @DisplayName("authorize should redirect access_denied when the user declines")
    void authorize_shouldRedirectAccessDenied_whenUserDeclines() {
        GrantOutcome outcome = orchestrator.authorize(post()
            .form("client_id", "app")
            .form("response_type", "code")
            .form("redirect_uri", CLIENT_URI)
            .form("state", STATE)
            .form("allow", "false")
            .build(), RESOURCE_OWNER);

        assertThat(redirectQuery(outcome))
            .containsEntry("error", "access_denied")
            .containsEntry("state", STATE);
    }

    @Test
    @DisplayName("authorize should redirect server_error when the code cannot be stored")
    void authorize_shouldReportStoreFailure() {
        TokenStore failing = mock(TokenStore.class);
        doThrow(new TokenStoreException("disk full")).when(failing).putCode(any());

        GrantOutcome outcome = orchestrator(failing, settings).authorize(approvedAuthorization("app").build(), RESOURCE_OWNER);

        assertThat(outcome.state()).isEqualTo(GrantState.STORE_FAILURE);
        assertThat(redirectQuery(outcome)).containsEntry("error", "server_error");
    }

    // ========================================
    // TOKEN EXCHANGE
    // ========================================

    @Test
    @DisplayName("exchangeToken should issue access and refresh tokens for a valid code")
    void exchangeToken_shouldIssueTokens() {
        String code = authorize("app");

        GrantOutcome outcome = orchestrator.exchangeToken(exchange(code).build());

        assertThat(outcome.state()).isEqualTo(GrantState.RESPONDED);
        GrantResponse response = outcome.response();
        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body())
            .containsEntry("token_type", "Bearer")
            .containsEntry("expires_in", 36000L)
            .containsEntry("scope", "read write")
            .containsKeys("access_token", "refresh_token");
        assertThat(response.header("Cache-Control")).isEqualTo("no-store");
        assertThat(response.header("Pragma")).isEqualTo("no-cache");

        AccessToken stored = store.findAccessToken(OpaqueTokens.hash((String) response.body().get("access_token"))).orElseThrow();
        assertThat(stored.resourceOwnerId).isEqualTo(RESOURCE_OWNER);
        assertThat(stored.sourceRefreshTokenHash)
            .isEqualTo(OpaqueTokens.hash((String) response.body().get("refresh_token")));
    }

    @Test
    @DisplayName("exchangeToken should not issue a refresh token to clients without the refresh grant")
    void exchangeToken_shouldOmitRefreshToken_whenGrantNotAllowed() {
        OAuthClient client = confidentialClient("short");
        client.grantTypes.remove(GrantType.REFRESH_TOKEN);
        registry.register(client);
        String code = authorize("short");

        GrantOutcome outcome = orchestrator.exchangeToken(post()
            .basicAuth("short", CLIENT_SECRET)
            .form("grant_type", "authorization_code")
            .form("code", code)
            .form("redirect_uri", CLIENT_URI)
            .build());

        assertThat(outcome.response().body()).containsKey("access_token").doesNotContainKey("refresh_token");
    }

    @Test
    @DisplayName("exchangeToken should refuse a replayed code and issue nothing more")
    void exchangeToken_shouldRejectReplay() {
        String code = authorize("app");
        orchestrator.exchangeToken(exchange(code).build());

        GrantOutcome replay = orchestrator.exchangeToken(exchange(code).build());

        assertThat(replay.state()).isEqualTo(GrantState.REJECTED);
        assertThat(replay.response().status()).isEqualTo(400);
        assertThat(replay.response().body()).containsEntry("error", "invalid_grant");
    }

    @Test
    @DisplayName("exchangeToken should let only one of many concurrent exchanges of a code succeed")
    void exchangeToken_shouldHaveSingleWinner_underConcurrentReplay() throws Exception {
        String code = authorize("app");
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<GrantOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return orchestrator.exchangeToken(exchange(code).build());
                }));
            }
            start.countDown();

            int issued = 0;
            for (Future<GrantOutcome> future : futures) {
                GrantOutcome outcome = future.get(30, TimeUnit.SECONDS);
                if (outcome.isSuccess()) {
                    issued++;
                } else {
                    assertThat(outcome.response().body()).containsEntry("error", "invalid_grant");
                }
            }
            assertThat(issued).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("exchangeToken should refuse a redirect URI with a trailing slash")
    void exchangeToken_shouldRejectRedirectUriMismatch() {
        String code = authorize("app");

        GrantOutcome outcome = orchestrator.exchangeToken(post()
            .basicAuth("app", CLIENT_SECRET)
            .form("grant_type", "authorization_code")
            .form("code", code)
            .form("redirect_uri", CLIENT_URI + "/")
            .build());

        assertThat(outcome.response().body()).containsEntry("error", "invalid_grant");
        assertThat(store.findCode(code).orElseThrow().consumed).isFalse();
    }

    @Test
    @DisplayName("exchangeToken should answer 401 invalid_client with a challenge for a wrong Basic secret")
    void exchangeToken_shouldReturn401_whenSecretWrong() {
        String code = authorize("app");

        GrantOutcome outcome = orchestrator.exchangeToken(post()
            .basicAuth("app", "wrong-secret")
            .form("grant_type", "authorization_code")
            .form("code", code)
            .form("redirect_uri", CLIENT_URI)
            .build());

        assertThat(outcome.response().status()).isEqualTo(401);
        assertThat(outcome.response().body()).containsEntry("error", "invalid_client");
        assertThat(outcome.response().header("WWW-Authenticate")).isEqualTo("Basic realm=\"oauth\"");
    }

    @Test
    @DisplayName("exchangeToken should not send a challenge when credentials were in the form")
    void exchangeToken_shouldNotChallenge_whenFormCredentials() {
        GrantOutcome outcome = orchestrator.exchangeToken(post()
            .form("client_id", "app")
            .form("client_secret", "wrong-secret")
            .form("grant_type", "client_credentials")
            .build());

        assertThat(outcome.response().status()).isEqualTo(401);
        assertThat(outcome.response().hasHeader("WWW-Authenticate")).isFalse();
    }

    @Test
    @DisplayName("exchangeToken should refuse an expired code")
    void exchangeToken_shouldRejectExpiredCode() {
        String code = authorize("app");
        clock.advance(Duration.ofSeconds(61));

        assertThat(orchestrator.exchangeToken(exchange(code).build()).response().body())
            .containsEntry("error", "invalid_grant");
    }

    @Test
    @DisplayName("exchangeToken should answer 500 when tokens cannot be stored")
    void exchangeToken_shouldReportStoreFailure() {
        String code = authorize("app");
        TokenStore failing = spy(store);
        doThrow(new TokenStoreException("connection lost")).when(failing).putTokens(any(), any());

        GrantOutcome outcome = orchestrator(failing, settings).exchangeToken(exchange(code).build());

        assertThat(outcome.state()).isEqualTo(GrantState.STORE_FAILURE);
        assertThat(outcome.response().status()).isEqualTo(500);
        assertThat(outcome.response().body()).containsEntry("error", "server_error");
    }

    // ========================================
    // CORS
    // ========================================

    @Test
    @DisplayName("no Access-Control-Allow-Origin header without an Origin header")
    void exchangeToken_shouldOmitCors_whenNoOrigin() {
        when(originPolicy.isOriginAllowed(any(), any())).thenReturn(true);

        GrantOutcome outcome = orchestrator.exchangeToken(exchange(authorize("app")).build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.response().hasHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isFalse();
        verify(originPolicy, never()).isOriginAllowed(any(), any());
    }

    @Test
    @DisplayName("an allowed origin is echoed byte for byte")
    void exchangeToken_shouldEchoAllowedOrigin() {
        when(originPolicy.isOriginAllowed("app", CLIENT_URI)).thenReturn(true);

        GrantOutcome outcome = orchestrator.exchangeToken(exchange(authorize("app")).origin(CLIENT_URI).build());

        assertThat(outcome.response().header(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo(CLIENT_URI);
    }

    @Test
    @DisplayName("a denied origin gets no header and the exchange still succeeds")
    void exchangeToken_shouldOmitCors_whenOriginDenied() {
        GrantOutcome outcome = orchestrator.exchangeToken(exchange(authorize("app")).origin(CLIENT_URI).build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.response().hasHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isFalse();
    }

    @Test
    @DisplayName("a failed exchange gets no CORS header even for an allowed origin")
    void exchangeToken_shouldOmitCors_whenExchangeFails() {
        when(originPolicy.isOriginAllowed(any(), any())).thenReturn(true);

        GrantOutcome outcome = orchestrator.exchangeToken(exchange("unknown-code").origin(CLIENT_URI).build());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.response().hasHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isFalse();
    }

    @Test
    @DisplayName("plain http origins are ignored when https is required")
    void exchangeToken_shouldIgnoreHttpOrigin_whenHttpsRequired() {
        when(originPolicy.isOriginAllowed(any(), any())).thenReturn(true);
        GrantOrchestrator strict = orchestrator(store, settings.toBuilder().corsRequireHttps(true).build());

        GrantOutcome outcome = strict.exchangeToken(exchange(authorize("app")).origin("http://example.org").build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.response().hasHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isFalse();
    }

    // ========================================
    // REFRESH TOKEN
    // ========================================

    @Test
    @DisplayName("refresh should rotate the refresh token and keep it in the same family")
    void refresh_shouldRotateToken() {
        Map<String, Object> first = exchangeTokens();
        String oldRefresh = (String) first.get("refresh_token");

        GrantOutcome outcome = orchestrator.exchangeToken(refresh(oldRefresh).form("scope", "read").build());

        assertThat(outcome.isSuccess()).isTrue();
        String newRefresh = (String) outcome.response().body().get("refresh_token");
        assertThat(newRefresh).isNotEqualTo(oldRefresh);
        assertThat(outcome.response().body()).containsEntry("scope", "read");

        RefreshToken rotated = store.findRefreshToken(OpaqueTokens.hash(oldRefresh)).orElseThrow();
        RefreshToken replacement = store.findRefreshToken(OpaqueTokens.hash(newRefresh)).orElseThrow();
        assertThat(rotated.replacedBy).isEqualTo(replacement.tokenHash);
        assertThat(replacement.tokenFamily).isEqualTo(rotated.tokenFamily);
        assertThat(replacement.scopes).containsExactly("read", "write");
    }

    @Test
    @DisplayName("reusing a rotated refresh token revokes the whole family")
    void refresh_shouldRevokeFamily_whenRotatedTokenReused() {
        String oldRefresh = (String) exchangeTokens().get("refresh_token");
        String newRefresh = (String) orchestrator.exchangeToken(refresh(oldRefresh).build()).response().body().get("refresh_token");

        GrantOutcome reuse = orchestrator.exchangeToken(refresh(oldRefresh).build());

        assertThat(reuse.response().body()).containsEntry("error", "invalid_grant");
        assertThat(store.findRefreshToken(OpaqueTokens.hash(newRefresh)).orElseThrow().revoked).isTrue();
        assertThat(orchestrator.exchangeToken(refresh(newRefresh).build()).response().body())
            .containsEntry("error", "invalid_grant");
    }

    @Test
    @DisplayName("without rotation the same refresh token is returned")
    void refresh_shouldReuseToken_whenRotationDisabled() {
        GrantOrchestrator noRotation = orchestrator(store, settings.toBuilder().rotateRefreshTokens(false).build());
        String refreshToken = (String) exchangeTokens().get("refresh_token");

        GrantOutcome outcome = noRotation.exchangeToken(refresh(refreshToken).build());

        assertThat(outcome.response().body()).containsEntry("refresh_token", refreshToken);
        assertThat(store.findRefreshToken(OpaqueTokens.hash(refreshToken)).orElseThrow().revoked).isFalse();
    }

    @Test
    @DisplayName("a refresh that fails to store its tokens should leave the presented refresh token usable")
    void refresh_shouldLeaveTokenUsable_whenStoreFails() {
        Map<String, Object> tokens = exchangeTokens();
        String refreshToken = (String) tokens.get("refresh_token");
        TokenStore failing = spy(store);
        doThrow(new TokenStoreException("connection lost")).when(failing).putTokens(any(), any());
        doThrow(new TokenStoreException("connection lost")).when(failing).rotateAndPutTokens(any(), any(), any(), any());

        GrantOutcome failed = orchestrator(failing, settings).exchangeToken(refresh(refreshToken).build());

        assertThat(failed.state()).isEqualTo(GrantState.STORE_FAILURE);
        assertThat(failed.response().status()).isEqualTo(500);
        RefreshToken presented = store.findRefreshToken(OpaqueTokens.hash(refreshToken)).orElseThrow();
        assertThat(presented.revoked).isFalse();
        assertThat(presented.replacedBy).isNull();

        GrantOutcome retry = orchestrator.exchangeToken(refresh(refreshToken).build());

        assertThat(retry.isSuccess()).isTrue();
        assertThat(retry.response().body()).containsKey("refresh_token");
        assertThat(introspect((String) tokens.get("access_token"))).containsEntry("active", true);
    }

    @Test
    @DisplayName("only one of many concurrent refreshes with the same token should succeed")
    void refresh_shouldHaveSingleWinner_underConcurrentRefresh() throws Exception {
        String refreshToken = (String) exchangeTokens().get("refresh_token");
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<GrantOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return orchestrator.exchangeToken(refresh(refreshToken).build());
                }));
            }
            start.countDown();

            List<String> issued = new ArrayList<>();
            for (Future<GrantOutcome> future : futures) {
                GrantOutcome outcome = future.get(30, TimeUnit.SECONDS);
                if (outcome.isSuccess()) {
                    issued.add((String) outcome.response().body().get("refresh_token"));
                } else {
                    assertThat(outcome.response().body()).containsEntry("error", "invalid_grant");
                }
            }
            assertThat(issued).hasSize(1);
            RefreshToken rotated = store.findRefreshToken(OpaqueTokens.hash(refreshToken)).orElseThrow();
            assertThat(rotated.replacedBy).isEqualTo(OpaqueTokens.hash(issued.get(0)));
        } finally {
            executor.shutdownNow();
        }
    }

    // ========================================
    // CLIENT CREDENTIALS
    // ========================================

    @Test
    @DisplayName("client_credentials should issue an access token only")
    void clientCredentials_shouldIssueAccessTokenOnly() {
        OAuthClient client = confidentialClient("service");
        client.grantTypes.add(GrantType.CLIENT_CREDENTIALS);
        registry.register(client);

        GrantOutcome outcome = orchestrator.exchangeToken(post()
            .basicAuth("service", CLIENT_SECRET)
            .form("grant_type", "client_credentials")
            .form("scope", "read")
            .build());

        assertThat(outcome.response().status()).isEqualTo(200);
        assertThat(outcome.response().body())
            .containsEntry("scope", "read")
            .doesNotContainKey("refresh_token");
    }

    // ========================================
    // REVOKE AND INTROSPECT
    // ========================================

    @Test
    @DisplayName("revoking a refresh token should also revoke its access token")
    void revoke_shouldRevokeRefreshAndLinkedAccessToken() {
        Map<String, Object> tokens = exchangeTokens();

        GrantOutcome outcome = orchestrator.revoke(post()
            .basicAuth("app", CLIENT_SECRET)
            .form("token", (String) tokens.get("refresh_token"))
            .build());

        assertThat(outcome.response().status()).isEqualTo(200);
        assertThat(introspect((String) tokens.get("access_token"))).containsEntry("active", false);
    }

    @Test
    @DisplayName("revoke should answer 200 for unknown tokens and leave other clients' tokens alone")
    void revoke_shouldIgnoreForeignAndUnknownTokens() {
        registry.register(confidentialClient("other"));
        Map<String, Object> tokens = exchangeTokens();

        GrantOutcome unknown = orchestrator.revoke(post().basicAuth("other", CLIENT_SECRET).form("token", "nope").build());
        GrantOutcome foreign = orchestrator.revoke(post()
            .basicAuth("other", CLIENT_SECRET)
            .form("token", (String) tokens.get("access_token"))
            .build());

        assertThat(unknown.response().status()).isEqualTo(200);
        assertThat(foreign.response().status()).isEqualTo(200);
        assertThat(introspect((String) tokens.get("access_token"))).containsEntry("active", true);
    }

    @Test
    @DisplayName("revoke should require client authentication")
    void revoke_shouldRequireClientAuthentication() {
        GrantOutcome outcome = orchestrator.revoke(post().basicAuth("app", "wrong").form("token", "x").build());

        assertThat(outcome.response().status()).isEqualTo(401);
    }

    @Test
    @DisplayName("introspect should describe an active access token")
    void introspect_shouldDescribeActiveToken() {
        Map<String, Object> tokens = exchangeTokens();

        Map<String, Object> body = introspect((String) tokens.get("access_token"));

        assertThat(body)
            .containsEntry("active", true)
            .containsEntry("client_id", "app")
            .containsEntry("username", RESOURCE_OWNER)
            .containsEntry("scope", "read write")
            .containsEntry("exp", NOW.plus(Duration.ofHours(10)).getEpochSecond());
        assertThat(introspect((String) tokens.get("refresh_token"))).containsEntry("active", false);
    }

    // ========================================
    // HELPERS
    // ========================================

    private RequestBuilder approvedAuthorization(String clientId) {
        return approvedAuthorization(clientId, "read write", STATE);
    }

    private RequestBuilder approvedAuthorization(String clientId, String scope, String state) {
        return post()
            .form("client_id", clientId)
            .form("response_type", "code")
            .form("redirect_uri", CLIENT_URI)
            .form("scope", scope)
            .form("state", state)
            .form("allow", "true");
    }

    private String authorize(String clientId) {
        GrantOutcome outcome = orchestrator.authorize(approvedAuthorization(clientId).build(), RESOURCE_OWNER);
        assertThat(outcome.state()).isEqualTo(GrantState.RESPONDED);
        return redirectQuery(outcome).get("code");
    }

    private RequestBuilder exchange(String code) {
        return post()
            .basicAuth("app", CLIENT_SECRET)
            .form("grant_type", "authorization_code")
            .form("code", code)
            .form("redirect_uri", CLIENT_URI);
    }

    private RequestBuilder refresh(String refreshToken) {
        return post()
            .basicAuth("app", CLIENT_SECRET)
            .form("grant_type", "refresh_token")
            .form("refresh_token", refreshToken);
    }

    private Map<String, Object> exchangeTokens() {
        GrantOutcome outcome = orchestrator.exchangeToken(exchange(authorize("app")).build());
        assertThat(outcome.isSuccess()).isTrue();
        return outcome.response().body();
    }

    private Map<String, Object> introspect(String token) {
        return orchestrator.introspect(post().basicAuth("app", CLIENT_SECRET).form("token", token).build())
            .response().body();
    }

    private static String location(GrantOutcome outcome) {
        return outcome.response().header("Location");
    }

    private static Map<String, String> redirectQuery(GrantOutcome outcome) {
        assertThat(outcome.response().status()).isEqualTo(302);
        String query = URI.create(location(outcome)).getRawQuery();
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }
}
