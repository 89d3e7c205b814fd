package tech.tollgate.provider.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;

/**
 * Deployment-wide settings for the OAuth2 provider.
 *
 * Example configuration:
 * <pre>
 * tollgate.oauth.allowed-redirect-uri-schemes=https
 * tollgate.oauth.pkce-required=true
 * tollgate.oauth.scopes=read,write,admin
 * tollgate.oauth.default-scopes=read
 * tollgate.oauth.origin-policy=client-allowed-origins
 * </pre>
 *
 * <p>Values are read once at startup and frozen into {@link OAuthSettings}.
 */
@ConfigMapping(prefix = "tollgate.oauth")
public interface OAuthConfig {

    /**
     * URI schemes a redirect URI may use.
     * Default: http, https
     */
    @WithName("allowed-redirect-uri-schemes")
    @WithDefault("http,https")
    List<String> allowedRedirectUriSchemes();

    /**
     * Whether every authorization code request must carry a PKCE challenge.
     * Public clients always need one regardless of this setting.
     */
    @WithName("pkce-required")
    @WithDefault("true")
    boolean pkceRequired();

    /**
     * Every scope the provider knows about.
     */
    @WithDefault("read,write")
    List<String> scopes();

    /**
     * Scopes granted when a request names none.
     */
    @WithName("default-scopes")
    @WithDefault("read,write")
    List<String> defaultScopes();

    /**
     * Authorization code lifetime.
     * Default: 60 seconds
     */
    @WithName("authorization-code-expiry")
    @WithDefault("PT1M")
    Duration authorizationCodeExpiry();

    /**
     * Access token lifetime.
     * Default: 10 hours
     */
    @WithName("access-token-expiry")
    @WithDefault("PT10H")
    Duration accessTokenExpiry();

    /**
     * Refresh token lifetime.
     * Default: 30 days
     */
    @WithName("refresh-token-expiry")
    @WithDefault("P30D")
    Duration refreshTokenExpiry();

    /**
     * Whether a refresh_token grant replaces the presented refresh token.
     */
    @WithName("rotate-refresh-tokens")
    @WithDefault("true")
    boolean rotateRefreshTokens();

    /**
     * Only emit CORS headers for https origins, even when the origin policy
     * allows a plain http one.
     */
    @WithName("cors-require-https")
    @WithDefault("false")
    boolean corsRequireHttps();

    /**
     * Which origin policy decides CORS on the token endpoint.
     * One of: deny-all, client-allowed-origins
     */
    @WithName("origin-policy")
    @WithDefault("deny-all")
    String originPolicy();

    /**
     * Where an unauthenticated resource owner is sent from /oauth/authorize.
     */
    @WithName("login-url")
    @WithDefault("/accounts/login")
    String loginUrl();
}
