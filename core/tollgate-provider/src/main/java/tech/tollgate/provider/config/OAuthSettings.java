package tech.tollgate.provider.config;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of {@link OAuthConfig}, handed to the validator and
 * orchestrator at construction.
 */
public record OAuthSettings(
    Set<String> allowedRedirectUriSchemes,
    boolean pkceRequired,
    Set<String> scopes,
    Set<String> defaultScopes,
    Duration authorizationCodeExpiry,
    Duration accessTokenExpiry,
    Duration refreshTokenExpiry,
    boolean rotateRefreshTokens,
    boolean corsRequireHttps,
    String loginUrl
) {

    public OAuthSettings {
        allowedRedirectUriSchemes = lowerCased(allowedRedirectUriSchemes);
        scopes = frozen(scopes);
        defaultScopes = frozen(defaultScopes);
        Objects.requireNonNull(authorizationCodeExpiry, "authorizationCodeExpiry");
        Objects.requireNonNull(accessTokenExpiry, "accessTokenExpiry");
        Objects.requireNonNull(refreshTokenExpiry, "refreshTokenExpiry");
        if (!scopes.containsAll(defaultScopes)) {
            throw new IllegalArgumentException("default scopes " + defaultScopes + " are not all in " + scopes);
        }
    }

    public static OAuthSettings from(OAuthConfig config) {
        return new OAuthSettings(
            new LinkedHashSet<>(config.allowedRedirectUriSchemes()),
            config.pkceRequired(),
            new LinkedHashSet<>(config.scopes()),
            new LinkedHashSet<>(config.defaultScopes()),
            config.authorizationCodeExpiry(),
            config.accessTokenExpiry(),
            config.refreshTokenExpiry(),
            config.rotateRefreshTokens(),
            config.corsRequireHttps(),
            config.loginUrl()
        );
    }

    /**
     * Same values as the {@link OAuthConfig} defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .allowedRedirectUriSchemes(allowedRedirectUriSchemes)
            .pkceRequired(pkceRequired)
            .scopes(scopes)
            .defaultScopes(defaultScopes)
            .authorizationCodeExpiry(authorizationCodeExpiry)
            .accessTokenExpiry(accessTokenExpiry)
            .refreshTokenExpiry(refreshTokenExpiry)
            .rotateRefreshTokens(rotateRefreshTokens)
            .corsRequireHttps(corsRequireHttps)
            .loginUrl(loginUrl);
    }

    private static Set<String> frozen(Collection<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static Set<String> lowerCased(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            values.forEach(v -> result.add(v.toLowerCase(Locale.ROOT)));
        }
        return Collections.unmodifiableSet(result);
    }

    public static final class Builder {
        private Collection<String> allowedRedirectUriSchemes = List.of("http", "https");
        private boolean pkceRequired = true;
        private Collection<String> scopes = List.of("read", "write");
        private Collection<String> defaultScopes = List.of("read", "write");
        private Duration authorizationCodeExpiry = Duration.ofMinutes(1);
        private Duration accessTokenExpiry = Duration.ofHours(10);
        private Duration refreshTokenExpiry = Duration.ofDays(30);
        private boolean rotateRefreshTokens = true;
        private boolean corsRequireHttps = false;
        private String loginUrl = "/accounts/login";

        private Builder() {
        }

        public Builder allowedRedirectUriSchemes(Collection<String> schemes) {
            this.allowedRedirectUriSchemes = schemes;
            return this;
        }

        public Builder pkceRequired(boolean pkceRequired) {
            this.pkceRequired = pkceRequired;
            return this;
        }

        public Builder scopes(Collection<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder defaultScopes(Collection<String> defaultScopes) {
            this.defaultScopes = defaultScopes;
            return this;
        }

        public Builder authorizationCodeExpiry(Duration expiry) {
            this.authorizationCodeExpiry = expiry;
            return this;
        }

        public Builder accessTokenExpiry(Duration expiry) {
            this.accessTokenExpiry = expiry;
            return this;
        }

        public Builder refreshTokenExpiry(Duration expiry) {
            this.refreshTokenExpiry = expiry;
            return this;
        }

        public Builder rotateRefreshTokens(boolean rotate) {
            this.rotateRefreshTokens = rotate;
            return this;
        }

        public Builder corsRequireHttps(boolean requireHttps) {
            this.corsRequireHttps = requireHttps;
            return this;
        }

        public Builder loginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
            return this;
        }

        public OAuthSettings build() {
            return new OAuthSettings(
                new LinkedHashSet<>(allowedRedirectUriSchemes),
                pkceRequired,
                new LinkedHashSet<>(scopes),
                new LinkedHashSet<>(defaultScopes),
                authorizationCodeExpiry,
                accessTokenExpiry,
                refreshTokenExpiry,
                rotateRefreshTokens,
                corsRequireHttps,
                loginUrl
            );
        }
    }
}
