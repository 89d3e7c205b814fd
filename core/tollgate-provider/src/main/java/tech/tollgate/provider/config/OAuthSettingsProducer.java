package tech.tollgate.provider.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Produces the frozen settings snapshot and the clock used for expiry checks.
 */
@ApplicationScoped
public class OAuthSettingsProducer {

    private static final Logger LOG = Logger.getLogger(OAuthSettingsProducer.class);

    @Inject
    OAuthConfig config;

    @Produces
    @Singleton
    OAuthSettings oauthSettings() {
        OAuthSettings settings = OAuthSettings.from(config);
        LOG.infof("OAuth settings: redirect schemes %s, pkce required %s, scopes %s, origin policy %s",
            settings.allowedRedirectUriSchemes(), settings.pkceRequired(), settings.scopes(), config.originPolicy());
        return settings;
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
