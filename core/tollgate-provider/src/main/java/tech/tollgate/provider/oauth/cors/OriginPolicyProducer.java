package tech.tollgate.provider.oauth.cors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tollgate.provider.config.OAuthConfig;
import tech.tollgate.provider.oauth.ClientRegistry;

/**
 * Selects the {@link OriginPolicy} named by {@code tollgate.oauth.origin-policy}
 * once at startup. Applications that need another policy can declare their own
 * {@code @Alternative} bean.
 */
@ApplicationScoped
public class OriginPolicyProducer {

    private static final Logger LOG = Logger.getLogger(OriginPolicyProducer.class);

    public static final String DENY_ALL = "deny-all";
    public static final String CLIENT_ALLOWED_ORIGINS = "client-allowed-origins";

    @Inject
    OAuthConfig config;

    @Inject
    ClientRegistry clientRegistry;

    @Produces
    @ApplicationScoped
    OriginPolicy originPolicy() {
        return select(config.originPolicy(), clientRegistry);
    }

    static OriginPolicy select(String name, ClientRegistry clientRegistry) {
        if (DENY_ALL.equals(name)) {
            LOG.info("CORS origin policy: deny all");
            return new DenyAllOriginPolicy();
        }
        if (CLIENT_ALLOWED_ORIGINS.equals(name)) {
            LOG.info("CORS origin policy: per-client allowed origins");
            return new ClientAllowedOriginsPolicy(clientRegistry);
        }
        throw new IllegalArgumentException("Unknown tollgate.oauth.origin-policy: " + name
            + " (expected " + DENY_ALL + " or " + CLIENT_ALLOWED_ORIGINS + ")");
    }
}
