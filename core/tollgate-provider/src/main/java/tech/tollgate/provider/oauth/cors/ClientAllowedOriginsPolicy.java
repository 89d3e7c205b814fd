package tech.tollgate.provider.oauth.cors;

import org.jboss.logging.Logger;
import tech.tollgate.provider.oauth.ClientRegistry;

/**
 * Allows the origins listed on the client's own registration. Origins are
 * compared as exact strings, so {@code https://app.example.com} and
 * {@code https://app.example.com/} are different origins.
 */
public class ClientAllowedOriginsPolicy implements OriginPolicy {

    private static final Logger LOG = Logger.getLogger(ClientAllowedOriginsPolicy.class);

    private final ClientRegistry clientRegistry;

    public ClientAllowedOriginsPolicy(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    @Override
    public boolean isOriginAllowed(String clientId, String origin) {
        if (clientId == null) {
            return false;
        }
        boolean allowed = clientRegistry.findClient(clientId)
            .filter(client -> client.active)
            .map(client -> client.isOriginAllowed(origin))
            .orElse(false);
        if (!allowed) {
            LOG.debugf("CORS: Origin %s not allowed for client %s", origin, clientId);
        }
        return allowed;
    }
}
