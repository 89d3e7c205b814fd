package tech.tollgate.provider.oauth.memory;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.tollgate.provider.oauth.ClientRegistry;
import tech.tollgate.provider.oauth.GrantType;
import tech.tollgate.provider.oauth.OAuthClient;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory client registry. Registrations are copied on the way in and out,
 * so callers never share mutable state with the registry.
 */
@ApplicationScoped
public class InMemoryClientRegistry implements ClientRegistry {

    private static final Logger LOG = Logger.getLogger(InMemoryClientRegistry.class);

    private final Map<String, OAuthClient> clients = new ConcurrentHashMap<>();

    @Override
    public Optional<OAuthClient> findClient(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId)).map(OAuthClient::copy);
    }

    /**
     * Add or replace a registration.
     *
     * @throws IllegalArgumentException if the registration is incomplete
     */
    public void register(OAuthClient client) {
        if (client.clientId == null || client.clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (client.isConfidential() && (client.clientSecretHash == null || client.clientSecretHash.isBlank())) {
            throw new IllegalArgumentException("Confidential client " + client.clientId + " needs a secret hash");
        }
        if (client.isPublic() && client.clientSecretHash != null) {
            throw new IllegalArgumentException("Public client " + client.clientId + " must not have a secret");
        }
        if (client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE) && client.redirectUris.isEmpty()) {
            throw new IllegalArgumentException("Client " + client.clientId + " needs at least one redirect URI");
        }
        clients.put(client.clientId, client.copy());
        LOG.infof("Registered %s OAuth client %s", client.clientType, client.clientId);
    }

    public boolean remove(String clientId) {
        boolean removed = clients.remove(clientId) != null;
        if (removed) {
            LOG.infof("Removed OAuth client %s", clientId);
        }
        return removed;
    }
}
