package tech.tollgate.provider.oauth;

import java.util.Optional;

/**
 * Lookup of registered OAuth clients.
 */
public interface ClientRegistry {

    /**
     * @return the registration, or empty if no client has this identifier
     */
    Optional<OAuthClient> findClient(String clientId);
}
