package tech.tollgate.provider.oauth;

import jakarta.ws.rs.core.SecurityContext;

import java.util.Optional;

/**
 * Resolves the user approving an authorization request. Applications replace
 * the default bean to plug in their own session handling.
 */
public interface ResourceOwnerResolver {

    /**
     * @return the resource owner id, or empty when nobody is signed in
     */
    Optional<String> resolve(SecurityContext securityContext);
}
