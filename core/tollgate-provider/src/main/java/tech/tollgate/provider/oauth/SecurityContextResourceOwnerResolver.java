package tech.tollgate.provider.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.SecurityContext;

import java.security.Principal;
import java.util.Optional;

/**
 * Uses the name of the JAX-RS request principal as the resource owner id.
 */
@ApplicationScoped
public class SecurityContextResourceOwnerResolver implements ResourceOwnerResolver {

    @Override
    public Optional<String> resolve(SecurityContext securityContext) {
        if (securityContext == null) {
            return Optional.empty();
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(principal.getName());
    }
}
