package tech.tollgate.provider.oauth.cors;

/**
 * Decides whether a browser origin may read token endpoint responses for a
 * client. This is the only customization point for CORS on the provider.
 *
 * <p>Implementations must be free of side effects. They are never called
 * with a null or blank origin.
 */
public interface OriginPolicy {

    boolean isOriginAllowed(String clientId, String origin);
}
