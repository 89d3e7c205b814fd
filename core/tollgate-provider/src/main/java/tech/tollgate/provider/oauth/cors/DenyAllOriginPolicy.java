package tech.tollgate.provider.oauth.cors;

/**
 * Default policy: no origin is allowed, so no CORS header is ever added.
 */
public class DenyAllOriginPolicy implements OriginPolicy {

    @Override
    public boolean isOriginAllowed(String clientId, String origin) {
        return false;
    }
}
