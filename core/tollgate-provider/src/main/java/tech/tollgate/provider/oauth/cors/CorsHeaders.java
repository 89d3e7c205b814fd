package tech.tollgate.provider.oauth.cors;

import tech.tollgate.provider.oauth.GrantResponse;

import java.util.Locale;

/**
 * Adds the CORS response header once an origin has been allowed.
 */
public final class CorsHeaders {

    public static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";

    private CorsHeaders() {
    }

    /**
     * Echo the origin byte for byte. Never a wildcard.
     */
    public static GrantResponse.Builder allowOrigin(GrantResponse.Builder response, String origin) {
        return response.header(ACCESS_CONTROL_ALLOW_ORIGIN, origin);
    }

    public static boolean isHttps(String origin) {
        return origin.toLowerCase(Locale.ROOT).startsWith("https://");
    }
}
