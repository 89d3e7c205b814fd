package tech.tollgate.provider.oauth;

import tech.tollgate.provider.common.Result;
import tech.tollgate.provider.common.errors.OAuthErrorKind;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Client credentials presented on a token, revocation or introspection
 * request.
 *
 * @param clientId     client identifier, null when none was presented
 * @param clientSecret client secret, null for public clients
 * @param basicAuth    whether the credentials came from an HTTP Basic header
 */
public record ClientCredentials(String clientId, String clientSecret, boolean basicAuth) {

    private static final String BASIC_PREFIX = "Basic ";

    public static ClientCredentials form(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret, false);
    }

    public static ClientCredentials basic(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret, true);
    }

    /**
     * Read credentials from the Authorization header or the form body.
     * A request may use only one of the two. Basic credentials are
     * form-urlencoded before base64 encoding (RFC 6749 section 2.3.1).
     */
    public static Result<ClientCredentials> fromRequest(GrantRequest request) {
        String authorization = request.header(GrantRequest.AUTHORIZATION);
        String formClientId = request.formField("client_id");
        String formClientSecret = request.formField("client_secret");

        if (authorization == null || !authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return Result.success(form(formClientId, formClientSecret));
        }
        if (formClientSecret != null) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST,
                "client authenticated with both Basic header and client_secret");
        }

        ClientCredentials basic;
        try {
            String decoded = new String(
                Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim()),
                StandardCharsets.UTF_8);
            int colonIndex = decoded.indexOf(':');
            if (colonIndex < 0) {
                return Result.failure(OAuthErrorKind.INVALID_CLIENT, "Basic credentials have no separator");
            }
            basic = basic(
                URLDecoder.decode(decoded.substring(0, colonIndex), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colonIndex + 1), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return Result.failure(OAuthErrorKind.INVALID_CLIENT, "malformed Basic credentials: " + e.getMessage());
        }

        if (formClientId != null && !formClientId.equals(basic.clientId())) {
            return Result.failure(OAuthErrorKind.INVALID_REQUEST,
                "client_id in body does not match Basic credentials");
        }
        return Result.success(basic);
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + ", basicAuth=" + basicAuth + "]";
    }
}
