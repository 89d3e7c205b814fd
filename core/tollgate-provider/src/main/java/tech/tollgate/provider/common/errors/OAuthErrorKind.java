package tech.tollgate.provider.common.errors;

/**
 * Denial taxonomy for authorization and token requests.
 *
 * <p>Each kind maps to an RFC 6749 wire error code, an HTTP status and a
 * generic description. The description never names the sub-check that
 * failed; that detail lives in {@link OAuthDenial#detail()} and is only
 * logged server-side.
 */
public enum OAuthErrorKind {

    INVALID_REQUEST("invalid_request", 400,
        "The request is missing a required parameter or is otherwise malformed."),

    INVALID_CLIENT("invalid_client", 401,
        "Client authentication failed."),

    INVALID_GRANT("invalid_grant", 400,
        "The provided authorization grant is invalid, expired, revoked or was issued to another client."),

    UNAUTHORIZED_CLIENT("unauthorized_client", 400,
        "The client is not authorized to request an authorization code."),

    UNAUTHORIZED_GRANT("unauthorized_client", 400,
        "The client is not authorized to use this grant type."),

    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400,
        "The grant type is not supported by the authorization server."),

    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400,
        "The response type is not supported by the authorization server."),

    ACCESS_DENIED("access_denied", 400,
        "The resource owner denied the request."),

    INVALID_SCOPE("invalid_scope", 400,
        "The requested scope is invalid, unknown or exceeds the granted scope."),

    INVALID_REDIRECT_URI("invalid_request", 400,
        "Mismatching or invalid redirect URI."),

    SERVER_ERROR("server_error", 500,
        "The authorization server encountered an unexpected condition.");

    private final String code;
    private final int httpStatus;
    private final String description;

    OAuthErrorKind(String code, int httpStatus, String description) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.description = description;
    }

    /**
     * Wire error code, e.g. {@code invalid_grant}.
     */
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String description() {
        return description;
    }
}
