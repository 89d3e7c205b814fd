package tech.tollgate.provider.common.errors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured reason a grant request was refused.
 *
 * <p>{@code kind} decides what goes on the wire. {@code detail} and
 * {@code details} say which check failed and are meant for server-side logs
 * only.
 *
 * @param kind    denial category
 * @param detail  the failed sub-check, for logging
 * @param details additional structured context (never rendered to the client)
 */
public record OAuthDenial(
    OAuthErrorKind kind,
    String detail,
    Map<String, Object> details
) {

    /** Key under which a rotated refresh token's family is reported on reuse. */
    public static final String TOKEN_FAMILY = "tokenFamily";

    public OAuthDenial {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static OAuthDenial of(OAuthErrorKind kind, String detail) {
        return new OAuthDenial(kind, detail, Map.of());
    }

    public String error() {
        return kind.code();
    }

    public String description() {
        return kind.description();
    }

    public int httpStatus() {
        return kind.httpStatus();
    }

    /**
     * Wire body for the token endpoint: {@code {"error": ..., "error_description": ...}}.
     */
    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error());
        body.put("error_description", description());
        return body;
    }
}
