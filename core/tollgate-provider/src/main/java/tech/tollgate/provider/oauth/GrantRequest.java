package tech.tollgate.provider.oauth;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transport-neutral view of an inbound authorization, token, revocation or
 * introspection request.
 *
 * @param httpMethod      e.g. GET or POST
 * @param headers         header values, looked up case-insensitively
 * @param formFields      form-encoded body fields, each possibly repeated
 * @param queryParameters query parameters, each possibly repeated
 */
public record GrantRequest(
    String httpMethod,
    Map<String, String> headers,
    Map<String, List<String>> formFields,
    Map<String, List<String>> queryParameters
) {

    public static final String ORIGIN = "Origin";
    public static final String AUTHORIZATION = "Authorization";

    public GrantRequest {
        Map<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        headers = Collections.unmodifiableMap(caseInsensitive);
        formFields = formFields == null ? Map.of() : Map.copyOf(formFields);
        queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
    }

    public String header(String name) {
        return headers.get(name);
    }

    /**
     * The Origin header, or null when absent or blank.
     */
    public String origin() {
        String origin = headers.get(ORIGIN);
        return origin == null || origin.isBlank() ? null : origin;
    }

    /**
     * First value of a body field, or null.
     */
    public String formField(String name) {
        return first(formFields.get(name));
    }

    /**
     * First value of a body field, falling back to the query string.
     */
    public String parameter(String name) {
        String value = formField(name);
        return value != null ? value : first(queryParameters.get(name));
    }

    /**
     * The first of {@code names} sent more than once, or null. OAuth request
     * parameters must not be repeated.
     */
    public String repeatedParameter(String... names) {
        for (String name : names) {
            int count = size(formFields.get(name)) + size(queryParameters.get(name));
            if (count > 1) {
                return name;
            }
        }
        return null;
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int size(List<String> values) {
        return values == null ? 0 : values.size();
    }
}
