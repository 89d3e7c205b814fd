package tech.tollgate.provider.oauth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-neutral response: status, ordered headers with unique names and
 * an optional JSON body.
 */
public record GrantResponse(
    int status,
    Map<String, String> headers,
    Map<String, Object> body
) {

    public static final String LOCATION = "Location";

    public GrantResponse {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean hasHeader(String name) {
        return header(name) != null;
    }

    public static Builder status(int status) {
        return new Builder(status);
    }

    public static final class Builder {
        private final int status;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Map<String, Object> body;

        private Builder(int status) {
            this.status = status;
        }

        /**
         * Set a header, replacing any value already set under the same name.
         */
        public Builder header(String name, String value) {
            headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
            headers.put(name, value);
            return this;
        }

        public Builder body(Map<String, Object> body) {
            this.body = body;
            return this;
        }

        public GrantResponse build() {
            return new GrantResponse(status, headers, body);
        }
    }
}
