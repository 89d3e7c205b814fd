package tech.tollgate.provider.oauth;

import java.util.Optional;

/**
 * OAuth2 grant types the provider can issue tokens for.
 */
public enum GrantType {

    AUTHORIZATION_CODE("authorization_code"),
    REFRESH_TOKEN("refresh_token"),
    CLIENT_CREDENTIALS("client_credentials");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    /**
     * The {@code grant_type} parameter value.
     */
    public String value() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        for (GrantType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
