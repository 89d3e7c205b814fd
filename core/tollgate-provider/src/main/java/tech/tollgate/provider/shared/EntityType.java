package tech.tollgate.provider.shared;

/**
 * Kinds of grant record, each with the prefix its ids carry
 * (e.g. "acd_0HZXEQ5Y8JY5Z" for an authorization code).
 */
public enum EntityType {

    AUTH_CODE("acd"),
    ACCESS_TOKEN("atk"),
    REFRESH_TOKEN("rtk"),

    // Rotation chain of refresh tokens
    TOKEN_FAMILY("tfm");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
