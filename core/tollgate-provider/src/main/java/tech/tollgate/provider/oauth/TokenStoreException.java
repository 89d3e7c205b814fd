package tech.tollgate.provider.oauth;

/**
 * Raised by a {@link TokenStore} when it cannot read or durably write grant state.
 */
public class TokenStoreException extends RuntimeException {

    public TokenStoreException(String message) {
        super(message);
    }

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
