package tech.tollgate.provider.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of authorization codes, access tokens and refresh tokens.
 *
 * <p>Implementations must be safe for concurrent use. These operations are
 * compare-and-set by contract, since replay protection depends on them:
 * <ul>
 *   <li>{@link #consumeCodeAtomic(String, Instant)} succeeds for at most one caller per code</li>
 *   <li>{@link #rotateRefreshTokenAtomic(String, String, Instant)} succeeds for at most one caller per token</li>
 *   <li>{@link #rotateAndPutTokens(String, AccessToken, RefreshToken, Instant)} succeeds for at most
 *       one caller per token</li>
 * </ul>
 *
 * <p>Any operation may throw {@link TokenStoreException} when the backing
 * storage fails.
 */
public interface TokenStore {

    void putCode(AuthorizationCode code);

    /**
     * Read a code without changing it. Returns consumed and expired codes too;
     * the caller decides what they mean.
     */
    Optional<AuthorizationCode> findCode(String code);

    /**
     * Mark a code consumed if, and only if, it exists, is unconsumed and has
     * not expired at {@code now}.
     *
     * @return true for the single caller that consumed the code
     */
    boolean consumeCodeAtomic(String code, Instant now);

    /**
     * Persist an access token and, optionally, the refresh token issued with
     * it. Either both become visible or neither does.
     */
    void putTokens(AccessToken accessToken, RefreshToken refreshToken);

    Optional<AccessToken> findAccessToken(String tokenHash);

    Optional<RefreshToken> findRefreshToken(String tokenHash);

    /**
     * Revoke a valid refresh token and record what replaced it.
     *
     * @return true for the single caller that rotated the token
     */
    boolean rotateRefreshTokenAtomic(String tokenHash, String replacedByHash, Instant now);

    /**
     * Rotate a refresh token and persist its replacement in one step. The
     * presented token is revoked with {@code replacedBy} set to the new
     * refresh token's hash, and both new tokens are stored. Either all of
     * this happens or none of it does: when the method returns false or
     * throws, the presented token is left exactly as it was.
     *
     * @return true for the single caller that rotated the token; false if it
     *         is unknown, revoked, already rotated or expired at {@code now}
     */
    boolean rotateAndPutTokens(String tokenHash, AccessToken accessToken, RefreshToken refreshToken, Instant now);

    /**
     * Revoke the access or refresh token with this hash. Revoking a refresh
     * token also revokes the access tokens issued alongside it.
     *
     * @return true if a token was found
     */
    boolean revoke(String tokenHash, Instant now);

    /**
     * Revoke every refresh token in a rotation family and their access tokens.
     *
     * @return number of refresh tokens revoked
     */
    int revokeTokenFamily(String tokenFamily, Instant now);

    /**
     * Remove codes and tokens that expired before {@code now}. Expired records
     * are refused by every other operation already, so this only reclaims
     * space. Meant to be called periodically by the host application.
     *
     * @return number of records removed
     */
    int purgeExpired(Instant now);
}
