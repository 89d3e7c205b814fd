package tech.tollgate.provider.oauth.memory;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.tollgate.provider.oauth.AccessToken;
import tech.tollgate.provider.oauth.AuthorizationCode;
import tech.tollgate.provider.oauth.RefreshToken;
import tech.tollgate.provider.oauth.TokenStore;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory {@link TokenStore}.
 *
 * <p>Code consumption and refresh rotation run inside
 * {@link ConcurrentHashMap#computeIfPresent}, which gives the per-key
 * compare-and-set the contract asks for. Every write to the token maps holds
 * {@code tokenLock}, so rotating a refresh token and storing its replacement
 * is a single step.
 *
 * <p>Nothing is evicted on its own; the host application reclaims expired
 * records by calling {@link #purgeExpired(Instant)}.
 */
@ApplicationScoped
public class InMemoryTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStore.class);

    private final Map<String, AuthorizationCode> codes = new ConcurrentHashMap<>();
    private final Map<String, AccessToken> accessTokens = new ConcurrentHashMap<>();
    private final Map<String, RefreshToken> refreshTokens = new ConcurrentHashMap<>();
    private final Object tokenLock = new Object();

    @Override
    public void putCode(AuthorizationCode code) {
        if (codes.putIfAbsent(code.code, code.copy()) != null) {
            throw new IllegalStateException("Authorization code already stored: " + code.id);
        }
    }

    @Override
    public Optional<AuthorizationCode> findCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.get(code)).map(AuthorizationCode::copy);
    }

    @Override
    public boolean consumeCodeAtomic(String code, Instant now) {
        AtomicBoolean consumed = new AtomicBoolean(false);
        codes.computeIfPresent(code, (key, existing) -> {
            if (!existing.isValid(now)) {
                return existing;
            }
            AuthorizationCode updated = existing.copy();
            updated.consumed = true;
            consumed.set(true);
            return updated;
        });
        return consumed.get();
    }

    @Override
    public void putTokens(AccessToken accessToken, RefreshToken refreshToken) {
        synchronized (tokenLock) {
            requireUnused(accessToken, refreshToken);
            storeTokens(accessToken, refreshToken);
        }
    }

    @Override
    public Optional<AccessToken> findAccessToken(String tokenHash) {
        if (tokenHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accessTokens.get(tokenHash)).map(AccessToken::copy);
    }

    @Override
    public Optional<RefreshToken> findRefreshToken(String tokenHash) {
        if (tokenHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(refreshTokens.get(tokenHash)).map(RefreshToken::copy);
    }

    @Override
    public boolean rotateRefreshTokenAtomic(String tokenHash, String replacedByHash, Instant now) {
        AtomicBoolean rotated = new AtomicBoolean(false);
        synchronized (tokenLock) {
            refreshTokens.computeIfPresent(tokenHash, (key, existing) -> {
                if (!existing.isValid(now)) {
                    return existing;
                }
                RefreshToken updated = existing.copy();
                updated.revoked = true;
                updated.revokedAt = now;
                updated.replacedBy = replacedByHash;
                rotated.set(true);
                return updated;
            });
        }
        return rotated.get();
    }

    @Override
    public boolean rotateAndPutTokens(String tokenHash, AccessToken accessToken, RefreshToken refreshToken, Instant now) {
        synchronized (tokenLock) {
            RefreshToken existing = refreshTokens.get(tokenHash);
            if (existing == null || !existing.isValid(now)) {
                return false;
            }
            // Checked before anything is written, so a collision leaves the presented token usable.
            requireUnused(accessToken, refreshToken);

            RefreshToken rotated = existing.copy();
            rotated.revoked = true;
            rotated.revokedAt = now;
            rotated.replacedBy = refreshToken.tokenHash;
            refreshTokens.put(tokenHash, rotated);
            storeTokens(accessToken, refreshToken);
            return true;
        }
    }

    @Override
    public boolean revoke(String tokenHash, Instant now) {
        synchronized (tokenLock) {
            AccessToken access = accessTokens.get(tokenHash);
            if (access != null) {
                revokeAccessToken(access);
                return true;
            }
            RefreshToken refresh = refreshTokens.get(tokenHash);
            if (refresh != null) {
                revokeRefreshToken(refresh, now);
                return true;
            }
            return false;
        }
    }

    @Override
    public int revokeTokenFamily(String tokenFamily, Instant now) {
        synchronized (tokenLock) {
            List<RefreshToken> family = refreshTokens.values().stream()
                .filter(t -> tokenFamily.equals(t.tokenFamily))
                .collect(Collectors.toList());
            int revoked = 0;
            for (RefreshToken token : family) {
                if (!token.revoked) {
                    revoked++;
                }
                revokeRefreshToken(token, now);
            }
            LOG.debugf("Revoked %d refresh tokens in family %s", revoked, tokenFamily);
            return revoked;
        }
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        removed += removeExpired(codes, code -> code.isExpired(now));
        synchronized (tokenLock) {
            removed += removeExpired(accessTokens, token -> token.isExpired(now));
            removed += removeExpired(refreshTokens, token -> token.isExpired(now));
        }
        if (removed > 0) {
            LOG.debugf("Purged %d expired codes and tokens", removed);
        }
        return removed;
    }

    private static <T> int removeExpired(Map<String, T> records, Predicate<T> expired) {
        int removed = 0;
        Iterator<T> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            if (expired.test(iterator.next())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    // Callers hold tokenLock.
    private void requireUnused(AccessToken accessToken, RefreshToken refreshToken) {
        if (accessTokens.containsKey(accessToken.tokenHash)
                || (refreshToken != null && refreshTokens.containsKey(refreshToken.tokenHash))) {
            throw new IllegalStateException("Token hash collision for access token " + accessToken.id);
        }
    }

    // Callers hold tokenLock.
    private void storeTokens(AccessToken accessToken, RefreshToken refreshToken) {
        if (refreshToken != null) {
            refreshTokens.put(refreshToken.tokenHash, refreshToken.copy());
        }
        accessTokens.put(accessToken.tokenHash, accessToken.copy());
    }

    // Callers hold tokenLock.
    private void revokeRefreshToken(RefreshToken token, Instant now) {
        if (!token.revoked) {
            RefreshToken updated = token.copy();
            updated.revoked = true;
            updated.revokedAt = now;
            refreshTokens.put(updated.tokenHash, updated);
        }
        accessTokens.values().stream()
            .filter(a -> token.tokenHash.equals(a.sourceRefreshTokenHash))
            .collect(Collectors.toList())
            .forEach(this::revokeAccessToken);
    }

    private void revokeAccessToken(AccessToken token) {
        if (!token.revoked) {
            AccessToken updated = token.copy();
            updated.revoked = true;
            accessTokens.put(updated.tokenHash, updated);
        }
    }
}
