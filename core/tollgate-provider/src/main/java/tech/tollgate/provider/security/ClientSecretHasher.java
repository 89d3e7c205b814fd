package tech.tollgate.provider.security;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Hashes and verifies OAuth client secrets using Argon2id.
 *
 * <p>Only the PHC-format hash is ever stored on a client registration.
 * Verification goes through Argon2's own comparison, which runs in constant
 * time with respect to the secret.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 */
@ApplicationScoped
public class ClientSecretHasher {

    private static final Logger LOG = Logger.getLogger(ClientSecretHasher.class);

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;

    // Hash of a random value nobody knows; built on first use.
    private volatile String decoyHash;

    public ClientSecretHasher() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a client secret.
     *
     * @return the hash in PHC format (e.g., $argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Client secret cannot be null or empty");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, secret.toCharArray());
    }

    /**
     * Verify a presented secret against a stored hash.
     *
     * @return true if the secret matches; false for a missing secret, a missing
     *         hash or a hash that cannot be parsed
     */
    public boolean verify(String secret, String secretHash) {
        if (secret == null || secretHash == null) {
            return false;
        }
        if (!secretHash.startsWith("$argon2")) {
            LOG.warn("Stored client secret hash is not in Argon2 PHC format");
            return false;
        }
        try {
            return argon2.verify(secretHash, secret.toCharArray());
        } catch (RuntimeException e) {
            LOG.warnf("Client secret verification failed: %s", e.getMessage());
            return false;
        }
    }

    /**
     * Run the same Argon2 verification as {@link #verify} against a hash no
     * secret matches. Refusing an unknown client through here takes as long
     * as refusing a known client's wrong secret.
     */
    public void verifyDecoy(String secret) {
        if (secret == null) {
            return;
        }
        argon2.verify(decoyHash(), secret.toCharArray());
    }

    private String decoyHash() {
        String hash = decoyHash;
        if (hash == null) {
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            hash = argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM,
                Base64.getEncoder().encodeToString(random).toCharArray());
            decoyHash = hash;
        }
        return hash;
    }
}
