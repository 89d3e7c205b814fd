package tech.tollgate.provider.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) implementation.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier)), or sends the verifier itself for "plain"
 * 3. Server stores code_challenge and method with the authorization code
 * 4. Client sends code_verifier in the token request
 * 5. Server recomputes the challenge with the stored method and compares
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_PLAIN = "plain";
    public static final String METHOD_S256 = "S256";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    // Unreserved URI characters, 43-128 long
    private static final Pattern PKCE_VALUE = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

    /**
     * Generate a cryptographically random code verifier (64 base64url characters).
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier matches the stored code challenge.
     *
     * @param method "plain" or "S256"; a null method means "plain" per RFC 7636 section 4.3
     * @return true if the verifier matches the challenge
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null || !isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        String effectiveMethod = method == null ? METHOD_PLAIN : method;
        if (METHOD_S256.equals(effectiveMethod)) {
            return constantTimeEquals(generateCodeChallenge(codeVerifier), codeChallenge);
        }
        if (METHOD_PLAIN.equals(effectiveMethod)) {
            return constantTimeEquals(codeVerifier, codeChallenge);
        }
        return false;
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_PLAIN.equals(method) || METHOD_S256.equals(method);
    }

    public boolean isValidCodeChallenge(String codeChallenge) {
        return codeChallenge != null && PKCE_VALUE.matcher(codeChallenge).matches();
    }

    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null && PKCE_VALUE.matcher(codeVerifier).matches();
    }

    private boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(
            a.getBytes(StandardCharsets.US_ASCII),
            b.getBytes(StandardCharsets.US_ASCII));
    }
}
