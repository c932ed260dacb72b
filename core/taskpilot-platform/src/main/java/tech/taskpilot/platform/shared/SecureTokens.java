package tech.taskpilot.platform.shared;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * URL-safe random tokens for session ids, client ids, client secrets and CSRF state.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureTokens() {
    }

    /**
     * Generate {@code byteCount} random bytes, Base64url-encoded without padding.
     * 32 bytes yields a 43 character token.
     */
    public static String urlSafe(int byteCount) {
        byte[] bytes = new byte[byteCount];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Shorten a secret identifier for log output.
     */
    public static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? "****" : token.substring(0, 8) + "...";
    }
}
