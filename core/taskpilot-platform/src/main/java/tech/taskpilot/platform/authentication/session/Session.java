package tech.taskpilot.platform.authentication.session;

import java.time.Instant;

/**
 * Server-side session binding a random id to a user and to encrypted copies of
 * that user's provider tokens.
 *
 * <p>Token fields only ever hold ciphertext. Use {@link SessionService} to
 * obtain plaintext transiently.
 */
public class Session {

    public String sessionId;

    public String userId;

    public byte[] accessToken;

    public byte[] refreshToken;

    /**
     * Expiry of the provider access token, which is also the session expiry.
     */
    public Instant expiresAt;

    public Instant createdAt;

    public Instant lastActivity;

    public String userAgent;

    /**
     * A session is valid iff {@code now < expiresAt}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Session{sessionId=" + (sessionId == null ? null : sessionId.substring(0, Math.min(8, sessionId.length())) + "...")
            + ", userId=" + userId
            + ", expiresAt=" + expiresAt
            + ", lastActivity=" + lastActivity + "}";
    }
}
