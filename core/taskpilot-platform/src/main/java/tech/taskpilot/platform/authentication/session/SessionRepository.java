package tech.taskpilot.platform.authentication.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Session entities.
 *
 * <p>Every write is a single statement so concurrent callers never observe a
 * partially applied change.
 */
public interface SessionRepository {

    // Read operations
    Optional<Session> findById(String sessionId);
    List<Session> findByUserId(String userId);

    // Write operations
    void persist(Session session);

    /**
     * Move last-activity forward to {@code now}. Never moves it backwards.
     *
     * @return false if the session does not exist
     */
    boolean touch(String sessionId, Instant now);

    /**
     * Replace access token, expiry and last-activity in one update.
     *
     * @return false if the session does not exist
     */
    boolean replaceAccessToken(String sessionId, byte[] accessToken, Instant expiresAt, Instant now);

    boolean deleteById(String sessionId);

    /**
     * Delete sessions with {@code expiresAt <= now}.
     */
    long deleteExpired(Instant now);
}
