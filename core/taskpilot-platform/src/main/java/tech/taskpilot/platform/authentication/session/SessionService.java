package tech.taskpilot.platform.authentication.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.security.cipher.TokenCipher;
import tech.taskpilot.platform.shared.SecureTokens;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Issues, validates, refreshes and revokes sessions.
 *
 * <p>{@link #validate(String)} is the single authorization gate for tool calls.
 * It fails closed and never throws for an unknown id.
 *
 * <p>Validity and retrievability are independent: an expired session still
 * yields its decrypted tokens until the expiry sweep removes it.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    /** 32 bytes of entropy, 43 URL-safe characters. */
    static final int SESSION_ID_BYTES = 32;
    static final int MAX_USER_AGENT_LENGTH = 500;

    @Inject
    SessionRepository sessionRepository;

    @Inject
    TokenCipher tokenCipher;

    @Transactional
    public Session create(String userId, String accessToken, String refreshToken,
                          Instant expiresAt, String userAgent) {
        Instant now = Instant.now();

        Session session = new Session();
        session.sessionId = SecureTokens.urlSafe(SESSION_ID_BYTES);
        session.userId = userId;
        session.accessToken = tokenCipher.encrypt(accessToken);
        session.refreshToken = tokenCipher.encrypt(refreshToken);
        session.expiresAt = expiresAt;
        session.createdAt = now;
        session.lastActivity = now;
        session.userAgent = truncate(userAgent);

        sessionRepository.persist(session);
        LOG.infof("Created session %s for user %s (expires %s)",
            SecureTokens.abbreviate(session.sessionId), userId, expiresAt);
        return session;
    }

    /**
     * @return true iff the session exists and {@code now < expiresAt}; on true,
     *         last-activity is moved forward as a side effect
     */
    @Transactional
    public boolean validate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        Optional<Session> session = sessionRepository.findById(sessionId);
        if (session.isEmpty()) {
            return false;
        }
        Instant now = Instant.now();
        if (session.get().isExpired(now)) {
            LOG.debugf("Session %s expired at %s", SecureTokens.abbreviate(sessionId), session.get().expiresAt);
            return false;
        }
        return sessionRepository.touch(sessionId, now);
    }

    public Optional<Session> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return sessionRepository.findById(sessionId);
    }

    public Optional<String> getDecryptedAccessToken(String sessionId) {
        return find(sessionId).map(s -> tokenCipher.decrypt(s.accessToken));
    }

    public Optional<String> getDecryptedRefreshToken(String sessionId) {
        return find(sessionId).map(s -> tokenCipher.decrypt(s.refreshToken));
    }

    /**
     * Replace the access token and expiry in one store operation. The refresh
     * token is left untouched.
     */
    @Transactional
    public Optional<Session> refresh(String sessionId, String newAccessToken, Instant newExpiresAt) {
        byte[] encrypted = tokenCipher.encrypt(newAccessToken);
        if (!sessionRepository.replaceAccessToken(sessionId, encrypted, newExpiresAt, Instant.now())) {
            return Optional.empty();
        }
        LOG.infof("Refreshed session %s (expires %s)", SecureTokens.abbreviate(sessionId), newExpiresAt);
        return sessionRepository.findById(sessionId);
    }

    /**
     * Idempotent logout.
     *
     * @return whether a session was actually removed
     */
    @Transactional
    public boolean delete(String sessionId) {
        boolean removed = sessionRepository.deleteById(sessionId);
        if (removed) {
            LOG.infof("Deleted session %s", SecureTokens.abbreviate(sessionId));
        }
        return removed;
    }

    @Transactional
    public long cleanupExpired() {
        long removed = sessionRepository.deleteExpired(Instant.now());
        if (removed > 0) {
            LOG.infof("Removed %d expired sessions", removed);
        }
        return removed;
    }

    public List<Session> listForUser(String userId) {
        return sessionRepository.findByUserId(userId);
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
}
