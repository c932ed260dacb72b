package tech.taskpilot.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.taskpilot.platform.authentication.session.Session;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.common.errors.AuthenticationException;

import java.util.Optional;

/**
 * Resolves {@code Authorization: Bearer <session_id>} headers to a user.
 *
 * <p>A missing header is "unauthenticated" and only an error where the endpoint
 * requires a caller. A header with another scheme, or with an empty token, is
 * always an error. Each case has its own message.
 */
@ApplicationScoped
public class BearerAuthenticator {

    static final String MISSING_HEADER = "Authentication required";
    static final String MALFORMED_HEADER = "Invalid authorization header format (expected 'Bearer <session_id>')";
    static final String EMPTY_TOKEN = "Missing session ID in authorization header";
    static final String INVALID_SESSION = "Invalid or expired session";

    private static final String SCHEME = "Bearer";

    @Inject
    SessionService sessionService;

    /**
     * Extract the session id without touching the store.
     *
     * @return empty if no header was sent
     * @throws AuthenticationException if the header is present but malformed
     */
    public Optional<String> extractSessionId(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (!header.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            throw new AuthenticationException(MALFORMED_HEADER);
        }
        if (header.length() > SCHEME.length() && !Character.isWhitespace(header.charAt(SCHEME.length()))) {
            throw new AuthenticationException(MALFORMED_HEADER);
        }
        String token = header.substring(SCHEME.length()).trim();
        if (token.isEmpty()) {
            throw new AuthenticationException(EMPTY_TOKEN);
        }
        return Optional.of(token);
    }

    /**
     * Require a valid, unexpired session. Validation refreshes the session's
     * last-activity.
     *
     * @throws AuthenticationException for a missing, malformed, unknown or expired credential
     */
    public AuthenticatedUser authenticate(String authorizationHeader) {
        String sessionId = extractSessionId(authorizationHeader)
            .orElseThrow(() -> new AuthenticationException(MISSING_HEADER));

        if (!sessionService.validate(sessionId)) {
            throw new AuthenticationException(INVALID_SESSION);
        }
        Session session = sessionService.find(sessionId)
            .orElseThrow(() -> new AuthenticationException(INVALID_SESSION));
        return new AuthenticatedUser(session.userId, sessionId);
    }
}
