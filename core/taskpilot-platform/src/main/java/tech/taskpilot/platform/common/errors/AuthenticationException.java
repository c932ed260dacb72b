package tech.taskpilot.platform.common.errors;

/**
 * Bearer credential was missing, malformed, unknown or expired.
 * Always rejected before any business logic runs (HTTP 401).
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
