package tech.taskpilot.platform.common.errors;

/**
 * Store, cipher or upstream failure. Never shown to the caller in detail.
 *
 * <p>{@code retryable} marks failures (timeouts, unavailable store) where the
 * same request may succeed later.
 */
public class InfrastructureException extends RuntimeException {

    private final boolean retryable;

    public InfrastructureException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public InfrastructureException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
