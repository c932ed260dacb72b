package tech.taskpilot.platform.authentication.oidc;

import java.util.Optional;

/**
 * Pending CSRF states for in-flight authorization attempts.
 *
 * <p>Implementations must make {@link #consume(String)} atomic: for any state,
 * at most one caller ever receives a value, even under concurrent delivery.
 * The in-memory implementation is process-local; running more than one
 * instance requires a shared implementation.
 */
public interface AuthorizationStateStore {

    void put(String state, PendingAuthorization pending);

    /**
     * Remove and return the pending entry. Second and later calls for the same
     * state return empty.
     */
    Optional<PendingAuthorization> consume(String state);

    boolean isPending(String state);
}
