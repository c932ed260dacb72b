package tech.taskpilot.platform.authentication.oidc;

/**
 * Upstream identity provider call or identity token verification failed.
 */
public class IdentityProviderException extends Exception {

    public IdentityProviderException(String message) {
        super(message);
    }

    public IdentityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
