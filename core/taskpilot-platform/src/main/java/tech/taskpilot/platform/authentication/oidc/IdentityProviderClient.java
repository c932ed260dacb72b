package tech.taskpilot.platform.authentication.oidc;

import java.time.Instant;

/**
 * The upstream identity provider as a capability: code exchange, identity
 * token verification and access token refresh.
 */
public interface IdentityProviderClient {

    /**
     * @param redirectUri must equal the redirect URI of the original authorization request
     */
    ProviderTokens exchangeCode(String code, String redirectUri) throws IdentityProviderException;

    /**
     * Verify signature, issuer, audience and expiry, then return the claims.
     */
    IdentityClaims verifyIdentity(String idToken) throws IdentityProviderException;

    RefreshedAccess refreshAccess(String refreshToken) throws IdentityProviderException;

    /**
     * Tokens from a code exchange. Any field may be null if the provider omitted it.
     */
    record ProviderTokens(String accessToken, String refreshToken, String idToken, Instant expiresAt) {}

    /**
     * Subject and email are required by the flow; name is optional.
     */
    record IdentityClaims(String subject, String email, String name) {}

    record RefreshedAccess(String accessToken, Instant expiresAt) {}
}
