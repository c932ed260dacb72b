package tech.taskpilot.platform.authentication.oidc;

import java.time.Instant;

/**
 * What a pending CSRF state remembers about the authorization request it was
 * issued for.
 *
 * @param redirectUri the redirect URI sent upstream; code exchange must repeat it
 * @param clientId    the dynamic client that started the flow, or null for the first-party flow
 */
public record PendingAuthorization(String redirectUri, String clientId, Instant createdAt) {}
