package tech.taskpilot.platform.authentication.oidc;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;
import tech.taskpilot.platform.authentication.client.ClientRegistrationService;
import tech.taskpilot.platform.authentication.session.Session;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.common.errors.AuthorizationFlowException;
import tech.taskpilot.platform.common.errors.ClientRegistrationException;
import tech.taskpilot.platform.principal.UserService;
import tech.taskpilot.platform.shared.SecureTokens;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives the authorization-code flow against the upstream provider.
 *
 * <ol>
 *   <li>{@link #beginAuthorization} issues a CSRF state and builds the provider URL</li>
 *   <li>{@link #completeAuthorization} consumes the state, exchanges the code,
 *       verifies the identity token, upserts the user and mints a session</li>
 *   <li>{@link #refreshAuthorization} renews the access token for an existing session</li>
 * </ol>
 *
 * <p>The state is consumed before any other callback work, so a replayed or
 * concurrently duplicated callback always fails. Failures after that point leave
 * no session behind.
 */
@ApplicationScoped
public class AuthorizationFlowService {

    private static final Logger LOG = Logger.getLogger(AuthorizationFlowService.class);

    static final int STATE_BYTES = 32;
    static final String TOKEN_TYPE = "Bearer";

    @Inject
    AuthConfig authConfig;

    @Inject
    AuthorizationStateStore stateStore;

    @Inject
    IdentityProviderClient identityProvider;

    @Inject
    ClientRegistrationService clientRegistrationService;

    @Inject
    UserService userService;

    @Inject
    SessionService sessionService;

    /**
     * Token response returned by the callback and refresh endpoints.
     */
    public record TokenGrant(String sessionId, String accessToken, String refreshToken,
                             long expiresIn, String tokenType) {}

    /**
     * Start an authorization attempt.
     *
     * @param clientId    dynamic client id, or null for the first-party flow
     * @param redirectUri registered redirect URI of that client, or null
     * @return the provider authorization URL with the new state embedded
     */
    public URI beginAuthorization(String clientId, String redirectUri) {
        boolean hasClient = clientId != null && !clientId.isBlank();
        boolean hasRedirect = redirectUri != null && !redirectUri.isBlank();

        String upstreamRedirect = authConfig.google().redirectUri();
        if (hasClient || hasRedirect) {
            if (!hasClient || !hasRedirect) {
                throw new ClientRegistrationException(ClientRegistrationException.INVALID_CLIENT,
                    "Both client_id and redirect_uri are required for dynamic clients");
            }
            if (!clientRegistrationService.validateRedirectUri(clientId, redirectUri)) {
                throw new ClientRegistrationException(ClientRegistrationException.INVALID_CLIENT,
                    "Invalid client_id or redirect_uri not registered for client");
            }
            upstreamRedirect = redirectUri;
        }

        String state = SecureTokens.urlSafe(STATE_BYTES);
        stateStore.put(state, new PendingAuthorization(upstreamRedirect, hasClient ? clientId : null, Instant.now()));

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", authConfig.google().clientId());
        params.put("redirect_uri", upstreamRedirect);
        params.put("response_type", "code");
        params.put("scope", String.join(" ", authConfig.google().scopes()));
        params.put("state", state);
        // Forced consent guarantees a refresh token on every login
        params.put("access_type", "offline");
        params.put("include_granted_scopes", "true");
        params.put("prompt", "consent");

        String query = params.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));

        LOG.infof("Starting authorization%s", hasClient ? " for client " + clientId : "");
        return URI.create(authConfig.google().authorizationEndpoint() + "?" + query);
    }

    /**
     * Handle the provider callback.
     *
     * @param userAgent caller's User-Agent, stored on the session; may be null
     */
    public TokenGrant completeAuthorization(String code, String state, String scope, String userAgent) {
        PendingAuthorization pending = stateStore.consume(state)
            .orElseThrow(() -> AuthorizationFlowException.badRequest(
                AuthorizationFlowException.INVALID_STATE, "Invalid state parameter"));

        if (code == null || code.isBlank()) {
            throw AuthorizationFlowException.badRequest(AuthorizationFlowException.INVALID_REQUEST,
                "Missing code parameter");
        }

        IdentityProviderClient.ProviderTokens tokens;
        try {
            tokens = identityProvider.exchangeCode(code, pending.redirectUri());
        } catch (IdentityProviderException e) {
            throw new AuthorizationFlowException(AuthorizationFlowException.INVALID_GRANT,
                "Failed to exchange authorization code", 400, e);
        }
        if (tokens.idToken() == null) {
            throw AuthorizationFlowException.badRequest(AuthorizationFlowException.INVALID_GRANT,
                "No ID token in response");
        }
        if (tokens.accessToken() == null || tokens.refreshToken() == null) {
            throw AuthorizationFlowException.badRequest(AuthorizationFlowException.INVALID_GRANT,
                "Provider did not return both access and refresh tokens");
        }

        IdentityProviderClient.IdentityClaims claims;
        try {
            claims = identityProvider.verifyIdentity(tokens.idToken());
        } catch (IdentityProviderException e) {
            throw new AuthorizationFlowException(AuthorizationFlowException.INVALID_TOKEN,
                "Invalid ID token: " + e.getMessage(), 400, e);
        }
        if (isBlank(claims.subject()) || isBlank(claims.email())) {
            throw AuthorizationFlowException.badRequest(AuthorizationFlowException.INVALID_TOKEN,
                "Missing required user info in ID token");
        }

        try {
            userService.upsert(claims.subject(), claims.email(), claims.name());
        } catch (UserService.EmailConflictException e) {
            throw new AuthorizationFlowException(AuthorizationFlowException.ACCESS_DENIED, e.getMessage(), 400, e);
        }

        Session session = sessionService.create(claims.subject(), tokens.accessToken(), tokens.refreshToken(),
            tokens.expiresAt(), userAgent);

        LOG.infof("Authorization completed for user %s (scope: %s)", claims.subject(), scope);
        return new TokenGrant(session.sessionId, tokens.accessToken(), tokens.refreshToken(),
            secondsUntil(tokens.expiresAt()), TOKEN_TYPE);
    }

    /**
     * Provider redirected back with an error. The state is still burned.
     */
    public AuthorizationFlowException abandonAuthorization(String state, String error) {
        stateStore.consume(state);
        return AuthorizationFlowException.badRequest(AuthorizationFlowException.ACCESS_DENIED,
            "Authorization was not granted: " + error);
    }

    /**
     * Renew the access token of an existing session. The presented refresh
     * token must match the one stored for the session.
     */
    public TokenGrant refreshAuthorization(String sessionId, String refreshToken) {
        if (isBlank(sessionId) || isBlank(refreshToken)) {
            throw AuthorizationFlowException.badRequest(AuthorizationFlowException.INVALID_REQUEST,
                "session_id and refresh_token are required");
        }

        String stored = sessionService.getDecryptedRefreshToken(sessionId)
            .orElseThrow(AuthorizationFlowService::sessionNotFound);

        if (!MessageDigest.isEqual(stored.getBytes(StandardCharsets.UTF_8),
                refreshToken.getBytes(StandardCharsets.UTF_8))) {
            throw new AuthorizationFlowException(AuthorizationFlowException.INVALID_GRANT,
                "Invalid refresh token", 401);
        }

        IdentityProviderClient.RefreshedAccess refreshed;
        try {
            refreshed = identityProvider.refreshAccess(stored);
        } catch (IdentityProviderException e) {
            throw new AuthorizationFlowException(AuthorizationFlowException.INVALID_GRANT,
                "Failed to refresh token", 401, e);
        }

        sessionService.refresh(sessionId, refreshed.accessToken(), refreshed.expiresAt())
            .orElseThrow(AuthorizationFlowService::sessionNotFound);

        return new TokenGrant(sessionId, refreshed.accessToken(), stored,
            secondsUntil(refreshed.expiresAt()), TOKEN_TYPE);
    }

    private static AuthorizationFlowException sessionNotFound() {
        return new AuthorizationFlowException(AuthorizationFlowException.SESSION_NOT_FOUND, "Session not found", 404);
    }

    private static long secondsUntil(Instant expiresAt) {
        return Math.max(0, Duration.between(Instant.now(), expiresAt).getSeconds());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
