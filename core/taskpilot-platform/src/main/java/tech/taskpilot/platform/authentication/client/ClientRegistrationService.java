package tech.taskpilot.platform.authentication.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;
import tech.taskpilot.platform.security.cipher.TokenCipher;
import tech.taskpilot.platform.shared.SecureTokens;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Dynamic client registration and credential checks.
 *
 * <p>Input is assumed validated by the REST boundary (platform enum, non-empty
 * redirect URI set). Checks here fail closed: unknown, expired and mismatched
 * clients all return false.
 */
@ApplicationScoped
public class ClientRegistrationService {

    private static final Logger LOG = Logger.getLogger(ClientRegistrationService.class);

    static final String CLIENT_ID_PREFIX = "client_";

    @Inject
    DynamicClientRepository clientRepository;

    @Inject
    TokenCipher tokenCipher;

    @Inject
    AuthConfig authConfig;

    /**
     * Plaintext secret alongside the stored client. The secret is never
     * retrievable again.
     */
    public record RegisteredClient(DynamicClient client, String clientSecret) {}

    @Transactional
    public RegisteredClient register(ClientPlatform platform, Set<String> redirectUris) {
        return register(platform, redirectUris, authConfig.clients().expiry());
    }

    @Transactional
    public RegisteredClient register(ClientPlatform platform, Set<String> redirectUris, Duration expiresIn) {
        Instant now = Instant.now();
        String secret = SecureTokens.urlSafe(32);

        DynamicClient client = new DynamicClient();
        client.clientId = CLIENT_ID_PREFIX + SecureTokens.urlSafe(24);
        client.secretDigest = tokenCipher.digest(secret);
        client.platform = platform;
        client.redirectUris = new HashSet<>(redirectUris);
        client.createdAt = now;
        client.expiresAt = now.plus(expiresIn);

        clientRepository.persist(client);
        LOG.infof("Registered %s client %s with %d redirect URIs",
            platform.wireValue(), client.clientId, redirectUris.size());
        return new RegisteredClient(client, secret);
    }

    /**
     * Checks existence, secret (constant time) and expiry. On success the
     * client's last-used time is updated.
     */
    @Transactional
    public boolean validateCredentials(String clientId, String clientSecret) {
        Optional<DynamicClient> client = find(clientId);
        if (client.isEmpty()) {
            return false;
        }
        Instant now = Instant.now();
        if (!tokenCipher.matchesDigest(clientSecret, client.get().secretDigest)) {
            LOG.warnf("Secret mismatch for client %s", clientId);
            return false;
        }
        if (client.get().isExpired(now)) {
            LOG.infof("Rejected expired client %s", clientId);
            return false;
        }
        clientRepository.markUsed(clientId, now);
        return true;
    }

    /**
     * Exact membership of {@code redirectUri} in the client's registered set.
     * Expired clients never match.
     */
    public boolean validateRedirectUri(String clientId, String redirectUri) {
        return find(clientId)
            .filter(c -> !c.isExpired(Instant.now()))
            .map(c -> c.isRedirectUriAllowed(redirectUri))
            .orElse(false);
    }

    public Optional<DynamicClient> find(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return clientRepository.findById(clientId);
    }

    @Transactional
    public boolean revoke(String clientId) {
        boolean removed = clientRepository.deleteById(clientId);
        if (removed) {
            LOG.infof("Revoked client %s", clientId);
        }
        return removed;
    }

    /**
     * Newest first, optionally filtered by platform.
     */
    public List<DynamicClient> list(ClientPlatform platform) {
        return clientRepository.list(platform);
    }

    @Transactional
    public long cleanupExpired() {
        long removed = clientRepository.deleteExpired(Instant.now());
        if (removed > 0) {
            LOG.infof("Removed %d expired clients", removed);
        }
        return removed;
    }
}
