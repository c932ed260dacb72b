package tech.taskpilot.platform.authentication.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.taskpilot.platform.security.cipher.TokenCipher;
import tech.taskpilot.testing.InMemoryDynamicClientRepository;
import tech.taskpilot.testing.TestAuthConfig;
import tech.taskpilot.testing.TestKeys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ClientRegistrationService.
 *
 * Credential checks guard the authorization flow for third-party apps, so
 * every negative path must fail closed.
 */
class ClientRegistrationServiceTest {

    private static final Set<String> REDIRECTS = Set.of("myapp://callback", "http://localhost:3000/cb");

    private InMemoryDynamicClientRepository repository;
    private ClientRegistrationService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDynamicClientRepository();
        service = new ClientRegistrationService();
        service.clientRepository = repository;
        service.tokenCipher = TokenCipher.withKey(TestKeys.APP_KEY);
        service.authConfig = new TestAuthConfig();
    }

    // ========================================
    // REGISTER
    // ========================================

    @Test
    @DisplayName("register should return a prefixed id and a secret that is not stored in plaintext")
    void register_shouldReturnSecretOnce_andStoreDigestOnly() {
        // Act
        var registered = service.register(ClientPlatform.IOS, REDIRECTS);

        // Assert
        DynamicClient stored = repository.findById(registered.client().clientId).orElseThrow();
        assertThat(registered.client().clientId).startsWith("client_");
        assertThat(registered.clientSecret()).hasSize(43);
        assertThat(stored.secretDigest).isNotEqualTo(registered.clientSecret().getBytes(StandardCharsets.UTF_8));
        assertThat(stored.redirectUris).containsExactlyInAnyOrderElementsOf(REDIRECTS);
        assertThat(stored.lastUsed).isNull();
    }

    @Test
    @DisplayName("register should set the expiry from configuration")
    void register_shouldApplyConfiguredExpiry() {
        var registered = service.register(ClientPlatform.CLI, REDIRECTS);

        DynamicClient client = registered.client();
        assertThat(Duration.between(client.createdAt, client.expiresAt)).isEqualTo(Duration.ofDays(365));
    }

    // ========================================
    // VALIDATE CREDENTIALS
    // ========================================

    @Test
    @DisplayName("validateCredentials should accept the issued secret and record last use")
    void validateCredentials_shouldAccept_whenSecretMatches() {
        var registered = service.register(ClientPlatform.ANDROID, REDIRECTS);

        boolean valid = service.validateCredentials(registered.client().clientId, registered.clientSecret());

        assertThat(valid).isTrue();
        assertThat(repository.findById(registered.client().clientId).orElseThrow().lastUsed).isNotNull();
    }

    @Test
    @DisplayName("validateCredentials should reject a wrong secret without recording use")
    void validateCredentials_shouldReject_whenSecretWrong() {
        var registered = service.register(ClientPlatform.ANDROID, REDIRECTS);

        boolean valid = service.validateCredentials(registered.client().clientId, "wrong-secret");

        assertThat(valid).isFalse();
        assertThat(repository.findById(registered.client().clientId).orElseThrow().lastUsed).isNull();
    }

    @Test
    @DisplayName("validateCredentials should reject unknown and blank client ids")
    void validateCredentials_shouldReject_whenClientUnknown() {
        assertThat(service.validateCredentials("client_missing", "secret")).isFalse();
        assertThat(service.validateCredentials(null, "secret")).isFalse();
    }

    @Test
    @DisplayName("validateCredentials should reject an expired client even with the right secret")
    void validateCredentials_shouldReject_whenClientExpired() {
        var registered = service.register(ClientPlatform.MACOS, REDIRECTS, Duration.ofSeconds(-1));

        assertThat(service.validateCredentials(registered.client().clientId, registered.clientSecret())).isFalse();
    }

    // ========================================
    // REDIRECT URIS
    // ========================================

    @Test
    @DisplayName("validateRedirectUri should require an exact match")
    void validateRedirectUri_shouldRequireExactMatch() {
        String clientId = service.register(ClientPlatform.IOS, REDIRECTS).client().clientId;

        assertThat(service.validateRedirectUri(clientId, "myapp://callback")).isTrue();
        assertThat(service.validateRedirectUri(clientId, "myapp://callback/")).isFalse();
        assertThat(service.validateRedirectUri(clientId, "myapp://callback?x=1")).isFalse();
        assertThat(service.validateRedirectUri(clientId, "MYAPP://callback")).isFalse();
        assertThat(service.validateRedirectUri("client_missing", "myapp://callback")).isFalse();
    }

    @Test
    @DisplayName("validateRedirectUri should reject URIs of expired clients")
    void validateRedirectUri_shouldReject_whenClientExpired() {
        String clientId = service.register(ClientPlatform.IOS, REDIRECTS, Duration.ofSeconds(-1)).client().clientId;

        assertThat(service.validateRedirectUri(clientId, "myapp://callback")).isFalse();
    }

    // ========================================
    // REVOKE / LIST / CLEANUP
    // ========================================

    @Test
    @DisplayName("revoke should remove the client and report whether it existed")
    void revoke_shouldRemoveClient() {
        var registered = service.register(ClientPlatform.WINDOWS, REDIRECTS);

        assertThat(service.revoke(registered.client().clientId)).isTrue();
        assertThat(service.revoke(registered.client().clientId)).isFalse();
        assertThat(service.validateCredentials(registered.client().clientId, registered.clientSecret())).isFalse();
    }

    @Test
    @DisplayName("list should filter by platform")
    void list_shouldFilterByPlatform() {
        service.register(ClientPlatform.IOS, REDIRECTS);
        service.register(ClientPlatform.IOS, REDIRECTS);
        service.register(ClientPlatform.LINUX, REDIRECTS);

        assertThat(service.list(ClientPlatform.IOS)).hasSize(2);
        assertThat(service.list(null)).hasSize(3);
    }

    @Test
    @DisplayName("cleanupExpired should remove expired clients only")
    void cleanupExpired_shouldRemoveExpiredClients() {
        service.register(ClientPlatform.IOS, REDIRECTS, Duration.ofSeconds(-5));
        var live = service.register(ClientPlatform.IOS, REDIRECTS);

        assertThat(service.cleanupExpired()).isEqualTo(1);
        assertThat(service.find(live.client().clientId)).isPresent();
    }
}
