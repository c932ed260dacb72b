package tech.taskpilot.platform.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;

import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Fetches and caches the identity provider's signing keys (JWKS).
 *
 * <p>Parsed keys are cached by key id for an hour. An unknown key id forces a
 * refetch, which picks up provider key rotation.
 */
@ApplicationScoped
public class JwksService {

    private static final Logger LOG = Logger.getLogger(JwksService.class);
    private static final Duration CACHE_TTL = Duration.ofHours(1);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig authConfig;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final Cache<String, RSAPublicKey> keyCache = Caffeine.newBuilder()
        .expireAfterWrite(CACHE_TTL)
        .maximumSize(100)
        .build();

    /**
     * Get the RSA public key for a key id, fetching the JWKS if needed.
     *
     * @throws JwksException if the key cannot be found or fetched
     */
    public RSAPublicKey getPublicKey(String kid) throws JwksException {
        RSAPublicKey cached = keyCache.getIfPresent(kid);
        if (cached != null) {
            return cached;
        }

        LOG.infof("Key ID %s not cached, fetching JWKS", kid);
        Map<String, RSAPublicKey> keys = parseJwks(fetchJwks());
        keyCache.putAll(keys);

        RSAPublicKey key = keys.get(kid);
        if (key == null) {
            throw new JwksException("Key ID " + kid + " not found in JWKS");
        }
        return key;
    }

    private String fetchJwks() throws JwksException {
        String jwksUri = authConfig.google().jwksUri();
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(jwksUri))
                .GET()
                .timeout(authConfig.google().httpTimeout())
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new JwksException("Failed to fetch JWKS: HTTP " + response.statusCode());
            }
            return response.body();
        } catch (JwksException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JwksException("Interrupted while fetching JWKS", e);
        } catch (Exception e) {
            throw new JwksException("Failed to fetch JWKS: " + e.getMessage(), e);
        }
    }

    /**
     * Parse every RSA signing key in a JWKS document, keyed by kid.
     */
    static Map<String, RSAPublicKey> parseJwks(String jwksJson) throws JwksException {
        try {
            JsonNode jwks = MAPPER.readTree(jwksJson);
            JsonNode keys = jwks.get("keys");
            if (keys == null || !keys.isArray()) {
                throw new JwksException("Invalid JWKS format - missing 'keys' array");
            }

            Map<String, RSAPublicKey> result = new HashMap<>();
            for (JsonNode key : keys) {
                String kid = key.path("kid").asText(null);
                String kty = key.path("kty").asText(null);
                String use = key.path("use").asText(null);
                if (kid == null || !"RSA".equals(kty)) {
                    continue;
                }
                if (use != null && !"sig".equals(use)) {
                    LOG.debugf("Skipping key %s not intended for signing (use=%s)", kid, use);
                    continue;
                }
                result.put(kid, parseRsaPublicKey(key));
            }
            return result;
        } catch (JwksException e) {
            throw e;
        } catch (Exception e) {
            throw new JwksException("Failed to parse JWKS: " + e.getMessage(), e);
        }
    }

    private static RSAPublicKey parseRsaPublicKey(JsonNode keyNode) throws JwksException {
        String n = keyNode.path("n").asText(null);
        String e = keyNode.path("e").asText(null);
        if (n == null || e == null) {
            throw new JwksException("RSA key missing modulus (n) or exponent (e)");
        }
        try {
            BigInteger modulus = new BigInteger(1, Base64.getUrlDecoder().decode(n));
            BigInteger exponent = new BigInteger(1, Base64.getUrlDecoder().decode(e));
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (Exception ex) {
            throw new JwksException("Failed to parse RSA public key: " + ex.getMessage(), ex);
        }
    }

    /**
     * Exception for JWKS-related errors.
     */
    public static class JwksException extends Exception {
        public JwksException(String message) {
            super(message);
        }
        public JwksException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
