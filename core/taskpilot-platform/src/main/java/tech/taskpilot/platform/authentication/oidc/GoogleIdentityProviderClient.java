package tech.taskpilot.platform.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Google OAuth 2.0 token endpoint client.
 */
@ApplicationScoped
public class GoogleIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(GoogleIdentityProviderClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Used when the token response has no expires_in. */
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    @Inject
    AuthConfig authConfig;

    @Inject
    IdTokenVerifier idTokenVerifier;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    @Override
    public ProviderTokens exchangeCode(String code, String redirectUri) throws IdentityProviderException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        form.put("client_id", authConfig.google().clientId());
        form.put("client_secret", authConfig.google().clientSecret());

        JsonNode json = postForm(form, "exchange authorization code");
        return new ProviderTokens(
            json.path("access_token").asText(null),
            json.path("refresh_token").asText(null),
            json.path("id_token").asText(null),
            expiry(json));
    }

    @Override
    public IdentityClaims verifyIdentity(String idToken) throws IdentityProviderException {
        return idTokenVerifier.verify(idToken);
    }

    @Override
    public RefreshedAccess refreshAccess(String refreshToken) throws IdentityProviderException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", authConfig.google().clientId());
        form.put("client_secret", authConfig.google().clientSecret());

        JsonNode json = postForm(form, "refresh access token");
        String accessToken = json.path("access_token").asText(null);
        if (accessToken == null) {
            throw new IdentityProviderException("No access token in refresh response");
        }
        return new RefreshedAccess(accessToken, expiry(json));
    }

    private JsonNode postForm(Map<String, String> form, String action) throws IdentityProviderException {
        String body = form.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(authConfig.google().tokenEndpoint()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(authConfig.google().httpTimeout())
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                // Body carries the provider error code, never our tokens
                LOG.errorf("Token endpoint returned %d while trying to %s: %s",
                    response.statusCode(), action, response.body());
                throw new IdentityProviderException("Failed to " + action);
            }
            return MAPPER.readTree(response.body());
        } catch (IdentityProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityProviderException("Interrupted while trying to " + action, e);
        } catch (Exception e) {
            throw new IdentityProviderException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private static Instant expiry(JsonNode json) {
        long expiresIn = json.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        return Instant.now().plusSeconds(expiresIn);
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
