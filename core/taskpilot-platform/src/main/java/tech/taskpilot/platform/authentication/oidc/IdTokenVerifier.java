package tech.taskpilot.platform.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthConfig;

import java.nio.charset.StandardCharsets;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Base64;

/**
 * Verifies identity tokens: RS256 signature against the provider JWKS,
 * issuer, audience (our client id) and expiry.
 */
@ApplicationScoped
public class IdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(IdTokenVerifier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    JwksService jwksService;

    @Inject
    AuthConfig authConfig;

    public IdentityProviderClient.IdentityClaims verify(String idToken) throws IdentityProviderException {
        String[] parts = idToken == null ? new String[0] : idToken.split("\\.");
        if (parts.length != 3) {
            throw new IdentityProviderException("Invalid ID token format");
        }

        try {
            JsonNode header = decodeSegment(parts[0]);
            String alg = header.path("alg").asText(null);
            String kid = header.path("kid").asText(null);

            // Only RS256: prevents algorithm confusion
            if (!"RS256".equals(alg)) {
                LOG.warnf("Rejecting ID token with unsupported algorithm: %s", alg);
                throw new IdentityProviderException("Unsupported ID token algorithm: " + alg);
            }
            if (kid == null || kid.isBlank()) {
                throw new IdentityProviderException("ID token missing key ID (kid)");
            }

            RSAPublicKey key = jwksService.getPublicKey(kid);
            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initVerify(key);
            sig.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
            if (!sig.verify(Base64.getUrlDecoder().decode(parts[2]))) {
                throw new IdentityProviderException("Invalid ID token signature");
            }

            JsonNode payload = decodeSegment(parts[1]);
            checkIssuer(payload.path("iss").asText(null));
            checkAudience(payload.get("aud"));
            checkExpiry(payload.path("exp").asLong(0));

            return new IdentityProviderClient.IdentityClaims(
                payload.path("sub").asText(null),
                payload.path("email").asText(null),
                payload.path("name").asText(null));

        } catch (IdentityProviderException e) {
            throw e;
        } catch (JwksService.JwksException e) {
            throw new IdentityProviderException("Unable to obtain signing key: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new IdentityProviderException("Failed to verify ID token: " + e.getMessage(), e);
        }
    }

    private void checkIssuer(String issuer) throws IdentityProviderException {
        if (issuer == null || !authConfig.google().issuers().contains(issuer)) {
            LOG.warnf("Invalid ID token issuer: %s", issuer);
            throw new IdentityProviderException("Invalid token issuer");
        }
    }

    private void checkAudience(JsonNode aud) throws IdentityProviderException {
        String clientId = authConfig.google().clientId();
        boolean matches = false;
        if (aud != null && aud.isTextual()) {
            matches = clientId.equals(aud.asText());
        } else if (aud != null && aud.isArray()) {
            for (JsonNode entry : aud) {
                if (clientId.equals(entry.asText())) {
                    matches = true;
                    break;
                }
            }
        }
        if (!matches) {
            throw new IdentityProviderException("ID token audience does not match client id");
        }
    }

    private static void checkExpiry(long exp) throws IdentityProviderException {
        if (exp <= 0 || !Instant.now().isBefore(Instant.ofEpochSecond(exp))) {
            throw new IdentityProviderException("ID token has expired");
        }
    }

    private static JsonNode decodeSegment(String segment) throws Exception {
        return MAPPER.readTree(new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8));
    }
}
