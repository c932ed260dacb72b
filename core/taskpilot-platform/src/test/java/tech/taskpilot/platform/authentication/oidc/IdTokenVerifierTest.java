package tech.taskpilot.platform.authentication.oidc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.taskpilot.testing.TestAuthConfig;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdTokenVerifier with a locally generated signing key.
 */
@ExtendWith(MockitoExtension.class)
class IdTokenVerifierTest {

    private static final String KID = "test-key-1";
    private static KeyPair keyPair;

    @Mock
    private JwksService jwksService;

    private IdTokenVerifier verifier;

    @BeforeAll
    static void generateKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        verifier = new IdTokenVerifier();
        verifier.jwksService = jwksService;
        verifier.authConfig = new TestAuthConfig();
    }

    // ========================================
    // ACCEPTED TOKENS
    // ========================================

    @Test
    @DisplayName("verify should return subject, email and name for a valid token")
    void verify_shouldReturnClaims_whenTokenValid() throws Exception {
        // Arrange
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("https://accounts.google.com",
            "\"" + TestAuthConfig.CLIENT_ID + "\"", inOneHour()));

        // Act
        var claims = verifier.verify(token);

        // Assert
        assertThat(claims.subject()).isEqualTo("google-sub-1");
        assertThat(claims.email()).isEqualTo("ada@example.com");
        assertThat(claims.name()).isEqualTo("Ada Lovelace");
    }

    @Test
    @DisplayName("verify should accept an audience array containing our client id")
    void verify_shouldAccept_whenAudienceArrayContainsClientId() throws Exception {
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("accounts.google.com",
            "[\"other-client\",\"" + TestAuthConfig.CLIENT_ID + "\"]", inOneHour()));

        assertThat(verifier.verify(token).subject()).isEqualTo("google-sub-1");
    }

    // ========================================
    // REJECTED TOKENS
    // ========================================

    @Test
    @DisplayName("verify should reject tokens issued for another client")
    void verify_shouldThrow_whenAudienceMismatch() throws Exception {
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("https://accounts.google.com", "\"other-client\"", inOneHour()));

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessageContaining("audience");
    }

    @Test
    @DisplayName("verify should reject tokens from an unknown issuer")
    void verify_shouldThrow_whenIssuerUnknown() throws Exception {
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("https://evil.example.com",
            "\"" + TestAuthConfig.CLIENT_ID + "\"", inOneHour()));

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessageContaining("issuer");
    }

    @Test
    @DisplayName("verify should reject expired tokens")
    void verify_shouldThrow_whenExpired() throws Exception {
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("https://accounts.google.com",
            "\"" + TestAuthConfig.CLIENT_ID + "\"", Instant.now().minusSeconds(60).getEpochSecond()));

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessageContaining("expired");
    }

    @Test
    @DisplayName("verify should reject a payload altered after signing")
    void verify_shouldThrow_whenPayloadTampered() throws Exception {
        // Arrange
        when(jwksService.getPublicKey(KID)).thenReturn((RSAPublicKey) keyPair.getPublic());
        String token = sign(header("RS256"), payload("https://accounts.google.com",
            "\"" + TestAuthConfig.CLIENT_ID + "\"", inOneHour()));
        String[] parts = token.split("\\.");
        String forged = encode(payload("https://accounts.google.com",
            "\"" + TestAuthConfig.CLIENT_ID + "\"", inOneHour()).replace("google-sub-1", "google-sub-2"));

        // Act & Assert
        assertThatThrownBy(() -> verifier.verify(parts[0] + "." + forged + "." + parts[2]))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessageContaining("signature");
    }

    @Test
    @DisplayName("verify should refuse any algorithm other than RS256 before looking up keys")
    void verify_shouldThrow_whenAlgorithmNotRs256() {
        String token = encode(header("HS256")) + "." + encode("{}") + ".c2ln";

        assertThatThrownBy(() -> verifier.verify(token))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessageContaining("HS256");
        verifyNoInteractions(jwksService);
    }

    @Test
    @DisplayName("verify should reject strings that are not three segments")
    void verify_shouldThrow_whenMalformed() {
        assertThatThrownBy(() -> verifier.verify("not-a-jwt"))
            .isInstanceOf(IdentityProviderException.class)
            .hasMessage("Invalid ID token format");
    }

    // ========================================
    // JWKS PARSING
    // ========================================

    @Test
    @DisplayName("parseJwks should read RSA signing keys and skip encryption keys")
    void parseJwks_shouldReturnSigningKeysByKid() throws Exception {
        // Arrange
        RSAPublicKey publicKey = (RSAPublicKey) keyPair.getPublic();
        String n = unsigned(publicKey.getModulus());
        String e = unsigned(publicKey.getPublicExponent());
        String jwks = "{\"keys\":["
            + "{\"kid\":\"sig-key\",\"kty\":\"RSA\",\"use\":\"sig\",\"alg\":\"RS256\",\"n\":\"" + n + "\",\"e\":\"" + e + "\"},"
            + "{\"kid\":\"enc-key\",\"kty\":\"RSA\",\"use\":\"enc\",\"n\":\"" + n + "\",\"e\":\"" + e + "\"},"
            + "{\"kid\":\"ec-key\",\"kty\":\"EC\"}"
            + "]}";

        // Act
        Map<String, RSAPublicKey> keys = JwksService.parseJwks(jwks);

        // Assert
        assertThat(keys).containsOnlyKeys("sig-key");
        assertThat(keys.get("sig-key").getModulus()).isEqualTo(publicKey.getModulus());
    }

    @Test
    @DisplayName("parseJwks should reject documents without a keys array")
    void parseJwks_shouldThrow_whenKeysMissing() {
        assertThatThrownBy(() -> JwksService.parseJwks("{\"foo\":1}"))
            .isInstanceOf(JwksService.JwksException.class);
    }

    // ========================================
    // HELPERS
    // ========================================

    private static String header(String alg) {
        return "{\"alg\":\"" + alg + "\",\"kid\":\"" + KID + "\",\"typ\":\"JWT\"}";
    }

    private static String payload(String issuer, String audienceJson, long exp) {
        return "{\"iss\":\"" + issuer + "\",\"aud\":" + audienceJson
            + ",\"sub\":\"google-sub-1\",\"email\":\"ada@example.com\",\"name\":\"Ada Lovelace\",\"exp\":" + exp + "}";
    }

    private static long inOneHour() {
        return Instant.now().plusSeconds(3600).getEpochSecond();
    }

    private static String sign(String header, String payload) throws Exception {
        String signingInput = encode(header) + "." + encode(payload);
        Signature signature = Signature.getInstance("SHA256withRSA");
        signature.initSign(keyPair.getPrivate());
        signature.update(signingInput.getBytes(StandardCharsets.US_ASCII));
        return signingInput + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(signature.sign());
    }

    private static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static String unsigned(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            bytes = trimmed;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
