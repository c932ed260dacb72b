package tech.taskpilot.platform.security.cipher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.taskpilot.testing.TestKeys;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class TokenCipherTest {

    private final TokenCipher cipher = TokenCipher.withKey(TestKeys.APP_KEY);

    // ========================================
    // ENCRYPT / DECRYPT
    // ========================================

    @Test
    @DisplayName("decrypt should return the original token")
    void decrypt_shouldReturnOriginal_whenCiphertextIsIntact() {
        // Arrange
        String token = "ya29.a0AfH6SMC-example-access-token";

        // Act
        byte[] ciphertext = cipher.encrypt(token);

        // Assert
        assertThat(cipher.decrypt(ciphertext)).isEqualTo(token);
    }

    @Test
    @DisplayName("encrypt should never store the plaintext and should use a fresh IV each time")
    void encrypt_shouldDifferFromPlaintext_andBetweenCalls() {
        // Arrange
        String token = "1//refresh-token-value";

        // Act
        byte[] first = cipher.encrypt(token);
        byte[] second = cipher.encrypt(token);

        // Assert
        assertThat(new String(first, StandardCharsets.ISO_8859_1)).doesNotContain(token);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("encrypt should reject an empty token")
    void encrypt_shouldThrow_whenTokenIsEmpty() {
        assertThatThrownBy(() -> cipher.encrypt(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("decrypt should fail when a single byte was flipped")
    void decrypt_shouldThrow_whenCiphertextWasTampered() {
        // Arrange
        byte[] ciphertext = cipher.encrypt("access-token");
        ciphertext[ciphertext.length - 1] ^= 0x01;

        // Act & Assert
        assertThatThrownBy(() -> cipher.decrypt(ciphertext))
            .isInstanceOf(TokenDecryptionException.class);
    }

    @Test
    @DisplayName("decrypt should fail for ciphertext shorter than IV and tag")
    void decrypt_shouldThrow_whenCiphertextIsTruncated() {
        assertThatThrownBy(() -> cipher.decrypt(new byte[10]))
            .isInstanceOf(TokenDecryptionException.class);
    }

    @Test
    @DisplayName("decrypt should fail when the ciphertext was produced under another key")
    void decrypt_shouldThrow_whenKeyDiffers() {
        // Arrange
        byte[] ciphertext = TokenCipher.withKey(TestKeys.OTHER_APP_KEY).encrypt("access-token");

        // Act & Assert
        assertThatThrownBy(() -> cipher.decrypt(ciphertext))
            .isInstanceOf(TokenDecryptionException.class);
    }

    // ========================================
    // KEY CONFIGURATION
    // ========================================

    @Test
    @DisplayName("withKey should refuse to start without a key")
    void withKey_shouldThrow_whenKeyMissing() {
        assertThatThrownBy(() -> TokenCipher.withKey(null))
            .isInstanceOf(CipherConfigurationException.class)
            .hasMessageContaining("No encryption key configured");
    }

    @Test
    @DisplayName("withKey should refuse a key that is not 256 bits")
    void withKey_shouldThrow_whenKeyHasWrongLength() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> TokenCipher.withKey(shortKey))
            .isInstanceOf(CipherConfigurationException.class)
            .hasMessageContaining("16 bytes");
    }

    @Test
    @DisplayName("withKey should refuse a key that is not Base64")
    void withKey_shouldThrow_whenKeyIsNotBase64() {
        assertThatThrownBy(() -> TokenCipher.withKey("not base64 !!"))
            .isInstanceOf(CipherConfigurationException.class);
    }

    // ========================================
    // SECRET DIGESTS
    // ========================================

    @Test
    @DisplayName("matchesDigest should accept the original secret and nothing else")
    void matchesDigest_shouldOnlyMatchOriginalSecret() {
        // Arrange
        byte[] digest = cipher.digest("client-secret");

        // Act & Assert
        assertThat(cipher.matchesDigest("client-secret", digest)).isTrue();
        assertThat(cipher.matchesDigest("client-secreT", digest)).isFalse();
        assertThat(cipher.matchesDigest(null, digest)).isFalse();
    }

    @Test
    @DisplayName("digest should depend on the application key")
    void digest_shouldDiffer_whenKeyDiffers() {
        byte[] ours = cipher.digest("client-secret");
        byte[] theirs = TokenCipher.withKey(TestKeys.OTHER_APP_KEY).digest("client-secret");

        assertThat(ours).isNotEqualTo(theirs);
    }
}
