package tech.taskpilot.platform.security.cipher;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Encrypts provider tokens for storage using AES-256-GCM.
 *
 * <p>The ciphertext format: IV (12 bytes) + encrypted data + auth tag (16 bytes).
 * GCM authenticates the bytes, so tampering, truncation or a different key all
 * fail with {@link TokenDecryptionException} instead of producing garbage.
 *
 * <p>The key comes from {@code taskpilot.app-key} (or {@code TASKPILOT_APP_KEY}):
 * a Base64-encoded 256-bit key, generated with {@code openssl rand -base64 32}.
 * The bean is created at startup so a missing or malformed key stops the process
 * before any request is served. There is no key rotation: replacing the key makes
 * every stored session undecryptable.
 *
 * <p>The same key also derives a MAC sub-key used to digest client secrets, see
 * {@link #digest(String)}.
 */
@Startup
@ApplicationScoped
public class TokenCipher {

    private static final Logger LOG = Logger.getLogger(TokenCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final byte[] DIGEST_KEY_LABEL = "taskpilot-client-secret-digest".getBytes(StandardCharsets.UTF_8);
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @ConfigProperty(name = "taskpilot.app-key")
    Optional<String> appKey;

    private SecretKey secretKey;
    private SecretKey digestKey;

    @PostConstruct
    void init() {
        if (appKey == null || appKey.isEmpty() || appKey.get().isBlank()) {
            throw new CipherConfigurationException(
                "No encryption key configured. Set TASKPILOT_APP_KEY or taskpilot.app-key. " +
                "Generate with: openssl rand -base64 32");
        }
        secretKey = parseKey(appKey.get());
        digestKey = deriveDigestKey(secretKey);
        LOG.info("Token cipher initialized with AES-256-GCM");
    }

    /**
     * Build a cipher outside of CDI, e.g. for key tooling and tests.
     */
    public static TokenCipher withKey(String base64Key) {
        TokenCipher cipher = new TokenCipher();
        cipher.appKey = Optional.ofNullable(base64Key);
        cipher.init();
        return cipher;
    }

    private static SecretKey parseKey(String base64Key) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new CipherConfigurationException(
                "taskpilot.app-key must be valid Base64. Generate with: openssl rand -base64 32", e);
        }
        if (keyBytes.length != 32) {
            throw new CipherConfigurationException(
                "taskpilot.app-key must be 256 bits (32 bytes) Base64-encoded. Got: " + keyBytes.length + " bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    private static SecretKey deriveDigestKey(SecretKey key) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getEncoded(), MAC_ALGORITHM));
            return new SecretKeySpec(mac.doFinal(DIGEST_KEY_LABEL), MAC_ALGORITHM);
        } catch (GeneralSecurityException e) {
            throw new CipherConfigurationException("Failed to derive digest key", e);
        }
    }

    /**
     * Encrypt a token for storage.
     *
     * @param plaintext non-empty token value
     * @return IV + ciphertext + tag
     */
    public byte[] encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Cannot encrypt an empty token");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return buffer.array();
        } catch (GeneralSecurityException e) {
            throw new CipherConfigurationException("Failed to encrypt token", e);
        }
    }

    /**
     * Decrypt a stored token.
     *
     * @throws TokenDecryptionException if the bytes are corrupt, truncated or
     *         were encrypted under a different key
     */
    public String decrypt(byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new TokenDecryptionException("Ciphertext too short");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(ciphertext);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new TokenDecryptionException("Failed to decrypt token", e);
        }
    }

    /**
     * Keyed digest of a secret (HMAC-SHA256). Stored instead of the secret itself.
     */
    public byte[] digest(String secret) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(digestKey);
            return mac.doFinal(secret.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new CipherConfigurationException("Failed to digest secret", e);
        }
    }

    /**
     * Constant-time comparison of a presented secret against a stored digest.
     */
    public boolean matchesDigest(String candidate, byte[] expectedDigest) {
        if (candidate == null || expectedDigest == null) {
            return false;
        }
        return MessageDigest.isEqual(digest(candidate), expectedDigest);
    }
}
