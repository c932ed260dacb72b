package tech.taskpilot.platform.authentication.client;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A client application that registered itself at runtime (RFC 7591 style).
 *
 * <p>Only a keyed digest of the secret is kept; the plaintext is handed out once
 * at registration.
 */
public class DynamicClient {

    public String clientId;

    public byte[] secretDigest;

    public ClientPlatform platform;

    public Set<String> redirectUris = new HashSet<>();

    public Instant createdAt;

    public Instant expiresAt;

    /** Null until the first successful credential check. */
    public Instant lastUsed;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Exact membership only. No prefix, wildcard or normalisation.
     */
    public boolean isRedirectUriAllowed(String uri) {
        return uri != null && redirectUris.contains(uri);
    }
}
