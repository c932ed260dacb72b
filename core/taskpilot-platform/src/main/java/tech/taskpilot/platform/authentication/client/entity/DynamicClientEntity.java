package tech.taskpilot.platform.authentication.client.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import tech.taskpilot.platform.authentication.client.ClientPlatform;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * JPA entity for dynamic_clients table.
 */
@Entity
@Table(name = "dynamic_clients", indexes = {
    @Index(name = "idx_dynamic_clients_expires_at", columnList = "expires_at"),
    @Index(name = "idx_dynamic_clients_platform", columnList = "platform")
})
public class DynamicClientEntity {

    @Id
    @Column(name = "client_id", length = 64)
    public String clientId;

    @Column(name = "secret_digest", nullable = false)
    public byte[] secretDigest;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 20)
    public ClientPlatform platform;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "dynamic_client_redirect_uris", joinColumns = @JoinColumn(name = "client_id"))
    @Column(name = "redirect_uri", nullable = false, length = 2000)
    public Set<String> redirectUris = new HashSet<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "last_used")
    public Instant lastUsed;

    public DynamicClientEntity() {
    }
}
