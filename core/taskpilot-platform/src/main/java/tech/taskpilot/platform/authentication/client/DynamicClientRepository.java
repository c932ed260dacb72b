package tech.taskpilot.platform.authentication.client;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for DynamicClient entities.
 */
public interface DynamicClientRepository {

    // Read operations
    Optional<DynamicClient> findById(String clientId);

    /**
     * Newest first. A null platform lists every client.
     */
    List<DynamicClient> list(ClientPlatform platform);

    // Write operations
    void persist(DynamicClient client);
    void markUsed(String clientId, Instant now);
    boolean deleteById(String clientId);
    long deleteExpired(Instant now);
}
