package tech.taskpilot.platform.authentication.client.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.taskpilot.platform.authentication.client.ClientPlatform;
import tech.taskpilot.platform.authentication.client.DynamicClient;
import tech.taskpilot.platform.authentication.client.DynamicClientRepository;
import tech.taskpilot.platform.authentication.client.entity.DynamicClientEntity;
import tech.taskpilot.platform.authentication.client.mapper.DynamicClientMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for DynamicClient entities.
 * Uses EntityManager for queries and delegates writes to DynamicClientWriteRepository.
 */
@ApplicationScoped
public class DynamicClientReadRepository implements DynamicClientRepository {

    @Inject
    EntityManager em;

    @Inject
    DynamicClientWriteRepository writeRepo;

    @Override
    public Optional<DynamicClient> findById(String clientId) {
        return Optional.ofNullable(DynamicClientMapper.toDomain(em.find(DynamicClientEntity.class, clientId)));
    }

    @Override
    public List<DynamicClient> list(ClientPlatform platform) {
        var query = platform == null
            ? em.createQuery("FROM DynamicClientEntity ORDER BY createdAt DESC", DynamicClientEntity.class)
            : em.createQuery("FROM DynamicClientEntity WHERE platform = :platform ORDER BY createdAt DESC",
                    DynamicClientEntity.class)
                .setParameter("platform", platform);
        return query.getResultList()
            .stream()
            .map(DynamicClientMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(DynamicClient client) {
        writeRepo.persistClient(client);
    }

    @Override
    public void markUsed(String clientId, Instant now) {
        writeRepo.markUsed(clientId, now);
    }

    @Override
    public boolean deleteById(String clientId) {
        return writeRepo.deleteClient(clientId);
    }

    @Override
    public long deleteExpired(Instant now) {
        return writeRepo.deleteExpired(now);
    }
}
