package tech.taskpilot.platform.authentication.client.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.taskpilot.platform.authentication.client.DynamicClient;
import tech.taskpilot.platform.authentication.client.entity.DynamicClientEntity;
import tech.taskpilot.platform.authentication.client.mapper.DynamicClientMapper;

import java.time.Instant;
import java.util.List;

/**
 * Write-side repository for DynamicClient entities.
 *
 * <p>Deletes go through the entity so the redirect URI collection rows are
 * removed with it.
 */
@ApplicationScoped
@Transactional
public class DynamicClientWriteRepository implements PanacheRepositoryBase<DynamicClientEntity, String> {

    public void persistClient(DynamicClient client) {
        persist(DynamicClientMapper.toEntity(client));
    }

    public void markUsed(String clientId, Instant now) {
        update("lastUsed = :now where clientId = :id", Parameters.with("now", now).and("id", clientId));
    }

    public boolean deleteClient(String clientId) {
        DynamicClientEntity entity = findById(clientId);
        if (entity == null) {
            return false;
        }
        delete(entity);
        return true;
    }

    public long deleteExpired(Instant now) {
        List<DynamicClientEntity> expired = list("expiresAt <= ?1", now);
        expired.forEach(this::delete);
        return expired.size();
    }
}
