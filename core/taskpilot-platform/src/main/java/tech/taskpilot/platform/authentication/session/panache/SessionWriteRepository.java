package tech.taskpilot.platform.authentication.session.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.taskpilot.platform.authentication.session.Session;
import tech.taskpilot.platform.authentication.session.entity.SessionEntity;
import tech.taskpilot.platform.authentication.session.mapper.SessionMapper;
import tech.taskpilot.platform.principal.entity.UserEntity;

import java.time.Instant;

/**
 * Write-side repository for Session entities.
 *
 * <p>Updates are bulk JPQL statements, so a refresh writes token and expiry
 * together or not at all.
 */
@ApplicationScoped
@Transactional
public class SessionWriteRepository implements PanacheRepositoryBase<SessionEntity, String> {

    public void persistSession(Session session) {
        SessionEntity entity = SessionMapper.toEntity(session);
        entity.user = getEntityManager().getReference(UserEntity.class, session.userId);
        persist(entity);
    }

    public boolean touch(String sessionId, Instant now) {
        int updated = update("lastActivity = :now where sessionId = :id and lastActivity <= :now",
            Parameters.with("now", now).and("id", sessionId));
        return updated > 0 || count("sessionId", sessionId) > 0;
    }

    public boolean replaceAccessToken(String sessionId, byte[] accessToken, Instant expiresAt, Instant now) {
        int updated = update(
            "accessToken = :token, expiresAt = :expiresAt, lastActivity = :now where sessionId = :id",
            Parameters.with("token", accessToken)
                .and("expiresAt", expiresAt)
                .and("now", now)
                .and("id", sessionId));
        return updated > 0;
    }

    public boolean deleteSession(String sessionId) {
        return delete("sessionId", sessionId) > 0;
    }

    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
