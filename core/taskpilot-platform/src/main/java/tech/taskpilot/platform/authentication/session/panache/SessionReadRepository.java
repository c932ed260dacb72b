package tech.taskpilot.platform.authentication.session.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.taskpilot.platform.authentication.session.Session;
import tech.taskpilot.platform.authentication.session.SessionRepository;
import tech.taskpilot.platform.authentication.session.entity.SessionEntity;
import tech.taskpilot.platform.authentication.session.mapper.SessionMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Session entities.
 * Uses EntityManager for queries and delegates writes to SessionWriteRepository.
 */
@ApplicationScoped
public class SessionReadRepository implements SessionRepository {

    @Inject
    EntityManager em;

    @Inject
    SessionWriteRepository writeRepo;

    @Override
    public Optional<Session> findById(String sessionId) {
        return Optional.ofNullable(SessionMapper.toDomain(em.find(SessionEntity.class, sessionId)));
    }

    @Override
    public List<Session> findByUserId(String userId) {
        return em.createQuery(
                "FROM SessionEntity WHERE userId = :userId ORDER BY createdAt DESC", SessionEntity.class)
            .setParameter("userId", userId)
            .getResultList()
            .stream()
            .map(SessionMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(Session session) {
        writeRepo.persistSession(session);
    }

    @Override
    public boolean touch(String sessionId, Instant now) {
        return writeRepo.touch(sessionId, now);
    }

    @Override
    public boolean replaceAccessToken(String sessionId, byte[] accessToken, Instant expiresAt, Instant now) {
        return writeRepo.replaceAccessToken(sessionId, accessToken, expiresAt, now);
    }

    @Override
    public boolean deleteById(String sessionId) {
        return writeRepo.deleteSession(sessionId);
    }

    @Override
    public long deleteExpired(Instant now) {
        return writeRepo.deleteExpired(now);
    }
}
