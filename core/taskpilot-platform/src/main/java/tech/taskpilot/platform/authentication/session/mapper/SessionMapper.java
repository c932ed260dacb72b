package tech.taskpilot.platform.authentication.session.mapper;

import tech.taskpilot.platform.authentication.session.Session;
import tech.taskpilot.platform.authentication.session.entity.SessionEntity;

/**
 * Mapper for converting between Session domain model and JPA entity.
 * The owning user reference is set by the write repository.
 */
public final class SessionMapper {

    private SessionMapper() {
    }

    public static Session toDomain(SessionEntity entity) {
        if (entity == null) {
            return null;
        }

        Session domain = new Session();
        domain.sessionId = entity.sessionId;
        domain.userId = entity.userId;
        domain.accessToken = entity.accessToken;
        domain.refreshToken = entity.refreshToken;
        domain.expiresAt = entity.expiresAt;
        domain.createdAt = entity.createdAt;
        domain.lastActivity = entity.lastActivity;
        domain.userAgent = entity.userAgent;
        return domain;
    }

    public static SessionEntity toEntity(Session domain) {
        if (domain == null) {
            return null;
        }

        SessionEntity entity = new SessionEntity();
        entity.sessionId = domain.sessionId;
        entity.userId = domain.userId;
        entity.accessToken = domain.accessToken;
        entity.refreshToken = domain.refreshToken;
        entity.expiresAt = domain.expiresAt;
        entity.createdAt = domain.createdAt;
        entity.lastActivity = domain.lastActivity;
        entity.userAgent = domain.userAgent;
        return entity;
    }
}
