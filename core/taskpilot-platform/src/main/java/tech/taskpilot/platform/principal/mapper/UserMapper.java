package tech.taskpilot.platform.principal.mapper;

import tech.taskpilot.platform.principal.User;
import tech.taskpilot.platform.principal.entity.UserEntity;

/**
 * Mapper for converting between User domain model and JPA entity.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }

        User domain = new User();
        domain.userId = entity.userId;
        domain.email = entity.email;
        domain.name = entity.name;
        domain.createdAt = entity.createdAt;
        domain.lastLogin = entity.lastLogin;
        return domain;
    }

    public static UserEntity toEntity(User domain) {
        if (domain == null) {
            return null;
        }

        UserEntity entity = new UserEntity();
        entity.userId = domain.userId;
        entity.email = domain.email;
        entity.name = domain.name;
        entity.createdAt = domain.createdAt;
        entity.lastLogin = domain.lastLogin;
        return entity;
    }

    public static void updateEntity(UserEntity entity, User domain) {
        entity.email = domain.email;
        entity.name = domain.name;
        entity.lastLogin = domain.lastLogin;
    }
}
