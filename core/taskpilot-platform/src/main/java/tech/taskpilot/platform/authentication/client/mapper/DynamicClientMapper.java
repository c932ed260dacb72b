package tech.taskpilot.platform.authentication.client.mapper;

import tech.taskpilot.platform.authentication.client.DynamicClient;
import tech.taskpilot.platform.authentication.client.entity.DynamicClientEntity;

import java.util.HashSet;

/**
 * Mapper for converting between DynamicClient domain model and JPA entity.
 */
public final class DynamicClientMapper {

    private DynamicClientMapper() {
    }

    public static DynamicClient toDomain(DynamicClientEntity entity) {
        if (entity == null) {
            return null;
        }

        DynamicClient domain = new DynamicClient();
        domain.clientId = entity.clientId;
        domain.secretDigest = entity.secretDigest;
        domain.platform = entity.platform;
        domain.redirectUris = entity.redirectUris != null ? new HashSet<>(entity.redirectUris) : new HashSet<>();
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.lastUsed = entity.lastUsed;
        return domain;
    }

    public static DynamicClientEntity toEntity(DynamicClient domain) {
        if (domain == null) {
            return null;
        }

        DynamicClientEntity entity = new DynamicClientEntity();
        entity.clientId = domain.clientId;
        entity.secretDigest = domain.secretDigest;
        entity.platform = domain.platform;
        entity.redirectUris = new HashSet<>(domain.redirectUris);
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.lastUsed = domain.lastUsed;
        return entity;
    }
}
