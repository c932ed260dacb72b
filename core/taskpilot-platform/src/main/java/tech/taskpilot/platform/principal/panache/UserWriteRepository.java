package tech.taskpilot.platform.principal.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.taskpilot.platform.principal.User;
import tech.taskpilot.platform.principal.entity.UserEntity;
import tech.taskpilot.platform.principal.mapper.UserMapper;

/**
 * Write-side repository for User entities.
 */
@ApplicationScoped
@Transactional
public class UserWriteRepository implements PanacheRepositoryBase<UserEntity, String> {

    public void persistUser(User user) {
        persist(UserMapper.toEntity(user));
    }

    public void updateUser(User user) {
        UserEntity entity = findById(user.userId);
        if (entity != null) {
            UserMapper.updateEntity(entity, user);
        }
    }
}
