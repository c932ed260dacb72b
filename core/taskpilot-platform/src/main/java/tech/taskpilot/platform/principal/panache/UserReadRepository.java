package tech.taskpilot.platform.principal.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.taskpilot.platform.principal.User;
import tech.taskpilot.platform.principal.UserRepository;
import tech.taskpilot.platform.principal.entity.UserEntity;
import tech.taskpilot.platform.principal.mapper.UserMapper;

import java.util.Optional;

/**
 * Read-side repository for User entities.
 * Uses EntityManager for queries and delegates writes to UserWriteRepository.
 */
@ApplicationScoped
public class UserReadRepository implements UserRepository {

    @Inject
    EntityManager em;

    @Inject
    UserWriteRepository writeRepo;

    @Override
    public Optional<User> findById(String userId) {
        return Optional.ofNullable(UserMapper.toDomain(em.find(UserEntity.class, userId)));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return em.createQuery("FROM UserEntity WHERE email = :email", UserEntity.class)
            .setParameter("email", email)
            .getResultStream()
            .findFirst()
            .map(UserMapper::toDomain);
    }

    @Override
    public void persist(User user) {
        writeRepo.persistUser(user);
    }

    @Override
    public void update(User user) {
        writeRepo.updateUser(user);
    }
}
