package tech.taskpilot.platform.principal;

import java.util.Optional;

/**
 * Repository interface for User entities.
 */
public interface UserRepository {

    // Read operations
    Optional<User> findById(String userId);
    Optional<User> findByEmail(String email);

    // Write operations
    void persist(User user);
    void update(User user);
}
