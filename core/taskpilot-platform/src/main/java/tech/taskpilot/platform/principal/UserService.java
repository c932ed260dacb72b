package tech.taskpilot.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Maintains local user records from verified identity claims.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    @Inject
    UserRepository userRepository;

    /**
     * Create the user on first login, otherwise refresh email, name (only when
     * the provider sent one) and last-login.
     *
     * @throws EmailConflictException if the email already belongs to a different subject
     */
    @Transactional
    public User upsert(String subject, String email, String name) {
        Instant now = Instant.now();

        Optional<User> byEmail = userRepository.findByEmail(email);
        if (byEmail.isPresent() && !byEmail.get().userId.equals(subject)) {
            throw new EmailConflictException(email);
        }

        Optional<User> existing = userRepository.findById(subject);
        if (existing.isEmpty()) {
            User user = new User(subject, email, name, now);
            userRepository.persist(user);
            LOG.infof("Created user %s", subject);
            return user;
        }

        User user = existing.get();
        user.email = email;
        if (name != null && !name.isBlank()) {
            user.name = name;
        }
        user.lastLogin = now;
        userRepository.update(user);
        LOG.debugf("Updated user %s on login", subject);
        return user;
    }

    public Optional<User> findById(String userId) {
        return userRepository.findById(userId);
    }

    /**
     * Email uniqueness would be violated by the login.
     */
    public static class EmailConflictException extends RuntimeException {
        public EmailConflictException(String email) {
            super("Email already linked to another account: " + email);
        }
    }
}
