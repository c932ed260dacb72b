package tech.taskpilot.platform.principal;

import java.time.Instant;

/**
 * A person authenticated through the upstream identity provider.
 *
 * <p>The id is the provider's subject claim, never generated locally. Users own
 * sessions (deleted with the user) and tasks (which block user deletion).
 */
public class User {

    public String userId;

    public String email;

    public String name;

    public Instant createdAt;

    public Instant lastLogin;

    public User() {
    }

    public User(String userId, String email, String name, Instant now) {
        this.userId = userId;
        this.email = email;
        this.name = name;
        this.createdAt = now;
        this.lastLogin = now;
    }
}
