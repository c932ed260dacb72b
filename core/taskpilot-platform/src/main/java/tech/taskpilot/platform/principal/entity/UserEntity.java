package tech.taskpilot.platform.principal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for users table.
 */
@Entity
@Table(name = "users",
    indexes = @Index(name = "idx_users_email", columnList = "email", unique = true))
public class UserEntity {

    @Id
    @Column(name = "user_id", length = 255)
    public String userId;

    @Column(name = "email", nullable = false, length = 255)
    public String email;

    @Column(name = "name", length = 255)
    public String name;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_login", nullable = false)
    public Instant lastLogin;

    public UserEntity() {
    }
}
