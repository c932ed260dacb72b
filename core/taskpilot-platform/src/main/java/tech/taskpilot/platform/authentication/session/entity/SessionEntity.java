package tech.taskpilot.platform.authentication.session.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import tech.taskpilot.platform.principal.entity.UserEntity;

import java.time.Instant;

/**
 * JPA entity for sessions table.
 *
 * <p>Sessions are removed with their owning user ({@code ON DELETE CASCADE}).
 */
@Entity
@Table(name = "sessions", indexes = {
    @Index(name = "idx_sessions_user_id", columnList = "user_id"),
    @Index(name = "idx_sessions_expires_at", columnList = "expires_at")
})
public class SessionEntity {

    @Id
    @Column(name = "session_id", length = 64)
    public String sessionId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_sessions_user"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    public UserEntity user;

    @Column(name = "user_id", insertable = false, updatable = false)
    public String userId;

    @Column(name = "access_token", nullable = false)
    public byte[] accessToken;

    @Column(name = "refresh_token", nullable = false)
    public byte[] refreshToken;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_activity", nullable = false)
    public Instant lastActivity;

    @Column(name = "user_agent", length = 500)
    public String userAgent;

    public SessionEntity() {
    }
}
