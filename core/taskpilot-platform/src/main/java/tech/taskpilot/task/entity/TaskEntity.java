package tech.taskpilot.task.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import tech.taskpilot.platform.principal.entity.UserEntity;
import tech.taskpilot.task.Energy;

import java.time.Instant;

/**
 * JPA entity for tasks table.
 *
 * <p>The owner foreign key has no delete action: a user with tasks cannot be deleted.
 */
@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_tasks_user_id", columnList = "user_id"),
    @Index(name = "idx_tasks_user_completed", columnList = "user_id, completed"),
    @Index(name = "idx_tasks_project", columnList = "project")
})
public class TaskEntity {

    @Id
    @Column(name = "id")
    public Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_tasks_user"))
    public UserEntity user;

    @Column(name = "user_id", insertable = false, updatable = false)
    public String userId;

    @Column(name = "title", nullable = false, length = 500)
    public String title;

    @Column(name = "project", length = 100)
    public String project;

    @Column(name = "priority", nullable = false)
    public int priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "energy", nullable = false, length = 10)
    public Energy energy;

    @Column(name = "time_estimate", length = 50)
    public String timeEstimate;

    @Column(name = "notes", columnDefinition = "TEXT")
    public String notes;

    @Column(name = "due_date")
    public Instant dueDate;

    @Column(name = "completed", nullable = false)
    public boolean completed;

    @Column(name = "completed_at")
    public Instant completedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "calendar_event_id", length = 255)
    public String calendarEventId;

    @Column(name = "calendar_event_url", length = 2000)
    public String calendarEventUrl;

    @Column(name = "scheduled_start")
    public Instant scheduledStart;

    @Column(name = "scheduled_duration")
    public Integer scheduledDuration;

    public TaskEntity() {
    }
}
