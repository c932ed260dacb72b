package tech.taskpilot.task.mapper;

import tech.taskpilot.task.Task;
import tech.taskpilot.task.entity.TaskEntity;

/**
 * Mapper for converting between Task domain model and JPA entity.
 */
public final class TaskMapper {

    private TaskMapper() {
    }

    public static Task toDomain(TaskEntity entity) {
        if (entity == null) {
            return null;
        }

        Task domain = new Task();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.title = entity.title;
        domain.project = entity.project;
        domain.priority = entity.priority;
        domain.energy = entity.energy;
        domain.timeEstimate = entity.timeEstimate;
        domain.notes = entity.notes;
        domain.dueDate = entity.dueDate;
        domain.completed = entity.completed;
        domain.completedAt = entity.completedAt;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        domain.calendarEventId = entity.calendarEventId;
        domain.calendarEventUrl = entity.calendarEventUrl;
        domain.scheduledStart = entity.scheduledStart;
        domain.scheduledDuration = entity.scheduledDuration;
        return domain;
    }

    public static TaskEntity toEntity(Task domain) {
        if (domain == null) {
            return null;
        }

        TaskEntity entity = new TaskEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    /**
     * Copy mutable fields. Id, owner and creation time never change.
     */
    public static void updateEntity(TaskEntity entity, Task domain) {
        entity.title = domain.title;
        entity.project = domain.project;
        entity.priority = domain.priority;
        entity.energy = domain.energy;
        entity.timeEstimate = domain.timeEstimate;
        entity.notes = domain.notes;
        entity.dueDate = domain.dueDate;
        entity.completed = domain.completed;
        entity.completedAt = domain.completedAt;
        entity.updatedAt = domain.updatedAt;
        entity.calendarEventId = domain.calendarEventId;
        entity.calendarEventUrl = domain.calendarEventUrl;
        entity.scheduledStart = domain.scheduledStart;
        entity.scheduledDuration = domain.scheduledDuration;
    }
}
