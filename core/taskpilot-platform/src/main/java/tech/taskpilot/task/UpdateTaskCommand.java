package tech.taskpilot.task;

import java.time.Instant;

/**
 * Partial update. A null field leaves the stored value unchanged.
 */
public record UpdateTaskCommand(
    long taskId,
    String title,
    String project,
    Integer priority,
    Energy energy,
    String timeEstimate,
    String notes,
    Instant dueDate,
    Boolean completed
) {}
