package tech.taskpilot.task;

import java.time.Instant;

/**
 * Input for creating a task. Null optional fields take the task defaults.
 */
public record CreateTaskCommand(
    String title,
    String project,
    Integer priority,
    Energy energy,
    String timeEstimate,
    String notes,
    Instant dueDate
) {}
