package tech.taskpilot.task;

import java.time.Instant;

/**
 * Block time on the caller's calendar for a task.
 *
 * @param durationMinutes 5 to 480
 */
public record ScheduleTaskCommand(long taskId, Instant startTime, int durationMinutes) {

    public static final int DEFAULT_DURATION_MINUTES = 60;
}
