package tech.taskpilot.task;

import java.util.Map;

/**
 * Aggregate view of a user's tasks.
 *
 * <p>{@code byProject} and {@code byPriority} count incomplete tasks only, so
 * each sums to {@code incompleteTasks}. Tasks without a project appear under "None".
 *
 * @param completionRate percentage of completed tasks, rounded to 2 decimals; 0.0 when there are none
 */
public record TaskStats(
    long totalTasks,
    long completedTasks,
    long incompleteTasks,
    double completionRate,
    Map<String, Long> byProject,
    Map<String, Long> byPriority
) {}
