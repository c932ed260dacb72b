package tech.taskpilot.mcp;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.taskpilot.task.Task;
import tech.taskpilot.task.TaskStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wire shapes for tool results. Keys are snake_case and timestamps are
 * ISO-8601 strings in UTC.
 */
public final class TaskPayloads {

    private TaskPayloads() {
    }

    public record TaskView(
        long id,
        @JsonProperty("user_id") String userId,
        String title,
        String project,
        int priority,
        String energy,
        @JsonProperty("time_estimate") String timeEstimate,
        String notes,
        @JsonProperty("due_date") String dueDate,
        boolean completed,
        @JsonProperty("completed_at") String completedAt,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("calendar_event_id") String calendarEventId,
        @JsonProperty("calendar_event_url") String calendarEventUrl,
        @JsonProperty("scheduled_start") String scheduledStart,
        @JsonProperty("scheduled_duration") Integer scheduledDuration
    ) {
        public static TaskView from(Task task) {
            return new TaskView(
                task.id,
                task.userId,
                task.title,
                task.project,
                task.priority,
                task.energy.wireValue(),
                task.timeEstimate,
                task.notes,
                iso(task.dueDate),
                task.completed,
                iso(task.completedAt),
                iso(task.createdAt),
                iso(task.updatedAt),
                task.calendarEventId,
                task.calendarEventUrl,
                iso(task.scheduledStart),
                task.scheduledDuration
            );
        }

        public static List<TaskView> fromAll(List<Task> tasks) {
            return tasks.stream().map(TaskView::from).toList();
        }
    }

    public record StatsView(
        @JsonProperty("total_tasks") long totalTasks,
        @JsonProperty("completed_tasks") long completedTasks,
        @JsonProperty("incomplete_tasks") long incompleteTasks,
        @JsonProperty("completion_rate") double completionRate,
        @JsonProperty("by_project") Map<String, Long> byProject,
        @JsonProperty("by_priority") Map<String, Long> byPriority
    ) {
        public static StatsView from(TaskStats stats) {
            return new StatsView(
                stats.totalTasks(),
                stats.completedTasks(),
                stats.incompleteTasks(),
                stats.completionRate(),
                stats.byProject(),
                stats.byPriority()
            );
        }
    }

    public record DeleteConfirmation(boolean success, String message) {

        public static DeleteConfirmation deleted() {
            return new DeleteConfirmation(true, "Task deleted successfully");
        }
    }

    public record ToolError(String error, String code) {}

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
