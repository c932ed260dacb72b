package tech.taskpilot.mcp;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of tools this server exposes. Adding a tool means adding a
 * constant here, a schema under {@code tools/}, and a case in
 * {@link TaskToolHandlers#handle}, which the compiler checks for exhaustiveness.
 */
public enum TaskTool {

    TASK_CREATE("task_create",
        "Create a new task with specified details. Returns the created task with generated ID."),
    TASK_LIST("task_list",
        "List tasks with optional filters. Returns an array of tasks sorted by priority (descending) and creation date."),
    TASK_GET("task_get",
        "Get a specific task by ID. Returns the complete task details."),
    TASK_UPDATE("task_update",
        "Update an existing task. Only provided fields will be updated. Returns the updated task."),
    TASK_COMPLETE("task_complete",
        "Mark a task as complete. Sets completed=true and records completion timestamp. Returns the updated task."),
    TASK_DELETE("task_delete",
        "Permanently delete a task. This action cannot be undone. Returns success confirmation."),
    TASK_SEARCH("task_search",
        "Search tasks by keywords in title or notes. Returns matching tasks sorted by priority and creation date."),
    TASK_STATS("task_stats",
        "Get task statistics including total, completed, incomplete counts, completion rate, and breakdowns by project and priority."),
    TASK_SCHEDULE("task_schedule",
        "Schedule a task to Google Calendar. Creates a calendar event linked to the task with specified start time and duration. Requires Google Calendar OAuth scope.");

    private final String toolName;
    private final String description;

    TaskTool(String toolName, String description) {
        this.toolName = toolName;
        this.description = description;
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    /**
     * Classpath location of the input schema.
     */
    public String schemaResource() {
        return "tools/" + toolName + ".json";
    }

    public static Optional<TaskTool> fromName(String name) {
        return Arrays.stream(values()).filter(t -> t.toolName.equals(name)).findFirst();
    }
}
