package tech.taskpilot.task;

/**
 * List filter. Null project or priority means "any".
 */
public record TaskFilter(String project, Integer priority, boolean showCompleted, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 100;

    public static TaskFilter defaults() {
        return new TaskFilter(null, null, false, DEFAULT_LIMIT, 0);
    }
}
