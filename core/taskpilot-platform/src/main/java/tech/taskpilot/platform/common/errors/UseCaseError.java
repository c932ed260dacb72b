package tech.taskpilot.platform.common.errors;

import java.util.Map;

/**
 * Business failure returned inside a {@code Result}. Tool callers receive
 * these as {@code {"error", "code"}} payloads.
 */
public sealed interface UseCaseError {

    String code();

    String message();

    /** Extra context for logs; never sent to callers. */
    Map<String, Object> details();

    /** Bad input: out-of-range value, unparseable timestamp. */
    record ValidationError(String code, String message, Map<String, Object> details) implements UseCaseError {}

    /** Missing, or owned by someone else. Callers cannot tell which. */
    record NotFoundError(String code, String message, Map<String, Object> details) implements UseCaseError {}

    /** The calendar rejected the call and nothing was stored. */
    record ExternalServiceError(String code, String message, Map<String, Object> details) implements UseCaseError {}

    static UseCaseError taskNotFound(long taskId) {
        return new NotFoundError("NOT_FOUND", "Task not found", Map.of("task_id", taskId));
    }
}
