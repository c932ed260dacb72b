package tech.taskpilot.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.taskpilot.platform.authentication.AuthenticatedUser;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.calendar.CalendarCredentials;
import tech.taskpilot.platform.common.Result;
import tech.taskpilot.platform.common.errors.AuthenticationException;
import tech.taskpilot.platform.common.errors.UseCaseError;
import tech.taskpilot.task.CreateTaskCommand;
import tech.taskpilot.task.Energy;
import tech.taskpilot.task.ScheduleTaskCommand;
import tech.taskpilot.task.Task;
import tech.taskpilot.task.TaskFilter;
import tech.taskpilot.task.TaskService;
import tech.taskpilot.task.UpdateTaskCommand;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Maps validated tool parameters onto {@link TaskService} calls for the
 * authenticated caller. Parameters have already passed the tool's schema.
 */
@ApplicationScoped
public class TaskToolHandlers {

    @Inject
    TaskService taskService;

    @Inject
    SessionService sessionService;

    public Result<Object> handle(TaskTool tool, AuthenticatedUser caller, JsonNode params) {
        String userId = caller.userId();
        try {
            return switch (tool) {
                case TASK_CREATE -> Result.success(TaskPayloads.TaskView.from(
                    taskService.create(userId, createCommand(params))));
                case TASK_LIST -> Result.success(TaskPayloads.TaskView.fromAll(
                    taskService.list(userId, listFilter(params))));
                case TASK_GET -> view(taskService.get(userId, taskId(params)));
                case TASK_UPDATE -> view(taskService.update(userId, updateCommand(params)));
                case TASK_COMPLETE -> view(taskService.complete(userId, taskId(params)));
                case TASK_DELETE -> delete(userId, taskId(params));
                case TASK_SEARCH -> Result.success(TaskPayloads.TaskView.fromAll(
                    taskService.search(userId, params.path("query").asText(),
                        optInt(params, "limit", TaskFilter.DEFAULT_LIMIT))));
                case TASK_STATS -> Result.success(TaskPayloads.StatsView.from(
                    taskService.stats(userId, optText(params, "project"))));
                case TASK_SCHEDULE -> schedule(caller, params);
            };
        } catch (InvalidParameterException e) {
            return Result.failure(new UseCaseError.ValidationError(
                "VALIDATION_ERROR", e.getMessage(), Map.of("field", e.field)));
        }
    }

    private Result<Object> delete(String userId, long taskId) {
        return taskService.delete(userId, taskId).<Object>map(id -> TaskPayloads.DeleteConfirmation.deleted());
    }

    private Result<Object> schedule(AuthenticatedUser caller, JsonNode params) {
        ScheduleTaskCommand command = new ScheduleTaskCommand(
            taskId(params),
            requiredInstant(params, "start_time"),
            optInt(params, "duration_minutes", ScheduleTaskCommand.DEFAULT_DURATION_MINUTES));

        // Decrypted only for the duration of this call
        String accessToken = sessionService.getDecryptedAccessToken(caller.sessionId())
            .orElseThrow(() -> new AuthenticationException("Invalid or expired session"));
        String refreshToken = sessionService.getDecryptedRefreshToken(caller.sessionId())
            .orElseThrow(() -> new AuthenticationException("Invalid or expired session"));

        return view(taskService.schedule(caller.userId(), command,
            new CalendarCredentials(caller.sessionId(), accessToken, refreshToken)));
    }

    private static Result<Object> view(Result<Task> result) {
        return result.<Object>map(TaskPayloads.TaskView::from);
    }

    // ========================================================================
    // Parameter extraction
    // ========================================================================

    private static CreateTaskCommand createCommand(JsonNode params) {
        return new CreateTaskCommand(
            params.path("title").asText(),
            optText(params, "project"),
            optInteger(params, "priority"),
            optEnergy(params),
            optText(params, "time_estimate"),
            optText(params, "notes"),
            optInstant(params, "due_date"));
    }

    private static UpdateTaskCommand updateCommand(JsonNode params) {
        JsonNode completed = params.get("completed");
        return new UpdateTaskCommand(
            taskId(params),
            optText(params, "title"),
            optText(params, "project"),
            optInteger(params, "priority"),
            optEnergy(params),
            optText(params, "time_estimate"),
            optText(params, "notes"),
            optInstant(params, "due_date"),
            completed == null || completed.isNull() ? null : completed.asBoolean());
    }

    private static TaskFilter listFilter(JsonNode params) {
        return new TaskFilter(
            optText(params, "project"),
            optInteger(params, "priority"),
            params.path("show_completed").asBoolean(false),
            optInt(params, "limit", TaskFilter.DEFAULT_LIMIT),
            optInt(params, "offset", 0));
    }

    private static long taskId(JsonNode params) {
        JsonNode node = params.get("task_id");
        if (node == null || !node.isNumber() || !node.canConvertToLong()) {
            throw new InvalidParameterException("task_id", "task_id must be a 64-bit integer");
        }
        return node.asLong();
    }

    private static String optText(JsonNode params, String field) {
        JsonNode node = params.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Integer optInteger(JsonNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber() || !node.canConvertToInt()) {
            throw new InvalidParameterException(field, field + " is out of range");
        }
        return node.asInt();
    }

    private static int optInt(JsonNode params, String field, int defaultValue) {
        Integer value = optInteger(params, field);
        return value != null ? value : defaultValue;
    }

    private static Energy optEnergy(JsonNode params) {
        String value = optText(params, "energy");
        if (value == null) {
            return null;
        }
        return Energy.fromWireValue(value)
            .orElseThrow(() -> new InvalidParameterException("energy", "Invalid energy level: " + value));
    }

    private static Instant optInstant(JsonNode params, String field) {
        String value = optText(params, field);
        return value == null ? null : parseInstant(field, value);
    }

    private static Instant requiredInstant(JsonNode params, String field) {
        String value = optText(params, field);
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(field, field + " is required");
        }
        return parseInstant(field, value);
    }

    private static Instant parseInstant(String field, String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(field,
                "Invalid " + field + " '" + value + "': expected ISO 8601 date-time with offset");
        }
    }

    private static final class InvalidParameterException extends RuntimeException {

        private final String field;

        InvalidParameterException(String field, String message) {
            super(message);
            this.field = field;
        }
    }
}
