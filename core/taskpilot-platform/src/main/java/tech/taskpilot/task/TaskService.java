package tech.taskpilot.task;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.calendar.CalendarClient;
import tech.taskpilot.platform.calendar.CalendarCredentials;
import tech.taskpilot.platform.calendar.CalendarEvent;
import tech.taskpilot.platform.calendar.CalendarEventRequest;
import tech.taskpilot.platform.calendar.CalendarException;
import tech.taskpilot.platform.common.Result;
import tech.taskpilot.platform.common.errors.UseCaseError;
import tech.taskpilot.platform.shared.TsidGenerator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-user task operations.
 *
 * <p>Every method takes the acting user id and only reads or writes that
 * user's rows. A task owned by someone else is reported exactly like a missing
 * one.
 */
@ApplicationScoped
public class TaskService {

    private static final Logger LOG = Logger.getLogger(TaskService.class);

    static final String NO_PROJECT = "None";

    @Inject
    TaskRepository taskRepository;

    @Inject
    CalendarClient calendarClient;

    @Transactional
    public Task create(String userId, CreateTaskCommand command) {
        Instant now = Instant.now();

        Task task = new Task();
        task.id = TsidGenerator.generateLong();
        task.userId = userId;
        task.title = command.title();
        task.project = command.project();
        task.priority = command.priority() != null ? command.priority() : Task.DEFAULT_PRIORITY;
        task.energy = command.energy() != null ? command.energy() : Energy.MEDIUM;
        task.timeEstimate = command.timeEstimate() != null ? command.timeEstimate() : Task.DEFAULT_TIME_ESTIMATE;
        task.notes = command.notes();
        task.dueDate = command.dueDate();
        task.createdAt = now;
        task.updatedAt = now;

        taskRepository.persist(task);
        LOG.debugf("User %s created task %d", userId, task.id);
        return task;
    }

    public List<Task> list(String userId, TaskFilter filter) {
        return taskRepository.list(userId, filter);
    }

    public Result<Task> get(String userId, long taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId)
            .<Result<Task>>map(Result::success)
            .orElseGet(() -> Result.failure(UseCaseError.taskNotFound(taskId)));
    }

    @Transactional
    public Result<Task> update(String userId, UpdateTaskCommand command) {
        var existing = taskRepository.findByIdAndUserId(command.taskId(), userId);
        if (existing.isEmpty()) {
            return Result.failure(UseCaseError.taskNotFound(command.taskId()));
        }

        Task task = existing.get();
        Instant now = Instant.now();
        if (command.title() != null) {
            task.title = command.title();
        }
        if (command.project() != null) {
            task.project = command.project();
        }
        if (command.priority() != null) {
            task.priority = command.priority();
        }
        if (command.energy() != null) {
            task.energy = command.energy();
        }
        if (command.timeEstimate() != null) {
            task.timeEstimate = command.timeEstimate();
        }
        if (command.notes() != null) {
            task.notes = command.notes();
        }
        if (command.dueDate() != null) {
            task.dueDate = command.dueDate();
        }
        if (command.completed() != null && command.completed() != task.completed) {
            task.completed = command.completed();
            task.completedAt = task.completed ? now : null;
        }
        task.updatedAt = now;

        if (!taskRepository.update(task)) {
            return Result.failure(UseCaseError.taskNotFound(command.taskId()));
        }
        return Result.success(task);
    }

    @Transactional
    public Result<Task> complete(String userId, long taskId) {
        var existing = taskRepository.findByIdAndUserId(taskId, userId);
        if (existing.isEmpty()) {
            return Result.failure(UseCaseError.taskNotFound(taskId));
        }

        Task task = existing.get();
        Instant now = Instant.now();
        task.completed = true;
        task.completedAt = now;
        task.updatedAt = now;
        if (!taskRepository.update(task)) {
            return Result.failure(UseCaseError.taskNotFound(taskId));
        }
        return Result.success(task);
    }

    @Transactional
    public Result<Long> delete(String userId, long taskId) {
        if (!taskRepository.delete(taskId, userId)) {
            return Result.failure(UseCaseError.taskNotFound(taskId));
        }
        LOG.debugf("User %s deleted task %d", userId, taskId);
        return Result.success(taskId);
    }

    public List<Task> search(String userId, String query, int limit) {
        return taskRepository.search(userId, query, limit);
    }

    /**
     * Totals cover completed and incomplete tasks. The per-project and
     * per-priority breakdowns count incomplete tasks only.
     *
     * @param project optional project filter, applied to totals and breakdowns
     */
    public TaskStats stats(String userId, String project) {
        long total = taskRepository.count(userId, project, null);
        long completed = taskRepository.count(userId, project, Boolean.TRUE);
        long incomplete = total - completed;

        Map<String, Long> byProject = new TreeMap<>();
        taskRepository.countByProject(userId, project, false)
            .forEach((name, count) -> byProject.merge(name == null ? NO_PROJECT : name, count, Long::sum));

        Map<String, Long> byPriority = new TreeMap<>();
        taskRepository.countByPriority(userId, project, false)
            .forEach((priority, count) -> byPriority.put(String.valueOf(priority), count));

        return new TaskStats(total, completed, incomplete, completionRate(completed, total), byProject, byPriority);
    }

    static double completionRate(long completed, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(completed * 100L)
            .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Create a calendar event for the task and record the linkage.
     *
     * <p>Nothing is written if the calendar call fails. If the task write fails
     * after the event was created, or the task is gone by then, the event is
     * deleted again.
     */
    @Transactional
    public Result<Task> schedule(String userId, ScheduleTaskCommand command, CalendarCredentials credentials) {
        var existing = taskRepository.findByIdAndUserId(command.taskId(), userId);
        if (existing.isEmpty()) {
            return Result.failure(UseCaseError.taskNotFound(command.taskId()));
        }
        Task task = existing.get();

        String description = task.notes != null && !task.notes.isBlank()
            ? task.notes
            : "Task from Task Manager MCP\nPriority: " + task.priority;
        CalendarEventRequest request = new CalendarEventRequest(task.title, description,
            command.startTime(), Duration.ofMinutes(command.durationMinutes()));

        CalendarEvent event;
        try {
            event = calendarClient.createEvent(credentials, request);
        } catch (CalendarException e) {
            LOG.warnf(e, "Scheduling task %d for user %s failed", task.id, userId);
            return Result.failure(new UseCaseError.ExternalServiceError(
                "CALENDAR_ERROR", "Failed to create calendar event: " + e.getMessage(), Map.of("task_id", task.id)));
        }

        task.calendarEventId = event.id();
        task.calendarEventUrl = event.htmlLink();
        task.scheduledStart = command.startTime();
        task.scheduledDuration = command.durationMinutes();
        task.updatedAt = Instant.now();
        boolean updated;
        try {
            updated = taskRepository.update(task);
        } catch (RuntimeException e) {
            removeOrphanedEvent(credentials, event.id());
            throw e;
        }
        if (!updated) {
            // Deleted while the calendar call was in flight
            removeOrphanedEvent(credentials, event.id());
            return Result.failure(UseCaseError.taskNotFound(task.id));
        }

        LOG.infof("Scheduled task %d for user %s as event %s", task.id, userId, event.id());
        return Result.success(task);
    }

    private void removeOrphanedEvent(CalendarCredentials credentials, String eventId) {
        try {
            calendarClient.deleteEvent(credentials, eventId);
        } catch (CalendarException e) {
            LOG.errorf(e, "Could not remove calendar event %s after failed task update", eventId);
        }
    }
}
