package tech.taskpilot.task;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.taskpilot.platform.calendar.CalendarClient;
import tech.taskpilot.platform.calendar.CalendarCredentials;
import tech.taskpilot.platform.calendar.CalendarEvent;
import tech.taskpilot.platform.calendar.CalendarEventRequest;
import tech.taskpilot.platform.calendar.CalendarException;
import tech.taskpilot.platform.common.Result;
import tech.taskpilot.platform.common.errors.UseCaseError;
import tech.taskpilot.testing.InMemoryTaskRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskService.
 *
 * CRITICAL: every operation is scoped to the acting user. A task owned by
 * someone else must look exactly like a missing one.
 */
@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    private static final String ALICE = "google-sub-alice";
    private static final String BOB = "google-sub-bob";
    private static final Instant T0 = Instant.parse("2025-01-01T09:00:00Z");
    private static final CalendarCredentials CREDENTIALS = new CalendarCredentials("session-1", "access", "refresh");

    @Mock
    private CalendarClient calendarClient;

    private InMemoryTaskRepository repository;
    private TaskService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTaskRepository();
        service = new TaskService();
        service.taskRepository = repository;
        service.calendarClient = calendarClient;
    }

    // ========================================
    // CREATE / GET
    // ========================================

    @Test
    @DisplayName("create should apply defaults for omitted fields")
    void create_shouldApplyDefaults() {
        // Act
        Task task = service.create(ALICE, new CreateTaskCommand("Write report", null, null, null, null, null, null));

        // Assert
        assertThat(task.priority).isEqualTo(3);
        assertThat(task.energy).isEqualTo(Energy.MEDIUM);
        assertThat(task.timeEstimate).isEqualTo("1hr");
        assertThat(task.completed).isFalse();
        assertThat(task.completedAt).isNull();
        assertThat(task.createdAt).isEqualTo(task.updatedAt);
        assertThat(service.get(ALICE, task.id)).isInstanceOf(Result.Success.class);
    }

    @Test
    @DisplayName("create should keep the due date instant")
    void create_shouldKeepDueDate() {
        Instant due = OffsetDateTime.parse("2025-12-30T14:00:00-08:00").toInstant();

        Task task = service.create(ALICE, new CreateTaskCommand("Ship", "Work", 5, Energy.DEEP, "2hr", "notes", due));

        assertThat(task.dueDate).isEqualTo(Instant.parse("2025-12-30T22:00:00Z"));
    }

    // ========================================
    // USER ISOLATION
    // ========================================

    @Test
    @DisplayName("another user's task should be reported as not found by every operation")
    void operations_shouldReturnNotFound_whenTaskBelongsToAnotherUser() {
        // Arrange
        Task alices = persist(ALICE, "Alice's secret task", 3, null, false, T0);

        // Act
        Result<Task> get = service.get(BOB, alices.id);
        Result<Task> update = service.update(BOB, new UpdateTaskCommand(alices.id, "Hijacked",
            null, null, null, null, null, null, null));
        Result<Task> complete = service.complete(BOB, alices.id);
        Result<Long> delete = service.delete(BOB, alices.id);

        // Assert
        assertNotFound(get);
        assertNotFound(update);
        assertNotFound(complete);
        assertNotFound(delete);
        Task unchanged = ((Result.Success<Task>) service.get(ALICE, alices.id)).value();
        assertThat(unchanged.title).isEqualTo("Alice's secret task");
        assertThat(unchanged.completed).isFalse();
    }

    @Test
    @DisplayName("list, search and stats should never include another user's tasks")
    void queries_shouldOnlySeeOwnTasks() {
        persist(ALICE, "Alice report", 3, "Work", false, T0);
        persist(BOB, "Bob report", 3, "Work", false, T0);

        assertThat(service.list(ALICE, TaskFilter.defaults())).extracting(t -> t.userId).containsOnly(ALICE);
        assertThat(service.search(ALICE, "report", 100)).hasSize(1);
        assertThat(service.stats(ALICE, null).totalTasks()).isEqualTo(1);
    }

    // ========================================
    // LIST / SEARCH
    // ========================================

    @Test
    @DisplayName("list should order by priority descending, then oldest first, and hide completed tasks by default")
    void list_shouldOrderByPriorityThenCreation() {
        // Arrange
        persist(ALICE, "low", 1, null, false, T0);
        persist(ALICE, "high-newer", 5, null, false, T0.plusSeconds(60));
        persist(ALICE, "high-older", 5, null, false, T0);
        persist(ALICE, "done", 4, null, true, T0);

        // Act
        List<Task> open = service.list(ALICE, TaskFilter.defaults());
        List<Task> all = service.list(ALICE, new TaskFilter(null, null, true, 100, 0));

        // Assert
        assertThat(open).extracting(t -> t.title).containsExactly("high-older", "high-newer", "low");
        assertThat(all).extracting(t -> t.title).containsExactly("high-older", "high-newer", "done", "low");
    }

    @Test
    @DisplayName("list should apply project, priority and paging filters")
    void list_shouldApplyFilters() {
        persist(ALICE, "a", 3, "Work", false, T0);
        persist(ALICE, "b", 3, "Work", false, T0.plusSeconds(1));
        persist(ALICE, "c", 2, "Work", false, T0);
        persist(ALICE, "d", 3, "Home", false, T0);

        assertThat(service.list(ALICE, new TaskFilter("Work", 3, false, 100, 0)))
            .extracting(t -> t.title).containsExactly("a", "b");
        assertThat(service.list(ALICE, new TaskFilter("Work", null, false, 1, 1)))
            .extracting(t -> t.title).containsExactly("b");
    }

    @Test
    @DisplayName("search should match title or notes case-insensitively")
    void search_shouldMatchTitleOrNotes() {
        Task byTitle = persist(ALICE, "Quarterly REPORT", 3, null, false, T0);
        Task byNotes = persist(ALICE, "Email", 2, null, false, T0);
        byNotes.notes = "attach the report";
        repository.update(byNotes);
        persist(ALICE, "Groceries", 3, null, false, T0);

        assertThat(service.search(ALICE, "report", 100)).extracting(t -> t.id)
            .containsExactly(byTitle.id, byNotes.id);
    }

    // ========================================
    // UPDATE / COMPLETE / DELETE
    // ========================================

    @Test
    @DisplayName("update should change only the provided fields")
    void update_shouldLeaveNullFieldsUnchanged() {
        // Arrange
        Task task = persist(ALICE, "Draft", 2, "Work", false, T0);

        // Act
        Result<Task> result = service.update(ALICE, new UpdateTaskCommand(task.id, null, null, 5,
            null, null, "new notes", null, null));

        // Assert
        Task updated = ((Result.Success<Task>) result).value();
        assertThat(updated.title).isEqualTo("Draft");
        assertThat(updated.project).isEqualTo("Work");
        assertThat(updated.priority).isEqualTo(5);
        assertThat(updated.notes).isEqualTo("new notes");
        assertThat(updated.updatedAt).isAfter(T0);
    }

    @Test
    @DisplayName("update should set and clear the completion time with the completed flag")
    void update_shouldMaintainCompletedAt() {
        Task task = persist(ALICE, "Draft", 2, null, false, T0);

        Task done = ((Result.Success<Task>) service.update(ALICE, new UpdateTaskCommand(task.id,
            null, null, null, null, null, null, null, true))).value();
        assertThat(done.completedAt).isNotNull();

        Task reopened = ((Result.Success<Task>) service.update(ALICE, new UpdateTaskCommand(task.id,
            null, null, null, null, null, null, null, false))).value();
        assertThat(reopened.completed).isFalse();
        assertThat(reopened.completedAt).isNull();
    }

    @Test
    @DisplayName("complete should mark the task done and record when")
    void complete_shouldSetCompletedAt() {
        Task task = persist(ALICE, "Draft", 2, null, false, T0);

        Task done = ((Result.Success<Task>) service.complete(ALICE, task.id)).value();

        assertThat(done.completed).isTrue();
        assertThat(done.completedAt).isNotNull();
    }

    @Test
    @DisplayName("delete should remove the task permanently")
    void delete_shouldRemoveTask() {
        Task task = persist(ALICE, "Draft", 2, null, false, T0);

        assertThat(service.delete(ALICE, task.id)).isEqualTo(Result.success(task.id));
        assertNotFound(service.get(ALICE, task.id));
        assertNotFound(service.delete(ALICE, task.id));
    }

    // ========================================
    // STATS
    // ========================================

    @Test
    @DisplayName("stats should round the completion rate and count incomplete tasks per project and priority")
    void stats_shouldComputeRateAndBreakdowns() {
        // Arrange
        persist(ALICE, "a", 5, "Work", false, T0);
        persist(ALICE, "b", 3, null, false, T0);
        persist(ALICE, "c", 3, "Work", true, T0);

        // Act
        TaskStats stats = service.stats(ALICE, null);

        // Assert
        assertThat(stats.totalTasks()).isEqualTo(3);
        assertThat(stats.completedTasks()).isEqualTo(1);
        assertThat(stats.incompleteTasks()).isEqualTo(2);
        assertThat(stats.completionRate()).isEqualTo(33.33);
        assertThat(stats.byProject()).containsEntry("Work", 1L).containsEntry("None", 1L);
        assertThat(stats.byPriority()).containsEntry("5", 1L).containsEntry("3", 1L);
        assertThat(stats.byProject().values().stream().mapToLong(Long::longValue).sum())
            .isEqualTo(stats.incompleteTasks());
        assertThat(stats.byPriority().values().stream().mapToLong(Long::longValue).sum())
            .isEqualTo(stats.incompleteTasks());
    }

    @Test
    @DisplayName("stats should report zero rate for a user without tasks")
    void stats_shouldReturnZero_whenNoTasks() {
        TaskStats stats = service.stats(ALICE, null);

        assertThat(stats.totalTasks()).isZero();
        assertThat(stats.completionRate()).isEqualTo(0.0);
        assertThat(stats.byProject()).isEmpty();
    }

    @Test
    @DisplayName("stats should restrict totals and breakdowns to the requested project")
    void stats_shouldFilterByProject() {
        persist(ALICE, "a", 5, "Work", false, T0);
        persist(ALICE, "b", 3, "Home", false, T0);
        persist(ALICE, "c", 3, "Work", true, T0);

        TaskStats stats = service.stats(ALICE, "Work");

        assertThat(stats.totalTasks()).isEqualTo(2);
        assertThat(stats.completionRate()).isEqualTo(50.0);
        assertThat(stats.byProject()).containsOnlyKeys("Work");
    }

    @Test
    @DisplayName("completionRate should round half up to two decimals")
    void completionRate_shouldRoundHalfUp() {
        assertThat(TaskService.completionRate(2, 3)).isEqualTo(66.67);
        assertThat(TaskService.completionRate(1, 8)).isEqualTo(12.5);
        assertThat(TaskService.completionRate(0, 0)).isEqualTo(0.0);
    }

    // ========================================
    // SCHEDULE
    // ========================================

    @Test
    @DisplayName("schedule should create an event and link it to the task")
    void schedule_shouldLinkEvent_whenCalendarSucceeds() throws Exception {
        // Arrange
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);
        Instant start = Instant.parse("2025-12-30T22:00:00Z");
        when(calendarClient.createEvent(eq(CREDENTIALS), any()))
            .thenReturn(new CalendarEvent("evt-1", "https://calendar.google.com/event?eid=evt-1"));

        // Act
        Result<Task> result = service.schedule(ALICE, new ScheduleTaskCommand(task.id, start, 90), CREDENTIALS);

        // Assert
        Task scheduled = ((Result.Success<Task>) result).value();
        assertThat(scheduled.calendarEventId).isEqualTo("evt-1");
        assertThat(scheduled.calendarEventUrl).contains("evt-1");
        assertThat(scheduled.scheduledStart).isEqualTo(start);
        assertThat(scheduled.scheduledDuration).isEqualTo(90);

        ArgumentCaptor<CalendarEventRequest> request = ArgumentCaptor.forClass(CalendarEventRequest.class);
        verify(calendarClient).createEvent(eq(CREDENTIALS), request.capture());
        assertThat(request.getValue().summary()).isEqualTo("Deep work");
        assertThat(request.getValue().description()).isEqualTo("Task from Task Manager MCP\nPriority: 4");
        assertThat(request.getValue().end()).isEqualTo(start.plus(Duration.ofMinutes(90)));
    }

    @Test
    @DisplayName("schedule should persist nothing when the calendar rejects the event")
    void schedule_shouldLeaveTaskUnchanged_whenCalendarFails() throws Exception {
        // Arrange
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);
        when(calendarClient.createEvent(any(), any())).thenThrow(new CalendarException("HTTP 403"));

        // Act
        Result<Task> result = service.schedule(ALICE, new ScheduleTaskCommand(task.id, T0, 60), CREDENTIALS);

        // Assert
        assertThat(result).isInstanceOf(Result.Failure.class);
        UseCaseError error = ((Result.Failure<Task>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.ExternalServiceError.class);
        assertThat(error.code()).isEqualTo("CALENDAR_ERROR");
        Task stored = ((Result.Success<Task>) service.get(ALICE, task.id)).value();
        assertThat(stored.calendarEventId).isNull();
        assertThat(stored.scheduledStart).isNull();
    }

    @Test
    @DisplayName("schedule should delete the created event when the task update fails")
    void schedule_shouldRemoveEvent_whenTaskUpdateFails() throws Exception {
        // Arrange
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);
        when(calendarClient.createEvent(any(), any())).thenReturn(new CalendarEvent("evt-1", "link"));
        repository.failNextUpdate();

        // Act & Assert
        assertThatThrownBy(() -> service.schedule(ALICE, new ScheduleTaskCommand(task.id, T0, 60), CREDENTIALS))
            .isInstanceOf(IllegalStateException.class);
        verify(calendarClient).deleteEvent(CREDENTIALS, "evt-1");
        assertThat(((Result.Success<Task>) service.get(ALICE, task.id)).value().calendarEventId).isNull();
    }

    @Test
    @DisplayName("schedule should delete the created event when the task disappears during the calendar call")
    void schedule_shouldRemoveEvent_whenTaskDeletedConcurrently() throws Exception {
        // Arrange
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);
        when(calendarClient.createEvent(any(), any())).thenAnswer(invocation -> {
            repository.delete(task.id, ALICE);
            return new CalendarEvent("evt-2", "link");
        });

        // Act
        Result<Task> result = service.schedule(ALICE, new ScheduleTaskCommand(task.id, T0, 60), CREDENTIALS);

        // Assert
        assertNotFound(result);
        verify(calendarClient).deleteEvent(CREDENTIALS, "evt-2");
        assertThat(repository.all()).isEmpty();
    }

    @Test
    @DisplayName("complete should report not found when the row no longer matches")
    void complete_shouldReturnNotFound_whenUpdateMatchesNoRow() {
        // Arrange
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);
        TaskRepository vanishing = mock(TaskRepository.class);
        when(vanishing.findByIdAndUserId(task.id, ALICE)).thenReturn(Optional.of(task));
        when(vanishing.update(any())).thenReturn(false);
        service.taskRepository = vanishing;

        // Act & Assert
        assertNotFound(service.complete(ALICE, task.id));
    }

    @Test
    @DisplayName("schedule should not call the calendar for another user's task")
    void schedule_shouldReturnNotFound_whenTaskNotOwned() {
        Task task = persist(ALICE, "Deep work", 4, null, false, T0);

        Result<Task> result = service.schedule(BOB, new ScheduleTaskCommand(task.id, T0, 60), CREDENTIALS);

        assertNotFound(result);
        verifyNoInteractions(calendarClient);
    }

    // ========================================
    // HELPERS
    // ========================================

    private Task persist(String userId, String title, int priority, String project, boolean completed, Instant createdAt) {
        Task task = new Task();
        task.id = createdAt.toEpochMilli() + repository.all().size();
        task.userId = userId;
        task.title = title;
        task.priority = priority;
        task.project = project;
        task.completed = completed;
        task.completedAt = completed ? createdAt : null;
        task.createdAt = createdAt;
        task.updatedAt = createdAt;
        repository.persist(task);
        return task;
    }

    private static void assertNotFound(Result<?> result) {
        assertThat(result).isInstanceOf(Result.Failure.class);
        UseCaseError error = ((Result.Failure<?>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(error.code()).isEqualTo("NOT_FOUND");
        assertThat(error.message()).isEqualTo("Task not found");
    }
}
