package tech.taskpilot.task;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Task entities.
 *
 * <p>Every method is scoped by owner. There is no way to load a task by id alone.
 */
public interface TaskRepository {

    // Read operations
    Optional<Task> findByIdAndUserId(long taskId, String userId);

    /**
     * Ordered by priority descending, then creation ascending.
     */
    List<Task> list(String userId, TaskFilter filter);

    /**
     * Case-insensitive substring match on title or notes.
     */
    List<Task> search(String userId, String query, int limit);

    /**
     * @param project   null for all projects
     * @param completed null for both states
     */
    long count(String userId, String project, Boolean completed);

    /**
     * Keys are project names; tasks without a project use a null key.
     */
    Map<String, Long> countByProject(String userId, String project, boolean completed);

    Map<Integer, Long> countByPriority(String userId, String project, boolean completed);

    // Write operations
    void persist(Task task);

    /**
     * Write the task's current state and flush it.
     *
     * @return false if no row matched the task's id and owner
     */
    boolean update(Task task);
    boolean delete(long taskId, String userId);
}
