package tech.taskpilot.task.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import tech.taskpilot.task.Task;
import tech.taskpilot.task.TaskFilter;
import tech.taskpilot.task.TaskRepository;
import tech.taskpilot.task.entity.TaskEntity;
import tech.taskpilot.task.mapper.TaskMapper;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-side repository for Task entities.
 * Uses EntityManager for queries and delegates writes to TaskWriteRepository.
 */
@ApplicationScoped
public class TaskReadRepository implements TaskRepository {

    @Inject
    EntityManager em;

    @Inject
    TaskWriteRepository writeRepo;

    @Override
    public Optional<Task> findByIdAndUserId(long taskId, String userId) {
        return em.createQuery("FROM TaskEntity WHERE id = :id AND userId = :userId", TaskEntity.class)
            .setParameter("id", taskId)
            .setParameter("userId", userId)
            .getResultStream()
            .findFirst()
            .map(TaskMapper::toDomain);
    }

    @Override
    public List<Task> list(String userId, TaskFilter filter) {
        StringBuilder jpql = new StringBuilder("FROM TaskEntity WHERE userId = :userId");
        if (filter.project() != null) {
            jpql.append(" AND project = :project");
        }
        if (filter.priority() != null) {
            jpql.append(" AND priority = :priority");
        }
        if (!filter.showCompleted()) {
            jpql.append(" AND completed = false");
        }
        jpql.append(" ORDER BY priority DESC, createdAt ASC");

        TypedQuery<TaskEntity> query = em.createQuery(jpql.toString(), TaskEntity.class)
            .setParameter("userId", userId);
        if (filter.project() != null) {
            query.setParameter("project", filter.project());
        }
        if (filter.priority() != null) {
            query.setParameter("priority", filter.priority());
        }
        return query
            .setFirstResult(filter.offset())
            .setMaxResults(filter.limit())
            .getResultList()
            .stream()
            .map(TaskMapper::toDomain)
            .toList();
    }

    @Override
    public List<Task> search(String userId, String query, int limit) {
        String pattern = "%" + escapeLike(query.toLowerCase()) + "%";
        return em.createQuery(
                "FROM TaskEntity WHERE userId = :userId " +
                "AND (LOWER(title) LIKE :pattern ESCAPE '\\' OR LOWER(notes) LIKE :pattern ESCAPE '\\') " +
                "ORDER BY priority DESC, createdAt ASC", TaskEntity.class)
            .setParameter("userId", userId)
            .setParameter("pattern", pattern)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(TaskMapper::toDomain)
            .toList();
    }

    @Override
    public long count(String userId, String project, Boolean completed) {
        StringBuilder jpql = new StringBuilder("SELECT COUNT(t) FROM TaskEntity t WHERE t.userId = :userId");
        if (project != null) {
            jpql.append(" AND t.project = :project");
        }
        if (completed != null) {
            jpql.append(" AND t.completed = :completed");
        }
        TypedQuery<Long> query = em.createQuery(jpql.toString(), Long.class).setParameter("userId", userId);
        if (project != null) {
            query.setParameter("project", project);
        }
        if (completed != null) {
            query.setParameter("completed", completed);
        }
        return query.getSingleResult();
    }

    @Override
    public Map<String, Long> countByProject(String userId, String project, boolean completed) {
        Map<String, Long> result = new HashMap<>();
        groupCount("t.project", userId, project, completed)
            .forEach(row -> result.put((String) row[0], (Long) row[1]));
        return result;
    }

    @Override
    public Map<Integer, Long> countByPriority(String userId, String project, boolean completed) {
        Map<Integer, Long> result = new HashMap<>();
        groupCount("t.priority", userId, project, completed)
            .forEach(row -> result.put((Integer) row[0], (Long) row[1]));
        return result;
    }

    private List<Object[]> groupCount(String field, String userId, String project, boolean completed) {
        String jpql = "SELECT " + field + ", COUNT(t) FROM TaskEntity t " +
            "WHERE t.userId = :userId AND t.completed = :completed" +
            (project != null ? " AND t.project = :project" : "") +
            " GROUP BY " + field;
        TypedQuery<Object[]> query = em.createQuery(jpql, Object[].class)
            .setParameter("userId", userId)
            .setParameter("completed", completed);
        if (project != null) {
            query.setParameter("project", project);
        }
        return query.getResultList();
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public void persist(Task task) {
        writeRepo.persistTask(task);
    }

    @Override
    public boolean update(Task task) {
        return writeRepo.updateTask(task);
    }

    @Override
    public boolean delete(long taskId, String userId) {
        return writeRepo.deleteTask(taskId, userId);
    }
}
