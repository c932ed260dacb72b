package tech.taskpilot.task.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.taskpilot.platform.principal.entity.UserEntity;
import tech.taskpilot.task.Task;
import tech.taskpilot.task.entity.TaskEntity;
import tech.taskpilot.task.mapper.TaskMapper;

/**
 * Write-side repository for Task entities. Updates and deletes match on owner
 * as well as id.
 */
@ApplicationScoped
@Transactional
public class TaskWriteRepository implements PanacheRepositoryBase<TaskEntity, Long> {

    public void persistTask(Task task) {
        TaskEntity entity = TaskMapper.toEntity(task);
        entity.user = getEntityManager().getReference(UserEntity.class, task.userId);
        persist(entity);
    }

    public boolean updateTask(Task task) {
        TaskEntity entity = find("id = :id and userId = :userId",
                Parameters.with("id", task.id).and("userId", task.userId))
            .firstResult();
        if (entity == null) {
            return false;
        }
        TaskMapper.updateEntity(entity, task);
        // Surface constraint and connection failures to the caller, not at commit
        getEntityManager().flush();
        return true;
    }

    public boolean deleteTask(long taskId, String userId) {
        return delete("id = :id and userId = :userId", Parameters.with("id", taskId).and("userId", userId)) > 0;
    }
}
