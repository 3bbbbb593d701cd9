package io.trackwise.backend.task;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findOneById(@Param("id") UUID id);

  @Query("SELECT t FROM Task t WHERE t.projectId = :projectId ORDER BY t.createdAt ASC")
  List<Task> findByProjectId(@Param("projectId") UUID projectId);

  /** Tasks that belong to no project. Together they form one hierarchy scope. */
  @Query("SELECT t FROM Task t WHERE t.projectId IS NULL ORDER BY t.createdAt ASC")
  List<Task> findWithoutProject();

  /** Direct children of a task, oldest first. */
  @Query("SELECT t FROM Task t WHERE t.parentId = :parentId ORDER BY t.createdAt ASC")
  List<Task> findChildren(@Param("parentId") UUID parentId);

  @Query("SELECT t FROM Task t WHERE t.id IN :ids")
  List<Task> findAllByIdIn(@Param("ids") Collection<UUID> ids);
}
