package io.trackwise.backend.dependency;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskDependencyRepository extends JpaRepository<TaskDependency, UUID> {

  @Query("SELECT d FROM TaskDependency d WHERE d.id = :id")
  Optional<TaskDependency> findOneById(@Param("id") UUID id);

  boolean existsByDependentTaskIdAndBlockingTaskIdAndType(
      UUID dependentTaskId, UUID blockingTaskId, DependencyType type);

  /** Edges where the task is on either end, oldest first. */
  @Query(
      """
      SELECT d FROM TaskDependency d
      WHERE d.dependentTaskId = :taskId OR d.blockingTaskId = :taskId
      ORDER BY d.createdAt ASC
      """)
  List<TaskDependency> findTouching(@Param("taskId") UUID taskId);

  /**
   * Outgoing "depends on" edges of a whole BFS frontier in one round trip. Used to load the
   * subgraph reachable from a blocking task.
   */
  @Query(
      """
      SELECT d FROM TaskDependency d
      WHERE d.dependentTaskId IN :dependentIds AND d.type IN :types
      """)
  List<TaskDependency> findByDependentIdsAndTypes(
      @Param("dependentIds") Collection<UUID> dependentIds,
      @Param("types") Collection<DependencyType> types);

  /** Edges with at least one end inside the project. */
  @Query(
      """
      SELECT d FROM TaskDependency d
      WHERE d.dependentTaskId IN (SELECT t.id FROM Task t WHERE t.projectId = :projectId)
         OR d.blockingTaskId IN (SELECT t.id FROM Task t WHERE t.projectId = :projectId)
      ORDER BY d.createdAt ASC
      """)
  List<TaskDependency> findTouchingProject(@Param("projectId") UUID projectId);

  @Query("SELECT d FROM TaskDependency d ORDER BY d.createdAt ASC")
  List<TaskDependency> findAllOrdered();
}
