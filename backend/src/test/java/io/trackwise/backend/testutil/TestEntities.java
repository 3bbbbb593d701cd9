package io.trackwise.backend.testutil;

import io.trackwise.backend.dependency.DependencyType;
import io.trackwise.backend.dependency.TaskDependency;
import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskPriority;
import io.trackwise.backend.task.TaskStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Builds entities with ids and timestamps set, as if loaded from the database. */
public final class TestEntities {

  private static final Instant BASE_TIME = Instant.parse("2026-01-01T00:00:00Z");
  private static int sequence;

  private TestEntities() {}

  public static Task task(String title, UUID projectId, UUID parentId, TaskStatus status) {
    return task(UUID.randomUUID(), title, projectId, parentId, status);
  }

  public static Task task(
      UUID id, String title, UUID projectId, UUID parentId, TaskStatus status) {
    int n = ++sequence;
    var task = new Task("TRK-" + n, projectId, parentId, title, "TASK", TaskPriority.MEDIUM, false);
    set(task, "id", id);
    set(task, "createdAt", BASE_TIME.plusSeconds(n));
    if (status != null) {
      task.changeStatus(status);
    }
    return task;
  }

  public static Task withEffort(Task task, String estimated, String logged) {
    task.recordEffort(
        estimated != null ? new BigDecimal(estimated) : null,
        logged != null ? new BigDecimal(logged) : null);
    return task;
  }

  public static TaskDependency dependency(UUID dependent, UUID blocking, DependencyType type) {
    var dependency = new TaskDependency(dependent, blocking, type);
    set(dependency, "id", UUID.randomUUID());
    return dependency;
  }

  public static <T> T withId(T entity, UUID id) {
    set(entity, "id", id);
    return entity;
  }

  private static void set(Object target, String fieldName, Object value) {
    try {
      var field = target.getClass().getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(target, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot set " + fieldName, e);
    }
  }
}
