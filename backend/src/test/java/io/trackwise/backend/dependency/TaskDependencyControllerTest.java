package io.trackwise.backend.dependency;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.trackwise.backend.exception.CircularDependencyException;
import io.trackwise.backend.exception.ResourceNotFoundException;
import io.trackwise.backend.exception.ValidationException;
import io.trackwise.backend.security.SecurityConfig;
import io.trackwise.backend.task.TaskStatus;
import io.trackwise.backend.task.TaskSummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TaskDependencyController.class)
@Import(SecurityConfig.class)
class TaskDependencyControllerTest {

  private static final UUID A = UUID.randomUUID();
  private static final UUID B = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TaskDependencyService dependencyService;
  @MockitoBean private BulkDependencyService bulkDependencyService;
  @MockitoBean private JwtDecoder jwtDecoder;

  @Test
  void rejectsUnauthenticatedRequests() throws Exception {
    mockMvc
        .perform(
            post("/api/task-dependencies").contentType(MediaType.APPLICATION_JSON).content(body()))
        .andExpect(status().isUnauthorized());

    verifyNoInteractions(dependencyService);
  }

  @Test
  void createsDependencyWithBlocksAsDefaultType() throws Exception {
    var id = UUID.randomUUID();
    when(dependencyService.createDependency(A, B, DependencyType.BLOCKS))
        .thenReturn(
            new DependencyResponse(
                id,
                DependencyType.BLOCKS,
                new TaskSummary(A, "TRK-1", "Build", TaskStatus.DRAFT),
                new TaskSummary(B, "TRK-2", "Design", TaskStatus.IN_PROGRESS),
                Instant.parse("2026-01-01T00:00:00Z")));

    mockMvc
        .perform(
            post("/api/task-dependencies")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/task-dependencies/" + id))
        .andExpect(jsonPath("$.type").value("BLOCKS"))
        .andExpect(jsonPath("$.blockingTask.key").value("TRK-2"));
  }

  @Test
  void mapsCycleToConflictWithPath() throws Exception {
    when(dependencyService.createDependency(A, B, DependencyType.BLOCKS))
        .thenThrow(new CircularDependencyException(List.of(A, B, A)));

    mockMvc
        .perform(
            post("/api/task-dependencies")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Circular dependency"))
        .andExpect(jsonPath("$.path[0]").value(A.toString()))
        .andExpect(jsonPath("$.path[2]").value(A.toString()));
  }

  @Test
  void mapsSelfDependencyToBadRequest() throws Exception {
    when(dependencyService.createDependency(A, B, DependencyType.BLOCKS))
        .thenThrow(
            new ValidationException(
                "SELF_DEPENDENCY", "Invalid dependency", "A task cannot depend on itself"));

    mockMvc
        .perform(
            post("/api/task-dependencies")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SELF_DEPENDENCY"));
  }

  @Test
  void mapsSerializationFailureToConflict() throws Exception {
    when(dependencyService.createDependency(A, B, DependencyType.BLOCKS))
        .thenThrow(new CannotAcquireLockException("could not serialize access"));

    mockMvc
        .perform(
            post("/api/task-dependencies")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Concurrent modification"));
  }

  @Test
  void rejectsMissingTaskIds() throws Exception {
    mockMvc
        .perform(
            post("/api/task-dependencies")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"dependentTaskId\": \"%s\"}".formatted(A)))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(dependencyService);
  }

  @Test
  void returnsNotFoundForUnknownTask() throws Exception {
    when(dependencyService.getBlockingInfo(any()))
        .thenThrow(new ResourceNotFoundException("Task", A));

    mockMvc
        .perform(get("/api/tasks/{id}/blocking-info", A).with(jwt()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.resourceType").value("Task"));
  }

  @Test
  void rejectsUnknownDependencyType() throws Exception {
    mockMvc
        .perform(get("/api/task-dependencies").param("type", "DUPLICATES").with(jwt()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void rejectsEmptyBulkRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/task-dependencies/bulk")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\": \"CREATE\", \"items\": []}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(bulkDependencyService);
  }

  @Test
  void rejectsNullBulkItem() throws Exception {
    mockMvc
        .perform(
            post("/api/task-dependencies/bulk")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operation\": \"CREATE\", \"items\": [null]}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(bulkDependencyService);
  }

  @Test
  void appliesBulkDelete() throws Exception {
    var id = UUID.randomUUID();
    var items = List.of(new BulkDependencyService.Item(id, null, null, null));
    when(bulkDependencyService.apply(BulkDependencyService.Operation.DELETE, items))
        .thenReturn(
            new BulkDependencyService.Result(
                BulkDependencyService.Operation.DELETE,
                List.of(),
                List.of(id),
                List.of(),
                List.of()));

    mockMvc
        .perform(
            post("/api/task-dependencies/bulk")
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"operation\": \"DELETE\", \"items\": [{\"dependencyId\": \"%s\"}]}"
                        .formatted(id)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted[0]").value(id.toString()))
        .andExpect(jsonPath("$.created").isEmpty());
  }

  private static String body() {
    return "{\"dependentTaskId\": \"%s\", \"blockingTaskId\": \"%s\"}".formatted(A, B);
  }
}
