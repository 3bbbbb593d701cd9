package io.trackwise.backend.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.trackwise.backend.TestcontainersConfiguration;
import io.trackwise.backend.audit.AuditEvent;
import io.trackwise.backend.audit.AuditService;
import io.trackwise.backend.project.Project;
import io.trackwise.backend.project.ProjectRepository;
import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskRepository;
import io.trackwise.backend.task.TaskStatus;
import io.trackwise.backend.workflow.WorkflowType;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TaskHierarchyIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private TaskRepository taskRepository;
  @Autowired private AuditService auditService;

  private UUID projectId;

  @BeforeAll
  void createProject() {
    projectId =
        projectRepository
            .save(new Project(uniqueKey("HIER"), "Hierarchy project", WorkflowType.BASIC))
            .getId();
  }

  @Test
  void shouldBuildTreeWithCompletion() throws Exception {
    var root = createTask(null, "Root", TaskStatus.IN_PROGRESS);
    var done = createTask(root.getId(), "Done", TaskStatus.COMPLETED);
    createTask(root.getId(), "Open", TaskStatus.DRAFT);
    createTask(done.getId(), "Grandchild", TaskStatus.COMPLETED);

    mockMvc
        .perform(get("/api/tasks/{id}/tree", root.getId()).with(jwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.depth").value(0))
        .andExpect(jsonPath("$.hasChildren").value(true))
        .andExpect(jsonPath("$.completionPercentage").value(50))
        .andExpect(jsonPath("$.children", hasSize(2)))
        .andExpect(jsonPath("$.children[0].task.title").value("Done"))
        .andExpect(jsonPath("$.children[0].children", hasSize(1)));

    mockMvc
        .perform(get("/api/tasks/{id}/tree", root.getId()).param("maxDepth", "1").with(jwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.children[0].children", hasSize(0)))
        .andExpect(jsonPath("$.children[0].hasChildren").value(true));
  }

  @Test
  void shouldRejectTreeDepthOutOfRange() throws Exception {
    var root = createTask(null, "Shallow", TaskStatus.DRAFT);

    mockMvc
        .perform(get("/api/tasks/{id}/tree", root.getId()).param("maxDepth", "0").with(jwt()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_MAX_DEPTH"));
  }

  @Test
  void shouldMoveTaskAndRecordAudit() throws Exception {
    var memberId = UUID.randomUUID();
    var parent = createTask(null, "New parent", TaskStatus.DRAFT);
    var task = createTask(null, "Orphan", TaskStatus.DRAFT);

    mockMvc
        .perform(
            put("/api/tasks/{id}/parent", task.getId())
                .with(jwt().jwt(j -> j.subject(memberId.toString())))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"newParentId": "%s"}
                    """.formatted(parent.getId())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.newParentId").value(parent.getId().toString()))
        .andExpect(jsonPath("$.depth").value(1));

    assertThat(taskRepository.findById(task.getId()).orElseThrow().getParentId())
        .isEqualTo(parent.getId());
    assertThat(auditService.findForEntity("task", task.getId()))
        .extracting(AuditEvent::getEventType)
        .containsExactly("task.moved");
  }

  @Test
  void shouldRejectMoveUnderDescendant() throws Exception {
    var top = createTask(null, "Top", TaskStatus.DRAFT);
    var middle = createTask(top.getId(), "Middle", TaskStatus.DRAFT);
    var bottom = createTask(middle.getId(), "Bottom", TaskStatus.DRAFT);

    mockMvc
        .perform(
            put("/api/tasks/{id}/parent", top.getId())
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"newParentId": "%s"}
                    """.formatted(bottom.getId())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.rule").value("CIRCULAR_REFERENCE"));

    assertThat(taskRepository.findById(top.getId()).orElseThrow().getParentId()).isNull();
  }

  @Test
  void shouldRejectCrossProjectMove() throws Exception {
    var other =
        projectRepository.save(new Project(uniqueKey("OTH"), "Other", WorkflowType.BASIC));
    var foreignParent =
        taskRepository.save(
            new Task(uniqueKey("T"), other.getId(), null, "Foreign", null, null, false));
    var task = createTask(null, "Local", TaskStatus.DRAFT);

    mockMvc
        .perform(
            put("/api/tasks/{id}/parent", task.getId())
                .with(jwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"newParentId": "%s"}
                    """.formatted(foreignParent.getId())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.rule").value("CROSS_PROJECT"));
  }

  @Test
  void shouldReturn404ForUnknownTask() throws Exception {
    mockMvc
        .perform(get("/api/tasks/{id}/tree", UUID.randomUUID()).with(jwt()))
        .andExpect(status().isNotFound());
  }

  private Task createTask(UUID parentId, String title, TaskStatus status) {
    var task = new Task(uniqueKey("T"), projectId, parentId, title, null, null, false);
    task.changeStatus(status);
    return taskRepository.save(task);
  }

  private static String uniqueKey(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
