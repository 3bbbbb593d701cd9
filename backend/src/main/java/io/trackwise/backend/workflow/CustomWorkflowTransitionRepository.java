package io.trackwise.backend.workflow;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomWorkflowTransitionRepository
    extends JpaRepository<CustomWorkflowTransition, UUID> {

  List<CustomWorkflowTransition> findByProjectIdOrderByPositionAsc(UUID projectId);
}
