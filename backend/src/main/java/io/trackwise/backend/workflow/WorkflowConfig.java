package io.trackwise.backend.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkflowConfig {

  private static final Logger log = LoggerFactory.getLogger(WorkflowConfig.class);

  @Bean
  public WorkflowDefinitionRegistry workflowDefinitionRegistry() {
    var registry = WorkflowDefinitionRegistry.standard();
    registry
        .all()
        .forEach(
            definition ->
                log.info(
                    "Registered workflow {} with {} transitions",
                    definition.type(),
                    definition.transitions().size()));
    return registry;
  }
}
