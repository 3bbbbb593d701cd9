package io.trackwise.backend.project;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  @Query("SELECT p FROM Project p WHERE p.id = :id")
  Optional<Project> findOneById(@Param("id") UUID id);
}
