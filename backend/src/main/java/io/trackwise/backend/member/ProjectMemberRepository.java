package io.trackwise.backend.member;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

  Optional<ProjectMember> findByProjectIdAndMemberId(UUID projectId, UUID memberId);
}
