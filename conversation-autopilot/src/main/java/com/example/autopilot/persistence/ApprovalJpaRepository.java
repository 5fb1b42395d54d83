package com.example.autopilot.persistence;

import com.example.autopilot.domain.ApprovalStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApprovalJpaRepository extends JpaRepository<ApprovalEntity, String> {

    Optional<ApprovalEntity> findFirstByConversationIdAndStatusOrderByRequestedAtDesc(
            String conversationId, ApprovalStatus status);

    List<ApprovalEntity> findByStatusOrderByRequestedAtAsc(ApprovalStatus status);

    List<ApprovalEntity> findByStatusAndRequestedAtBeforeOrderByRequestedAtAsc(ApprovalStatus status, Instant cutoff);
}
