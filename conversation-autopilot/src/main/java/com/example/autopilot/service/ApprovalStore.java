package com.example.autopilot.service;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable registry of approval requests.
 */
public interface ApprovalStore {

    void save(ApprovalRequest request);

    Optional<ApprovalRequest> findByToken(String token);

    Optional<ApprovalRequest> findPendingByConversation(String conversationId);

    List<ApprovalRequest> findByStatus(ApprovalStatus status);

    List<ApprovalRequest> findPendingRequestedBefore(Instant cutoff);
}
