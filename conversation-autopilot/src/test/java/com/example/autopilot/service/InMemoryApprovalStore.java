package com.example.autopilot.service;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalStatus;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryApprovalStore implements ApprovalStore {

    private final Map<String, ApprovalRequest> requests = new LinkedHashMap<>();

    @Override
    public synchronized void save(ApprovalRequest request) {
        requests.put(request.getToken(), request.toBuilder().build());
    }

    @Override
    public synchronized Optional<ApprovalRequest> findByToken(String token) {
        return Optional.ofNullable(requests.get(token)).map(request -> request.toBuilder().build());
    }

    @Override
    public synchronized Optional<ApprovalRequest> findPendingByConversation(String conversationId) {
        return requests.values().stream()
                .filter(request -> request.getConversationId().equals(conversationId))
                .filter(request -> request.getStatus() == ApprovalStatus.PENDING)
                .max(Comparator.comparing(ApprovalRequest::getRequestedAt))
                .map(request -> request.toBuilder().build());
    }

    @Override
    public synchronized List<ApprovalRequest> findByStatus(ApprovalStatus status) {
        return requests.values().stream()
                .filter(request -> request.getStatus() == status)
                .map(request -> request.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized List<ApprovalRequest> findPendingRequestedBefore(Instant cutoff) {
        return requests.values().stream()
                .filter(request -> request.getStatus() == ApprovalStatus.PENDING)
                .filter(request -> request.getRequestedAt().isBefore(cutoff))
                .map(request -> request.toBuilder().build())
                .toList();
    }

    public synchronized int size() {
        return requests.size();
    }
}
