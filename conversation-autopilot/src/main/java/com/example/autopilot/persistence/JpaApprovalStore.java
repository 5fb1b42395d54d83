package com.example.autopilot.persistence;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.service.ApprovalStore;
import com.example.autopilot.service.exception.ConversationStoreException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JpaApprovalStore implements ApprovalStore {

    private final ApprovalJpaRepository approvalJpaRepository;
    private final ConversationEntityMapper mapper;

    @Override
    public void save(ApprovalRequest request) {
        guarded("save", () -> approvalJpaRepository.save(mapper.toEntity(request)));
    }

    @Override
    public Optional<ApprovalRequest> findByToken(String token) {
        return guarded("lookup", () -> approvalJpaRepository.findById(token).map(mapper::toApproval));
    }

    @Override
    public Optional<ApprovalRequest> findPendingByConversation(String conversationId) {
        return guarded("lookup", () -> approvalJpaRepository
                .findFirstByConversationIdAndStatusOrderByRequestedAtDesc(conversationId, ApprovalStatus.PENDING)
                .map(mapper::toApproval));
    }

    @Override
    public List<ApprovalRequest> findByStatus(ApprovalStatus status) {
        return guarded("scan", () -> approvalJpaRepository.findByStatusOrderByRequestedAtAsc(status).stream()
                .map(mapper::toApproval)
                .toList());
    }

    @Override
    public List<ApprovalRequest> findPendingRequestedBefore(Instant cutoff) {
        return guarded("scan", () -> approvalJpaRepository
                .findByStatusAndRequestedAtBeforeOrderByRequestedAtAsc(ApprovalStatus.PENDING, cutoff).stream()
                .map(mapper::toApproval)
                .toList());
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new ConversationStoreException("Approval store " + operation + " failed", ex);
        }
    }
}
