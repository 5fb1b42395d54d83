package com.example.autopilot.service;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalResolution;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.service.exception.ApprovalConflictException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Registry of approval requests keyed by correlation token. A conversation has at most one pending
 * request; every request reaches exactly one terminal state, persisted before anyone waiting on
 * the token is notified.
 */
@Slf4j
@Service
public class ApprovalBroker {

    private final ApprovalStore approvalStore;
    private final Clock clock;
    private final Object registryLock = new Object();
    private final Map<String, CompletableFuture<ApprovalResolution>> waiters = new HashMap<>();

    public ApprovalBroker(ApprovalStore approvalStore, Clock clock) {
        this.approvalStore = approvalStore;
        this.clock = clock;
    }

    public ApprovalRequest request(String conversationId, String displayName, Decision decision) {
        synchronized (registryLock) {
            approvalStore.findPendingByConversation(conversationId).ifPresent(existing -> {
                throw new ApprovalConflictException(conversationId, existing.getToken());
            });
            ApprovalRequest request = ApprovalRequest.builder()
                    .token(UUID.randomUUID().toString())
                    .conversationId(conversationId)
                    .displayName(displayName)
                    .decision(decision)
                    .status(ApprovalStatus.PENDING)
                    .requestedAt(clock.instant())
                    .build();
            approvalStore.save(request);
            waiters.put(request.getToken(), new CompletableFuture<>());
            log.info("Approval {} requested for conversation {} ({})",
                    request.getToken(), conversationId, decision.getIntentLabel());
            return request;
        }
    }

    /**
     * Future completed by the terminal transition of {@code token}. After a restart this rebuilds
     * the subscription from the persisted request; a request that already reached a terminal state
     * yields an already completed future.
     */
    public Optional<CompletableFuture<ApprovalResolution>> await(String token) {
        synchronized (registryLock) {
            CompletableFuture<ApprovalResolution> existing = waiters.get(token);
            if (existing != null) {
                return Optional.of(existing);
            }
            Optional<ApprovalRequest> request = approvalStore.findByToken(token);
            if (request.isEmpty()) {
                return Optional.empty();
            }
            if (request.get().getStatus().isTerminal()) {
                return Optional.of(CompletableFuture.completedFuture(ApprovalResolution.of(request.get())));
            }
            CompletableFuture<ApprovalResolution> future = new CompletableFuture<>();
            waiters.put(token, future);
            return Optional.of(future);
        }
    }

    public Optional<CompletableFuture<ApprovalResolution>> resubscribe(String token) {
        Optional<CompletableFuture<ApprovalResolution>> future = await(token);
        if (future.isPresent()) {
            log.info("Resubscribed to approval {}", token);
        } else {
            log.warn("Cannot resubscribe to unknown approval {}", token);
        }
        return future;
    }

    public ResolutionResult resolve(String token, ApprovalStatus outcome, String replyOverride) {
        if (outcome != ApprovalStatus.APPROVED && outcome != ApprovalStatus.REJECTED) {
            throw new IllegalArgumentException("Approval can only be resolved as APPROVED or REJECTED");
        }
        return transition(token, outcome, replyOverride, null);
    }

    public ResolutionResult expire(String token) {
        return transition(token, ApprovalStatus.EXPIRED, null, "No answer before the approval timeout");
    }

    /**
     * Withdraws the conversation's pending request, for teardown. Whoever awaited it is cancelled
     * instead of completed, so no reply follows.
     */
    public Optional<String> discard(String conversationId) {
        CompletableFuture<ApprovalResolution> cancelled;
        ApprovalRequest request;
        synchronized (registryLock) {
            Optional<ApprovalRequest> pending = approvalStore.findPendingByConversation(conversationId);
            if (pending.isEmpty()) {
                return Optional.empty();
            }
            request = pending.get();
            request.setStatus(ApprovalStatus.REJECTED);
            request.setResolvedAt(clock.instant());
            request.setResolutionNote("Conversation closed");
            approvalStore.save(request);
            cancelled = waiters.remove(request.getToken());
        }
        if (cancelled != null) {
            cancelled.cancel(false);
        }
        log.info("Discarded approval {} of conversation {}", request.getToken(), conversationId);
        return Optional.of(request.getToken());
    }

    public Optional<ApprovalRequest> find(String token) {
        return approvalStore.findByToken(token);
    }

    public Optional<ApprovalRequest> findPending(String conversationId) {
        return approvalStore.findPendingByConversation(conversationId);
    }

    public List<ApprovalRequest> listPending() {
        return approvalStore.findByStatus(ApprovalStatus.PENDING);
    }

    public List<ApprovalRequest> findOverdue(Instant cutoff) {
        return approvalStore.findPendingRequestedBefore(cutoff);
    }

    private ResolutionResult transition(String token, ApprovalStatus outcome, String replyOverride, String note) {
        CompletableFuture<ApprovalResolution> waiter;
        ApprovalRequest request;
        synchronized (registryLock) {
            Optional<ApprovalRequest> found = approvalStore.findByToken(token);
            if (found.isEmpty()) {
                log.warn("Ignoring {} for unknown approval {}", outcome, token);
                return ResolutionResult.UNKNOWN_TOKEN;
            }
            request = found.get();
            if (request.getStatus().isTerminal()) {
                log.info("Ignoring {} for approval {} already {}", outcome, token, request.getStatus());
                return ResolutionResult.ALREADY_TERMINAL;
            }
            request.setStatus(outcome);
            request.setResolvedAt(clock.instant());
            request.setReplyOverride(StringUtils.hasText(replyOverride) ? replyOverride.trim() : null);
            request.setResolutionNote(note);
            approvalStore.save(request);
            waiter = waiters.remove(token);
        }
        log.info("Approval {} of conversation {} resolved {}", token, request.getConversationId(), outcome);
        if (waiter != null) {
            waiter.complete(ApprovalResolution.of(request));
        }
        return ResolutionResult.APPLIED;
    }
}
