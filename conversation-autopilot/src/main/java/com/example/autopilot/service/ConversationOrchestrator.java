package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalResolution;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.domain.Batch;
import com.example.autopilot.domain.BatchCloseReason;
import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.ConversationStatus;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.InboundMessage;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import com.example.autopilot.domain.OpenBatchMarker;
import com.example.autopilot.event.ConversationEventPublisher;
import com.example.autopilot.event.ConversationEventType;
import com.example.autopilot.service.exception.ApprovalConflictException;
import com.example.autopilot.service.exception.ConversationStoreException;
import com.example.autopilot.service.exception.ReplyDeliveryException;
import com.example.autopilot.service.exception.ServiceException;
import com.example.autopilot.service.exception.StateCorruptionException;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Drives every conversation through ingest, debounce, decision, approval and reply, and picks the
 * work back up after a restart.
 *
 * <p>The persisted {@link ConversationSnapshot} is read and written under the conversation lock;
 * each step changes only the fields it owns. Decisions and approval outcomes run on the
 * conversation's serial worker, so one conversation never has two of them in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationOrchestrator {

    private final ConversationStore conversationStore;
    private final DebounceScheduler debounceScheduler;
    private final DecisionRouter decisionRouter;
    private final ApprovalBroker approvalBroker;
    private final List<ApprovalChannel> approvalChannels;
    private final ReplyDispatcher replyDispatcher;
    private final ConversationLockService lockService;
    private final ConversationWorkers workers;
    private final TransientRetry transientRetry;
    private final ListingProfileService listingProfileService;
    private final ConversationEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final AutopilotProperties properties;

    private final Map<String, ScheduledFuture<?>> expiryTimers = new ConcurrentHashMap<>();

    @PostConstruct
    public void registerBatchHandler() {
        debounceScheduler.setBatchHandler(this::onBatchClosed);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        resume();
    }

    public IngestResult ingest(InboundMessage inbound) {
        if (inbound == null
                || !StringUtils.hasText(inbound.getConversationId())
                || !StringUtils.hasText(inbound.getText())) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Conversation id and text are required", "invalid_message");
        }
        String conversationId = inbound.getConversationId().trim();
        if (conversationId.length() > InboundMessage.MAX_KEY_LENGTH
                || (inbound.getMessageId() != null && inbound.getMessageId().trim().length() > InboundMessage.MAX_KEY_LENGTH)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST,
                    "Conversation id and message id are limited to %d characters".formatted(InboundMessage.MAX_KEY_LENGTH),
                    "invalid_message");
        }
        String text = inbound.getText().trim();
        Message message = Message.builder()
                .conversationId(conversationId)
                .role(MessageRole.INBOUND)
                .text(text)
                .dedupKey(StringUtils.hasText(inbound.getMessageId())
                        ? inbound.getMessageId().trim()
                        : DedupKeys.contentKey(conversationId, MessageRole.INBOUND, text))
                .timestamp(inbound.getSentAt() != null ? inbound.getSentAt() : clock.instant())
                .build();

        return lockService.withLock(conversationId, () -> {
            ConversationSnapshot snapshot = loadOrQuarantine(conversationId);
            boolean stored = transientRetry.call("message append", () -> conversationStore.append(conversationId, message));
            if (!stored) {
                log.debug("Duplicate message {} for conversation {}", message.getDedupKey(), conversationId);
                return IngestResult.DUPLICATE;
            }
            eventPublisher.publish(conversationId, ConversationEventType.MESSAGE_INGESTED,
                    Map.of("dedupKey", message.getDedupKey()));

            if (snapshot.isQuarantined()) {
                log.warn("Stored message for quarantined conversation {} without batching it", conversationId);
                return IngestResult.QUARANTINED;
            }
            if (snapshot.isArchived()) {
                log.info("Reopening archived conversation {} on new message", conversationId);
                snapshot.setStatus(ConversationStatus.IDLE);
                snapshot.setUpdatedAt(clock.instant());
                transientRetry.run("state save", () -> conversationStore.saveState(conversationId, snapshot));
            }
            if (!debounceScheduler.isTracking(conversationId) && hasWorkInFlight(snapshot)) {
                log.info("Conversation {} has work from before the restart that is not resumed yet, resuming it first",
                        conversationId);
                resumeConversation(conversationId);
            }

            BatchingOutcome outcome = debounceScheduler.onMessage(conversationId, message);
            mutate(conversationId, state -> {
                applyIdentity(state, inbound);
                if (outcome == BatchingOutcome.OPENED || outcome == BatchingOutcome.EXTENDED) {
                    debounceScheduler.openBatch(conversationId).ifPresent(batch -> {
                        state.setOpenBatch(OpenBatchMarker.of(batch));
                        state.setStatus(ConversationStatus.COLLECTING);
                    });
                }
            });
            return IngestResult.of(outcome);
        });
    }

    public Optional<ConversationSnapshot> snapshot(String conversationId) {
        return conversationStore.loadState(conversationId);
    }

    public List<Message> history(String conversationId, int limit) {
        return conversationStore.history(conversationId, limit);
    }

    /**
     * Archives the conversation: its timer and open batch are dropped, a pending approval is
     * withdrawn and any resolution arriving afterwards is ignored.
     */
    public ConversationSnapshot teardown(String conversationId) {
        ConversationSnapshot archived = lockService.withLock(conversationId, () -> {
            ConversationSnapshot snapshot = loadLenient(conversationId)
                    .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
            stopActivity(conversationId);
            snapshot.setStatus(ConversationStatus.ARCHIVED);
            snapshot.setOpenBatch(null);
            snapshot.setPendingApprovalToken(null);
            snapshot.setUpdatedAt(clock.instant());
            transientRetry.run("state save", () -> conversationStore.saveState(conversationId, snapshot));
            return snapshot;
        });
        log.info("Archived conversation {}", conversationId);
        eventPublisher.publish(conversationId, ConversationEventType.CONVERSATION_ARCHIVED, Map.of());
        return archived;
    }

    /**
     * Tears the conversation down and forgets everything stored about it.
     */
    public void resetMemory(String conversationId) {
        lockService.withLock(conversationId, () -> {
            stopActivity(conversationId);
            transientRetry.run("memory reset", () -> conversationStore.reset(conversationId));
        });
        log.info("Reset memory of conversation {}", conversationId);
        eventPublisher.publish(conversationId, ConversationEventType.CONVERSATION_ARCHIVED, Map.of("reset", true));
    }

    /**
     * Clears a quarantine after manual inspection. Messages received meanwhile stay in history
     * only; the next inbound message starts a new batch.
     */
    public ConversationSnapshot releaseQuarantine(String conversationId) {
        return lockService.withLock(conversationId, () -> {
            ConversationSnapshot snapshot = loadLenient(conversationId)
                    .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
            if (!snapshot.isQuarantined()) {
                throw new ServiceException(HttpStatus.CONFLICT, "Conversation is not quarantined", "not_quarantined");
            }
            stopActivity(conversationId);
            ConversationSnapshot released = ConversationSnapshot.fresh(conversationId, clock.instant()).toBuilder()
                    .displayName(snapshot.getDisplayName())
                    .threadUrl(snapshot.getThreadUrl())
                    .createdAt(snapshot.getCreatedAt() != null ? snapshot.getCreatedAt() : clock.instant())
                    .build();
            transientRetry.run("state save", () -> conversationStore.saveState(conversationId, released));
            log.info("Released conversation {} from quarantine", conversationId);
            return released;
        });
    }

    /**
     * Re-establishes in-flight work for every stored conversation: pending approvals are watched
     * again, unconsumed batches are decided immediately and inconsistent conversations are
     * quarantined. A failure on one conversation does not stop the others. Conversations already
     * picked up by an inbound message are left alone.
     */
    public void resume() {
        List<String> conversationIds;
        try {
            conversationIds = transientRetry.call("conversation scan", conversationStore::knownConversations);
        } catch (ConversationStoreException ex) {
            log.error("Unable to list conversations, recovery skipped", ex);
            return;
        }
        int resumed = 0;
        for (String conversationId : conversationIds) {
            try {
                if (lockService.withLock(conversationId, () -> resumeUntracked(conversationId))) {
                    resumed++;
                }
            } catch (RuntimeException ex) {
                log.error("Failed to resume conversation {}", conversationId, ex);
            }
        }
        log.info("Recovery finished: {} of {} conversations had work in flight", resumed, conversationIds.size());
    }

    private boolean resumeUntracked(String conversationId) {
        if (debounceScheduler.isTracking(conversationId)) {
            log.debug("Conversation {} is already active, nothing to resume", conversationId);
            return false;
        }
        return resumeConversation(conversationId);
    }

    boolean resumeConversation(String conversationId) {
        Optional<ConversationSnapshot> loaded;
        try {
            loaded = conversationStore.loadState(conversationId);
        } catch (StateCorruptionException ex) {
            quarantine(conversationId, ex.getMessage());
            return false;
        }
        if (loaded.isEmpty() || loaded.get().isArchived() || loaded.get().isQuarantined()) {
            return false;
        }
        ConversationSnapshot snapshot = loaded.get();

        String token = snapshot.getPendingApprovalToken();
        if (StringUtils.hasText(token)) {
            debounceScheduler.markBusy(conversationId);
            Optional<ApprovalRequest> request = approvalBroker.find(token);
            if (request.isEmpty()) {
                log.warn("Conversation {} references unknown approval {}, releasing it", conversationId, token);
                finishCycle(conversationId, null);
                return true;
            }
            log.info("Resuming approval {} of conversation {}", token, conversationId);
            watch(request.get(), true);
            return true;
        }

        OpenBatchMarker marker = snapshot.getOpenBatch();
        if (marker == null) {
            return false;
        }
        Optional<ApprovalRequest> pending = approvalBroker.findPending(conversationId);
        if (pending.isPresent()) {
            ApprovalRequest adopted = pending.get();
            log.info("Adopting approval {} issued for conversation {} before the restart", adopted.getToken(), conversationId);
            debounceScheduler.markBusy(conversationId);
            mutate(conversationId, state -> awaitApproval(state, adopted.getToken()));
            watch(adopted, true);
            return true;
        }

        Batch batch = rebuildBatch(conversationId, marker);
        if (batch.size() == 0) {
            log.warn("Open batch {} of conversation {} has no stored members, dropping it", marker.getBatchId(), conversationId);
            mutate(conversationId, state -> {
                state.setOpenBatch(null);
                state.setStatus(ConversationStatus.IDLE);
            });
            return false;
        }
        log.info("Closing batch {} of conversation {} left open before the restart", batch.getId(), conversationId);
        debounceScheduler.markBusy(conversationId);
        onBatchClosed(batch);
        return true;
    }

    void onBatchClosed(Batch batch) {
        String conversationId = batch.getConversationId();
        try {
            boolean active = mutate(conversationId, state -> {
                state.setOpenBatch(OpenBatchMarker.of(batch));
                state.setStatus(ConversationStatus.DECIDING);
            });
            if (!active) {
                log.info("Dropping batch {} of inactive conversation {}", batch.getId(), conversationId);
                return;
            }
        } catch (StateCorruptionException ex) {
            quarantine(conversationId, ex.getMessage());
            return;
        } catch (ConversationStoreException ex) {
            log.error("Could not persist closed batch {} of conversation {}, deciding anyway",
                    batch.getId(), conversationId, ex);
        }
        eventPublisher.publish(conversationId, ConversationEventType.BATCH_CLOSED, Map.of(
                "batchId", batch.getId(),
                "size", batch.size(),
                "reason", batch.getCloseReason() != null ? batch.getCloseReason().name() : "UNKNOWN"));
        workers.submit(conversationId, () -> decide(batch));
    }

    void decide(Batch batch) {
        String conversationId = batch.getConversationId();
        try {
            ConversationSnapshot snapshot = loadOrFresh(conversationId);
            if (!isCurrent(snapshot, batch.getId())) {
                log.info("Batch {} is no longer current for conversation {}, skipping", batch.getId(), conversationId);
                return;
            }
            Decision decision = decisionRouter.classify(batch, context(conversationId, snapshot));
            eventPublisher.publish(conversationId, ConversationEventType.DECISION_MADE, decisionPayload(decision));
            if (decision.isAuto()) {
                sendAutomatically(snapshot, decision);
            } else {
                requestApproval(conversationId, decision);
            }
        } catch (StateCorruptionException ex) {
            quarantine(conversationId, ex.getMessage());
        } catch (ConversationStoreException ex) {
            log.error("Storage unavailable while deciding batch {} of conversation {}, retrying in {}",
                    batch.getId(), conversationId, properties.getRetry().getPause(), ex);
            later(conversationId, () -> decide(batch));
        }
    }

    void onResolved(ApprovalResolution resolution) {
        String conversationId = resolution.conversationId();
        cancelExpiry(resolution.token());
        try {
            ConversationSnapshot snapshot = loadOrFresh(conversationId);
            if (snapshot.isArchived()
                    || snapshot.isQuarantined()
                    || !resolution.token().equals(snapshot.getPendingApprovalToken())) {
                log.info("Ignoring resolution of approval {} for conversation {} in state {}",
                        resolution.token(), conversationId, snapshot.getStatus());
                return;
            }
            eventPublisher.publish(conversationId, ConversationEventType.APPROVAL_RESOLVED,
                    Map.of("token", resolution.token(), "status", resolution.status().name()));

            String failure = null;
            if (resolution.approved() && StringUtils.hasText(resolution.replyText())) {
                try {
                    replyDispatcher.dispatch(conversationId, snapshot.getDisplayName(), resolution.decision(), resolution.replyText());
                } catch (ReplyDeliveryException ex) {
                    log.error("Approved reply for conversation {} could not be delivered", conversationId, ex);
                    failure = ex.getMessage();
                }
            } else if (resolution.approved()) {
                log.warn("Approval {} approved without any reply text, nothing sent", resolution.token());
            } else {
                log.info("Reply for approval {} suppressed ({})", resolution.token(), resolution.status());
            }
            finishCycle(conversationId, failure);
        } catch (StateCorruptionException ex) {
            quarantine(conversationId, ex.getMessage());
        } catch (ConversationStoreException ex) {
            log.error("Storage unavailable while applying approval {} of conversation {}, retrying in {}",
                    resolution.token(), conversationId, properties.getRetry().getPause(), ex);
            later(conversationId, () -> onResolved(resolution));
        }
    }

    private void sendAutomatically(ConversationSnapshot snapshot, Decision decision) {
        String conversationId = snapshot.getConversationId();
        String failure = null;
        try {
            replyDispatcher.dispatch(conversationId, snapshot.getDisplayName(), decision, decision.getProposedReply());
        } catch (ReplyDeliveryException ex) {
            log.error("Automatic reply for conversation {} could not be delivered", conversationId, ex);
            failure = ex.getMessage();
        }
        finishCycle(conversationId, failure);
    }

    private void requestApproval(String conversationId, Decision decision) {
        ApprovalRequest request = lockService.withLock(conversationId, () -> {
            ConversationSnapshot current = loadOrFresh(conversationId);
            if (!isCurrent(current, decision.getBatchId())) {
                log.info("Conversation {} moved on while batch {} was decided, no approval requested",
                        conversationId, decision.getBatchId());
                return null;
            }
            ApprovalRequest issued;
            try {
                issued = approvalBroker.request(conversationId, current.getDisplayName(), decision);
            } catch (ApprovalConflictException ex) {
                log.warn("Conversation {} already awaits approval {}, adopting it", conversationId, ex.getPendingToken());
                issued = approvalBroker.find(ex.getPendingToken()).orElseThrow(() -> ex);
            }
            String token = issued.getToken();
            mutate(conversationId, state -> awaitApproval(state, token));
            return issued;
        });
        if (request == null) {
            return;
        }
        eventPublisher.publish(conversationId, ConversationEventType.APPROVAL_REQUESTED, Map.of(
                "token", request.getToken(),
                "intent", String.valueOf(decision.getIntentLabel())));
        present(request);
        watch(request, false);
    }

    private void present(ApprovalRequest request) {
        for (ApprovalChannel channel : approvalChannels) {
            try {
                channel.present(request);
            } catch (RuntimeException ex) {
                log.warn("Approval channel {} could not present approval {}, it stays pending",
                        channel.getClass().getSimpleName(), request.getToken(), ex);
            }
        }
    }

    private void watch(ApprovalRequest request, boolean resumed) {
        String token = request.getToken();
        if (request.getStatus() == ApprovalStatus.PENDING) {
            scheduleExpiry(token, request.getRequestedAt());
        }
        Optional<CompletableFuture<ApprovalResolution>> outcome = resumed
                ? approvalBroker.resubscribe(token)
                : approvalBroker.await(token);
        outcome.ifPresent(future -> future.thenAccept(resolution ->
                workers.submit(resolution.conversationId(), () -> onResolved(resolution))));
    }

    private void scheduleExpiry(String token, Instant requestedAt) {
        Instant deadline = (requestedAt != null ? requestedAt : clock.instant())
                .plus(properties.getApproval().getTimeout());
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> expire(token), deadline);
        ScheduledFuture<?> previous = expiryTimers.put(token, timer);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void expire(String token) {
        expiryTimers.remove(token);
        try {
            if (approvalBroker.expire(token) == ResolutionResult.APPLIED) {
                log.info("Approval {} expired without an answer", token);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to expire approval {}", token, ex);
        }
    }

    private void cancelExpiry(String token) {
        ScheduledFuture<?> timer = expiryTimers.remove(token);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    /**
     * Ends the decision cycle: the snapshot goes back to idle (or stalled after a failed delivery)
     * and held messages, if any, open the next batch.
     */
    private void finishCycle(String conversationId, String failure) {
        lockService.withLock(conversationId, () -> {
            mutate(conversationId, state -> {
                state.setOpenBatch(null);
                state.setPendingApprovalToken(null);
                state.setStatus(failure != null ? ConversationStatus.STALLED : ConversationStatus.IDLE);
                state.setLastError(failure);
            });
            debounceScheduler.release(conversationId);
            debounceScheduler.openBatch(conversationId).ifPresent(batch -> mutate(conversationId, state -> {
                state.setOpenBatch(OpenBatchMarker.of(batch));
                state.setStatus(ConversationStatus.COLLECTING);
            }));
        });
    }

    private void quarantine(String conversationId, String reason) {
        log.error("Quarantining conversation {}: {}", conversationId, reason);
        debounceScheduler.cancel(conversationId);
        try {
            transientRetry.run("quarantine", () -> conversationStore.quarantine(conversationId, reason));
        } catch (ConversationStoreException ex) {
            log.error("Could not persist quarantine of conversation {}", conversationId, ex);
        }
        eventPublisher.publish(conversationId, ConversationEventType.CONVERSATION_QUARANTINED,
                Map.of("reason", String.valueOf(reason)));
    }

    private void stopActivity(String conversationId) {
        debounceScheduler.cancel(conversationId);
        approvalBroker.discard(conversationId).ifPresent(this::cancelExpiry);
    }

    private void later(String conversationId, Runnable task) {
        taskScheduler.schedule(() -> workers.submit(conversationId, task),
                clock.instant().plus(properties.getRetry().getPause()));
    }

    /**
     * Applies {@code change} to the stored snapshot of an active conversation.
     *
     * @return {@code false} if the conversation is archived or quarantined and nothing was written
     */
    private boolean mutate(String conversationId, Consumer<ConversationSnapshot> change) {
        return lockService.withLock(conversationId, () -> {
            ConversationSnapshot snapshot = loadOrFresh(conversationId);
            if (snapshot.isArchived() || snapshot.isQuarantined()) {
                return false;
            }
            change.accept(snapshot);
            snapshot.setUpdatedAt(clock.instant());
            transientRetry.run("state save", () -> conversationStore.saveState(conversationId, snapshot));
            return true;
        });
    }

    private void awaitApproval(ConversationSnapshot state, String token) {
        state.setOpenBatch(null);
        state.setPendingApprovalToken(token);
        state.setStatus(ConversationStatus.AWAITING_APPROVAL);
    }

    private boolean hasWorkInFlight(ConversationSnapshot snapshot) {
        return StringUtils.hasText(snapshot.getPendingApprovalToken()) || snapshot.getOpenBatch() != null;
    }

    private ConversationSnapshot loadOrFresh(String conversationId) {
        return transientRetry.call("state load", () -> conversationStore.loadState(conversationId))
                .orElseGet(() -> ConversationSnapshot.fresh(conversationId, clock.instant()));
    }

    private ConversationSnapshot loadOrQuarantine(String conversationId) {
        try {
            return loadOrFresh(conversationId);
        } catch (StateCorruptionException ex) {
            quarantine(conversationId, ex.getMessage());
            return ConversationSnapshot.fresh(conversationId, clock.instant()).toBuilder()
                    .status(ConversationStatus.QUARANTINED)
                    .quarantineReason(ex.getMessage())
                    .build();
        }
    }

    private Optional<ConversationSnapshot> loadLenient(String conversationId) {
        try {
            return transientRetry.call("state load", () -> conversationStore.loadState(conversationId));
        } catch (StateCorruptionException ex) {
            log.warn("Overriding inconsistent state of conversation {}: {}", conversationId, ex.getMessage());
            return Optional.of(ConversationSnapshot.fresh(conversationId, clock.instant()).toBuilder()
                    .status(ConversationStatus.QUARANTINED)
                    .quarantineReason(ex.getMessage())
                    .build());
        }
    }

    private boolean isCurrent(ConversationSnapshot snapshot, String batchId) {
        return !snapshot.isArchived()
                && !snapshot.isQuarantined()
                && snapshot.getOpenBatch() != null
                && batchId.equals(snapshot.getOpenBatch().getBatchId());
    }

    private ConversationContext context(String conversationId, ConversationSnapshot snapshot) {
        int limit = properties.getHistory().getContextLimit();
        return ConversationContext.builder()
                .conversationId(conversationId)
                .displayName(snapshot.getDisplayName())
                .history(transientRetry.call("history load", () -> conversationStore.history(conversationId, limit)))
                .listing(listingProfileService.current())
                .localTime(listingProfileService.localTime())
                .build();
    }

    private Batch rebuildBatch(String conversationId, OpenBatchMarker marker) {
        Map<String, Message> byKey = transientRetry.call("history load", () -> conversationStore.history(conversationId))
                .stream()
                .collect(Collectors.toMap(Message::getDedupKey, Function.identity(), (first, second) -> first));
        List<Message> members = new ArrayList<>();
        for (String key : marker.getMessageKeys()) {
            Message message = byKey.get(key);
            if (message != null) {
                members.add(message);
            }
        }
        return Batch.builder()
                .id(marker.getBatchId())
                .conversationId(conversationId)
                .messages(members)
                .openedAt(marker.getOpenedAt())
                .lastExtendedAt(marker.getLastExtendedAt())
                .closed(true)
                .closedAt(clock.instant())
                .closeReason(BatchCloseReason.RECOVERED)
                .build();
    }

    private void applyIdentity(ConversationSnapshot state, InboundMessage inbound) {
        if (StringUtils.hasText(inbound.getDisplayName())) {
            state.setDisplayName(inbound.getDisplayName().trim());
        }
        if (StringUtils.hasText(inbound.getThreadUrl())) {
            state.setThreadUrl(inbound.getThreadUrl().trim());
        }
    }

    private Map<String, Object> decisionPayload(Decision decision) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchId", decision.getBatchId());
        payload.put("classification", decision.getClassification().name());
        payload.put("category", decision.getCategory().name());
        payload.put("intent", String.valueOf(decision.getIntentLabel()));
        return payload;
    }
}
