package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.Batch;
import com.example.autopilot.domain.BatchCloseReason;
import com.example.autopilot.domain.Message;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Coalesces bursts of inbound messages per conversation into batches.
 *
 * <p>Each conversation is idle, collecting an open batch, or busy while a closed batch is being
 * decided or awaits approval. Messages that arrive while busy are held until {@link #release}.
 * Every armed timer carries the generation it was armed for; a timer whose generation is no longer
 * current does nothing when it fires. A conversation that is idle with nothing held has no slot.
 */
@Slf4j
@Component
public class DebounceScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final AutopilotProperties properties;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    private volatile BatchHandler batchHandler = batch ->
            log.warn("Batch {} closed before a handler was registered", batch.getId());

    public DebounceScheduler(TaskScheduler taskScheduler, Clock clock, AutopilotProperties properties) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.properties = properties;
    }

    public void setBatchHandler(BatchHandler batchHandler) {
        this.batchHandler = batchHandler;
    }

    public BatchingOutcome onMessage(String conversationId, Message message) {
        BatchingOutcome outcome = null;
        Batch closed = null;
        while (outcome == null) {
            Slot slot = slots.computeIfAbsent(conversationId, Slot::new);
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                Instant now = clock.instant();
                if (slot.busy) {
                    slot.held.add(message);
                    log.debug("Holding message {} for busy conversation {}", message.getDedupKey(), conversationId);
                    return BatchingOutcome.HELD;
                }
                if (slot.open == null) {
                    slot.open = new OpenBatch(UUID.randomUUID().toString(), now);
                    outcome = BatchingOutcome.OPENED;
                } else {
                    outcome = BatchingOutcome.EXTENDED;
                }
                slot.open.messages.add(message);
                slot.open.lastExtendedAt = now;

                if (slot.open.messages.size() >= maxBatchSize()) {
                    closed = close(slot, BatchCloseReason.MAX_SIZE, now);
                    outcome = BatchingOutcome.CLOSED_AT_CAPACITY;
                } else {
                    arm(slot, now);
                }
            }
        }
        if (closed != null) {
            dispatch(closed);
        }
        return outcome;
    }

    /**
     * Marks the conversation busy without an open batch, used when recovery finds a decision or an
     * approval already in progress.
     */
    public void markBusy(String conversationId) {
        while (true) {
            Slot slot = slots.computeIfAbsent(conversationId, Slot::new);
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                disarm(slot);
                slot.open = null;
                slot.busy = true;
                return;
            }
        }
    }

    /**
     * Ends the busy period. Held messages open a fresh batch when replay is enabled, otherwise they
     * only stay in history.
     */
    public void release(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return;
        }
        List<Message> replay;
        boolean replaying;
        synchronized (slot) {
            if (slot.retired) {
                return;
            }
            slot.busy = false;
            replay = new ArrayList<>(slot.held);
            slot.held.clear();
            replaying = !replay.isEmpty() && properties.getDebounce().isReplayHeldMessages();
            if (!replaying && slot.open == null) {
                retire(slot);
            }
        }
        if (replay.isEmpty()) {
            return;
        }
        if (!replaying) {
            log.debug("Dropping {} held messages of conversation {} from batching", replay.size(), conversationId);
            return;
        }
        log.debug("Replaying {} held messages of conversation {}", replay.size(), conversationId);
        for (Message message : replay) {
            onMessage(conversationId, message);
        }
    }

    /**
     * Forgets the conversation: the timer is cancelled and the open batch and held messages are
     * discarded without a decision.
     */
    public void cancel(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            disarm(slot);
            slot.open = null;
            slot.held.clear();
            slot.busy = false;
            retire(slot);
        }
        log.debug("Cancelled batching for conversation {}", conversationId);
    }

    /**
     * Whether this instance currently holds batching state for the conversation, either an open
     * batch or a busy period.
     */
    public boolean isTracking(String conversationId) {
        return slots.containsKey(conversationId);
    }

    public Optional<Batch> openBatch(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return slot.open == null ? Optional.empty() : Optional.of(slot.open.toBatch(conversationId, false, null, null));
        }
    }

    public boolean isBusy(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.busy;
        }
    }

    public int heldCount(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return 0;
        }
        synchronized (slot) {
            return slot.held.size();
        }
    }

    private void arm(Slot slot, Instant now) {
        disarm(slot);
        long generation = ++slot.generation;
        Instant deadline = now.plus(properties.getDebounce().getQuietWindow());
        slot.timer = taskScheduler.schedule(() -> onQuietWindowElapsed(slot, generation), deadline);
    }

    private void disarm(Slot slot) {
        slot.generation++;
        if (slot.timer != null) {
            slot.timer.cancel(false);
            slot.timer = null;
        }
    }

    private void onQuietWindowElapsed(Slot slot, long generation) {
        Batch closed;
        synchronized (slot) {
            if (slot.retired || slot.generation != generation || slot.open == null) {
                return;
            }
            slot.timer = null;
            closed = close(slot, BatchCloseReason.QUIET_WINDOW, clock.instant());
        }
        dispatch(closed);
    }

    private void retire(Slot slot) {
        slot.retired = true;
        slots.remove(slot.conversationId, slot);
    }

    private Batch close(Slot slot, BatchCloseReason reason, Instant now) {
        disarm(slot);
        Batch batch = slot.open.toBatch(slot.conversationId, true, reason, now);
        slot.open = null;
        slot.busy = true;
        return batch;
    }

    private void dispatch(Batch batch) {
        log.info("Closed batch {} for conversation {} with {} messages ({})",
                batch.getId(), batch.getConversationId(), batch.size(), batch.getCloseReason());
        try {
            batchHandler.onBatchClosed(batch);
        } catch (RuntimeException ex) {
            log.error("Batch handler failed for batch {} of conversation {}", batch.getId(), batch.getConversationId(), ex);
        }
    }

    private int maxBatchSize() {
        return Math.max(properties.getDebounce().getMaxBatchSize(), 1);
    }

    private static final class Slot {

        private final String conversationId;
        private final List<Message> held = new ArrayList<>();
        private OpenBatch open;
        private ScheduledFuture<?> timer;
        private long generation;
        private boolean busy;
        private boolean retired;

        private Slot(String conversationId) {
            this.conversationId = conversationId;
        }
    }

    private static final class OpenBatch {

        private final String id;
        private final Instant openedAt;
        private final List<Message> messages = new ArrayList<>();
        private Instant lastExtendedAt;

        private OpenBatch(String id, Instant openedAt) {
            this.id = id;
            this.openedAt = openedAt;
            this.lastExtendedAt = openedAt;
        }

        private Batch toBatch(String conversationId, boolean closed, BatchCloseReason reason, Instant closedAt) {
            return Batch.builder()
                    .id(id)
                    .conversationId(conversationId)
                    .messages(List.copyOf(messages))
                    .openedAt(openedAt)
                    .lastExtendedAt(lastExtendedAt)
                    .closed(closed)
                    .closeReason(reason)
                    .closedAt(closedAt)
                    .build();
        }
    }
}
