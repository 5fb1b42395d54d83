package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.Batch;
import com.example.autopilot.domain.BatchCloseReason;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebounceSchedulerTest {

    private static final String CONVERSATION = "thread-1";

    private MutableClock clock;
    private ManualTimers timers;
    private AutopilotProperties properties;
    private DebounceScheduler scheduler;
    private final List<Batch> closed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T18:00:00Z"));
        timers = new ManualTimers(clock);
        properties = new AutopilotProperties();
        properties.getDebounce().setQuietWindow(Duration.ofSeconds(3));
        properties.getDebounce().setMaxBatchSize(5);
        scheduler = new DebounceScheduler(timers.scheduler(), clock, properties);
        scheduler.setBatchHandler(closed::add);
    }

    @Test
    void burstWithinQuietWindowClosesAsOneBatch() {
        assertThat(scheduler.onMessage(CONVERSATION, message("m1", "Is it available?")))
                .isEqualTo(BatchingOutcome.OPENED);
        timers.advance(Duration.ofSeconds(1));
        assertThat(scheduler.onMessage(CONVERSATION, message("m2", "Also is it negotiable?")))
                .isEqualTo(BatchingOutcome.EXTENDED);

        timers.advance(Duration.ofMillis(2_999));
        assertThat(closed).isEmpty();

        timers.advance(Duration.ofMillis(1));
        assertThat(closed).hasSize(1);
        Batch batch = closed.get(0);
        assertThat(batch.texts()).containsExactly("Is it available?", "Also is it negotiable?");
        assertThat(batch.getCloseReason()).isEqualTo(BatchCloseReason.QUIET_WINDOW);
        assertThat(batch.getClosedAt()).isEqualTo(Instant.parse("2026-03-01T18:00:04Z"));
        assertThat(scheduler.isBusy(CONVERSATION)).isTrue();
    }

    @Test
    void closesImmediatelyWhenBatchReachesMaximumSize() {
        for (int i = 1; i <= 4; i++) {
            scheduler.onMessage(CONVERSATION, message("m" + i, "line " + i));
        }
        assertThat(scheduler.onMessage(CONVERSATION, message("m5", "line 5")))
                .isEqualTo(BatchingOutcome.CLOSED_AT_CAPACITY);

        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).size()).isEqualTo(5);
        assertThat(closed.get(0).getCloseReason()).isEqualTo(BatchCloseReason.MAX_SIZE);

        assertThat(scheduler.onMessage(CONVERSATION, message("m6", "line 6")))
                .isEqualTo(BatchingOutcome.HELD);
        timers.advance(Duration.ofSeconds(10));
        assertThat(closed).hasSize(1);
    }

    @Test
    void heldMessagesOpenNextBatchOnRelease() {
        scheduler.onMessage(CONVERSATION, message("m1", "first"));
        timers.advance(Duration.ofSeconds(3));
        assertThat(scheduler.onMessage(CONVERSATION, message("m2", "while deciding")))
                .isEqualTo(BatchingOutcome.HELD);
        assertThat(scheduler.heldCount(CONVERSATION)).isEqualTo(1);

        scheduler.release(CONVERSATION);

        assertThat(scheduler.isBusy(CONVERSATION)).isFalse();
        assertThat(scheduler.openBatch(CONVERSATION))
                .hasValueSatisfying(batch -> assertThat(batch.texts()).containsExactly("while deciding"));
        timers.advance(Duration.ofSeconds(3));
        assertThat(closed).hasSize(2);
        assertThat(closed.get(0).getId()).isNotEqualTo(closed.get(1).getId());
    }

    @Test
    void heldMessagesAreNotBatchedWhenReplayIsDisabled() {
        properties.getDebounce().setReplayHeldMessages(false);
        scheduler.onMessage(CONVERSATION, message("m1", "first"));
        timers.advance(Duration.ofSeconds(3));
        scheduler.onMessage(CONVERSATION, message("m2", "while deciding"));

        scheduler.release(CONVERSATION);

        assertThat(scheduler.openBatch(CONVERSATION)).isEmpty();
        assertThat(scheduler.heldCount(CONVERSATION)).isZero();
    }

    @Test
    void cancelDropsOpenBatchAndTimer() {
        scheduler.onMessage(CONVERSATION, message("m1", "hello"));

        scheduler.cancel(CONVERSATION);
        timers.advance(Duration.ofSeconds(5));

        assertThat(closed).isEmpty();
        assertThat(scheduler.openBatch(CONVERSATION)).isEmpty();
        assertThat(timers.pending()).isZero();
    }

    @Test
    void conversationsAreBatchedIndependently() {
        scheduler.onMessage("a", message("a1", "from a"));
        timers.advance(Duration.ofSeconds(2));
        scheduler.onMessage("b", message("b1", "from b"));

        timers.advance(Duration.ofSeconds(1));
        assertThat(closed).extracting(Batch::getConversationId).containsExactly("a");

        timers.advance(Duration.ofSeconds(2));
        assertThat(closed).extracting(Batch::getConversationId).containsExactly("a", "b");
    }

    @Test
    void releasedConversationWithNothingHeldIsForgotten() {
        scheduler.onMessage(CONVERSATION, message("m1", "first"));
        timers.advance(Duration.ofSeconds(3));
        assertThat(scheduler.isTracking(CONVERSATION)).isTrue();

        scheduler.release(CONVERSATION);

        assertThat(scheduler.isTracking(CONVERSATION)).isFalse();
        assertThat(scheduler.onMessage(CONVERSATION, message("m2", "next day")))
                .isEqualTo(BatchingOutcome.OPENED);
        assertThat(scheduler.isTracking(CONVERSATION)).isTrue();
    }

    @Test
    void droppedHeldMessagesLeaveNoState() {
        properties.getDebounce().setReplayHeldMessages(false);
        scheduler.onMessage(CONVERSATION, message("m1", "first"));
        timers.advance(Duration.ofSeconds(3));
        scheduler.onMessage(CONVERSATION, message("m2", "while deciding"));

        scheduler.release(CONVERSATION);

        assertThat(scheduler.isTracking(CONVERSATION)).isFalse();
    }

    @Test
    void markBusyHoldsNewMessagesUntilReleased() {
        scheduler.markBusy(CONVERSATION);

        assertThat(scheduler.onMessage(CONVERSATION, message("m1", "after restart")))
                .isEqualTo(BatchingOutcome.HELD);
        timers.advance(Duration.ofSeconds(5));
        assertThat(closed).isEmpty();
    }

    private Message message(String key, String text) {
        return Message.builder()
                .conversationId(CONVERSATION)
                .role(MessageRole.INBOUND)
                .text(text)
                .dedupKey(key)
                .timestamp(clock.instant())
                .build();
    }
}
