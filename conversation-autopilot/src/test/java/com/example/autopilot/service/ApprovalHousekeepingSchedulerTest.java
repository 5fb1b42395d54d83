package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ApprovalResolution;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.domain.Classification;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.SensitivityCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApprovalHousekeepingSchedulerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T18:00:00Z"));
    private final InMemoryApprovalStore store = new InMemoryApprovalStore();
    private final AutopilotProperties properties = new AutopilotProperties();

    private ApprovalBroker broker;
    private ApprovalHousekeepingScheduler housekeeping;

    @BeforeEach
    void setUp() {
        properties.getApproval().setTimeout(Duration.ofHours(1));
        broker = new ApprovalBroker(store, clock);
        housekeeping = new ApprovalHousekeepingScheduler(properties, broker, clock);
    }

    @Test
    void expiresOnlyRequestsPastTimeout() {
        String old = broker.request("thread-1", "Dana", decision("thread-1")).getToken();
        clock.advance(Duration.ofMinutes(40));
        String recent = broker.request("thread-2", "Lee", decision("thread-2")).getToken();
        clock.advance(Duration.ofMinutes(30));

        housekeeping.expireOverdueApprovals();

        assertThat(broker.find(old).orElseThrow().getStatus()).isEqualTo(ApprovalStatus.EXPIRED);
        assertThat(broker.find(recent).orElseThrow().getStatus()).isEqualTo(ApprovalStatus.PENDING);
    }

    @Test
    void expiryCompletesWaitingFuture() {
        String token = broker.request("thread-1", "Dana", decision("thread-1")).getToken();
        CompletableFuture<ApprovalResolution> outcome = broker.await(token).orElseThrow();
        clock.advance(Duration.ofHours(2));

        housekeeping.expireOverdueApprovals();

        assertThat(outcome).isCompleted();
        assertThat(outcome.join().status()).isEqualTo(ApprovalStatus.EXPIRED);
    }

    private Decision decision(String conversationId) {
        return Decision.builder()
                .batchId("batch-" + conversationId)
                .conversationId(conversationId)
                .classification(Classification.NEEDS_APPROVAL)
                .category(SensitivityCategory.PRICING)
                .proposedReply("Lowest is $3")
                .build();
    }
}
