package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ApprovalRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

/**
 * Expires approvals whose in-memory timer was lost, for example because another instance issued
 * them or the expiry fired while storage was down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalHousekeepingScheduler {

    private final AutopilotProperties properties;
    private final ApprovalBroker approvalBroker;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${autopilot.housekeeping.interval:PT1M}').toMillis()}")
    public void expireOverdueApprovals() {
        Duration timeout = properties.getApproval().getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        Instant cutoff = clock.instant().minus(timeout);
        List<ApprovalRequest> overdue;
        try {
            overdue = approvalBroker.findOverdue(cutoff);
        } catch (RuntimeException ex) {
            log.warn("Unable to look up overdue approvals", ex);
            return;
        }
        if (CollectionUtils.isEmpty(overdue)) {
            return;
        }
        for (ApprovalRequest request : overdue) {
            try {
                log.debug("Expiring approval {} of conversation {} requested at {}",
                        request.getToken(), request.getConversationId(), request.getRequestedAt());
                approvalBroker.expire(request.getToken());
            } catch (RuntimeException ex) {
                log.warn("Failed to expire approval {}", request.getToken(), ex);
            }
        }
    }
}
