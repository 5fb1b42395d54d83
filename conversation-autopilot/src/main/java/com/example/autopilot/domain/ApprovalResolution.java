package com.example.autopilot.domain;

import java.time.Instant;

/**
 * Terminal outcome of an approval request, handed to whoever awaits its token.
 */
public record ApprovalResolution(
        String token,
        String conversationId,
        ApprovalStatus status,
        String replyText,
        Decision decision,
        Instant resolvedAt) {

    public static ApprovalResolution of(ApprovalRequest request) {
        return new ApprovalResolution(
                request.getToken(),
                request.getConversationId(),
                request.getStatus(),
                request.chosenReply(),
                request.getDecision(),
                request.getResolvedAt());
    }

    public boolean approved() {
        return status == ApprovalStatus.APPROVED;
    }
}
