package com.example.autopilot.service.exception;

import org.springframework.http.HttpStatus;

public class ApprovalConflictException extends ServiceException {

    private final String pendingToken;

    public ApprovalConflictException(String conversationId, String pendingToken) {
        super(HttpStatus.CONFLICT,
                "Conversation %s already has pending approval %s".formatted(conversationId, pendingToken),
                "approval_pending");
        this.pendingToken = pendingToken;
    }

    public String getPendingToken() {
        return pendingToken;
    }
}
