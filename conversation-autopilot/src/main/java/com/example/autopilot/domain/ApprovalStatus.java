package com.example.autopilot.domain;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
