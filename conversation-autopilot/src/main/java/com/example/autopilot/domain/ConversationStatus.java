package com.example.autopilot.domain;

public enum ConversationStatus {
    IDLE,
    COLLECTING,
    DECIDING,
    AWAITING_APPROVAL,
    STALLED,
    QUARANTINED,
    ARCHIVED
}
