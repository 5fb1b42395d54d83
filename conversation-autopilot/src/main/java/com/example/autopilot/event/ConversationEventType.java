package com.example.autopilot.event;

public enum ConversationEventType {
    MESSAGE_INGESTED,
    BATCH_CLOSED,
    DECISION_MADE,
    APPROVAL_REQUESTED,
    APPROVAL_RESOLVED,
    REPLY_SENT,
    REPLY_FAILED,
    MEETUP_CONFIRMED,
    CONVERSATION_ARCHIVED,
    CONVERSATION_QUARANTINED
}
