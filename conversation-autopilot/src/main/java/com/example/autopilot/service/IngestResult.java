package com.example.autopilot.service;

public enum IngestResult {
    OPENED,
    EXTENDED,
    CLOSED_AT_CAPACITY,
    HELD,
    DUPLICATE,
    QUARANTINED;

    static IngestResult of(BatchingOutcome outcome) {
        return switch (outcome) {
            case OPENED -> OPENED;
            case EXTENDED -> EXTENDED;
            case CLOSED_AT_CAPACITY -> CLOSED_AT_CAPACITY;
            case HELD -> HELD;
        };
    }
}
