package com.example.autopilot.domain;

public enum BatchCloseReason {
    QUIET_WINDOW,
    MAX_SIZE,
    RECOVERED
}
