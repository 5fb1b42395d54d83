package com.example.autopilot.domain;

public enum Classification {
    AUTO,
    NEEDS_APPROVAL
}
