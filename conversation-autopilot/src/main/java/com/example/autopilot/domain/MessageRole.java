package com.example.autopilot.domain;

public enum MessageRole {
    INBOUND,
    OUTBOUND
}
