package com.example.autopilot.service;

public enum BatchingOutcome {
    OPENED,
    EXTENDED,
    CLOSED_AT_CAPACITY,
    HELD
}
