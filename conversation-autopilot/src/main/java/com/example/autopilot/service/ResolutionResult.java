package com.example.autopilot.service;

public enum ResolutionResult {
    APPLIED,
    UNKNOWN_TOKEN,
    ALREADY_TERMINAL
}
