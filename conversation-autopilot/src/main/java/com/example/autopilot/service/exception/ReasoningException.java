package com.example.autopilot.service.exception;

import org.springframework.http.HttpStatus;

public class ReasoningException extends ServiceException {

    public ReasoningException(String message) {
        this(message, null);
    }

    public ReasoningException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, "reasoning_unavailable", cause);
    }
}
