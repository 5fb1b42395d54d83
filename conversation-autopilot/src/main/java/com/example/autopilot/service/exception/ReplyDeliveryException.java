package com.example.autopilot.service.exception;

import org.springframework.http.HttpStatus;

public class ReplyDeliveryException extends ServiceException {

    public ReplyDeliveryException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, "reply_delivery_failed", cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
