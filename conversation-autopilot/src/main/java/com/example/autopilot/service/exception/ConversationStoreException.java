package com.example.autopilot.service.exception;

import org.springframework.http.HttpStatus;

public class ConversationStoreException extends ServiceException {

    private final boolean transientFailure;

    public ConversationStoreException(String message, Throwable cause) {
        this(HttpStatus.SERVICE_UNAVAILABLE, message, "store_unavailable", cause, true);
    }

    private ConversationStoreException(
            HttpStatus status, String message, String errorCode, Throwable cause, boolean transientFailure) {
        super(status, message, errorCode, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * The store refused the write itself, for instance a value exceeding a column. Repeating the
     * call fails the same way.
     */
    public static ConversationStoreException rejected(String message, Throwable cause) {
        return new ConversationStoreException(HttpStatus.UNPROCESSABLE_ENTITY, message, "store_rejected", cause, false);
    }

    @Override
    public boolean isTransient() {
        return transientFailure;
    }
}
