package com.example.autopilot.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Base failure of the autopilot services. Carries the HTTP status the REST layer answers with and
 * a stable machine-readable code.
 */
public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
