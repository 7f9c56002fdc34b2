package com.example.rentalchat.service.exception;

import java.util.Objects;
import org.springframework.http.HttpStatus;

/**
 * Base of the chat failure kinds. The error code is what REST bodies and socket acks expose as {@code code}
 * and {@code kind}; the status is only meaningful on the HTTP surface.
 */
public abstract class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    protected ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        // stack traces only for server-side failures
        super(message, cause, false, status.is5xxServerError());
        this.status = Objects.requireNonNull(status, "status");
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return false;
    }
}
