package com.example.rentalchat.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A durable store operation failed in a way that may succeed on retry (timeout, lock contention).
 */
public class TransientStoreException extends ServiceException {

    public TransientStoreException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, "store_unavailable", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
