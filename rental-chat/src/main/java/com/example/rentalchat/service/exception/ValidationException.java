package com.example.rentalchat.service.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ServiceException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message, "validation_error");
    }
}
