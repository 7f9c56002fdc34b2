package com.example.rentalchat.service.exception;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends ServiceException {

    public UnauthenticatedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message, "unauthenticated");
    }
}
