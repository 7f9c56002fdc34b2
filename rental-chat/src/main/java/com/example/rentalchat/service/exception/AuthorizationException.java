package com.example.rentalchat.service.exception;

import org.springframework.http.HttpStatus;

public class AuthorizationException extends ServiceException {

    public AuthorizationException(String message) {
        super(HttpStatus.FORBIDDEN, message, "not_a_participant");
    }
}
