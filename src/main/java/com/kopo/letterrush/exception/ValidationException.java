package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends GameException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
