package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends GameException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
