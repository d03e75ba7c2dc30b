package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends GameException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
