package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends GameException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
