package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends GameException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
