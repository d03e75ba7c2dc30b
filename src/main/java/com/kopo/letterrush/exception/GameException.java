package com.kopo.letterrush.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for request failures that carry a client-facing status.
 */
public abstract class GameException extends RuntimeException {

    private final HttpStatus status;

    protected GameException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
