package com.kopo.letterrush.service.validation;

/**
 * The external judge failed, timed out or answered with something unusable.
 */
public class JudgeUnavailableException extends RuntimeException {

    public JudgeUnavailableException(String message) {
        super(message);
    }

    public JudgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
