package com.jreinhal.covenant.exception;

public class AnswerUnavailableException extends RuntimeException {
    public AnswerUnavailableException(String message) {
        super(message);
    }

    public AnswerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
