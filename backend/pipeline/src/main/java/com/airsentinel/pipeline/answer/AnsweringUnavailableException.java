package com.airsentinel.pipeline.answer;

public class AnsweringUnavailableException extends IllegalStateException {
    public AnsweringUnavailableException(String message) {
        super(message);
    }

    public AnsweringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
