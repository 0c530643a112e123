package com.airsentinel.pipeline.ingest;

public class PersistenceUnavailableException extends IllegalStateException {
    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
