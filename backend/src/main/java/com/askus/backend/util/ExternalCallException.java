package com.askus.backend.util;

/**
 * A call to the embedding service, the vector store or the language model
 * failed, timed out or was cancelled. Callers degrade instead of surfacing it.
 */
public class ExternalCallException extends RuntimeException {

    private final String service;

    public ExternalCallException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public ExternalCallException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public String service() {
        return service;
    }
}
