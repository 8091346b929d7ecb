package com.streamfirst.component.catalog.ports;

/**
 * Thrown by {@link CandidatePort} implementations when the backing catalog cannot be read.
 * Callers should surface it as a server-side failure; the port itself never retries.
 */
public class CandidateAccessException extends RuntimeException {

    public CandidateAccessException(String message) {
        super(message);
    }

    public CandidateAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
