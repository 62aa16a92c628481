package com.intervue.evaluation.provider;

/**
 * Transport-level failure talking to the reasoning endpoint (timeout, refused connection, I/O).
 */
public class ReasoningEndpointException extends RuntimeException {

    public ReasoningEndpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
