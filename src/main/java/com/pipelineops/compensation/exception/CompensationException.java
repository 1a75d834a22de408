package com.pipelineops.compensation.exception;

/**
 * Base exception for missed-trigger compensation errors.
 */
public class CompensationException extends RuntimeException {

    public CompensationException(String message) {
        super(message);
    }

    public CompensationException(String message, Throwable cause) {
        super(message, cause);
    }
}
