package com.pipelineops.compensation.exception;

/**
 * Thrown at startup when the compensation window cannot be built,
 * e.g. an unknown time zone id or a non-positive window. Never retried.
 */
public class InvalidCompensationConfigException extends CompensationException {

    public InvalidCompensationConfigException(String message) {
        super(message);
    }

    public InvalidCompensationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
