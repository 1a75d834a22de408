package com.pipelineops.compensation.exception;

/**
 * The pipeline cache could not produce a snapshot.
 * Readers are expected to try again later.
 */
public class PipelineCacheException extends CompensationException {

    public PipelineCacheException(String message) {
        super(message);
    }

    public PipelineCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
