package com.pipelineops.compensation.service;

import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.exception.PipelineCacheException;

import java.util.List;

/**
 * Read access to the current set of pipeline definitions.
 * <p>
 * The cache fills asynchronously after startup, so callers must be prepared for
 * an empty snapshot or a transient failure and ask again later.
 */
public interface PipelineCache {

    /**
     * Returns the latest snapshot of pipeline definitions. Safe to call repeatedly.
     *
     * @return an immutable snapshot, empty until the cache has been filled
     * @throws PipelineCacheException if the cache is currently unavailable
     */
    List<Pipeline> getPipelines() throws PipelineCacheException;
}
