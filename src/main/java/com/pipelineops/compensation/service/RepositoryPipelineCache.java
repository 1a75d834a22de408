package com.pipelineops.compensation.service;

import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.exception.PipelineCacheException;
import com.pipelineops.compensation.repository.PipelineRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pipeline cache backed by the pipeline repository.
 * <p>
 * The snapshot is refreshed on a fixed delay. Until the first refresh completes the cache
 * is empty; if that first load fails, readers get a {@link PipelineCacheException}. A failed
 * refresh after a successful one keeps serving the previous snapshot.
 */
@Service
@Slf4j
public class RepositoryPipelineCache implements PipelineCache {

    private final PipelineRepository pipelineRepository;

    // null until the first successful refresh
    private final AtomicReference<List<Pipeline>> snapshot = new AtomicReference<>();

    private volatile DataAccessException lastRefreshFailure;

    public RepositoryPipelineCache(PipelineRepository pipelineRepository) {
        this.pipelineRepository = pipelineRepository;
    }

    @Scheduled(fixedDelayString = "${pipeline-cache.refresh-interval-ms:15000}",
            initialDelayString = "${pipeline-cache.initial-delay-ms:1000}")
    public void refresh() {
        try {
            List<Pipeline> pipelines = List.copyOf(pipelineRepository.findAllByOrderByApplicationAscIdAsc());
            List<Pipeline> previous = snapshot.getAndSet(pipelines);
            lastRefreshFailure = null;

            if (previous == null || previous.size() != pipelines.size()) {
                log.info("Pipeline cache refreshed with {} pipelines", pipelines.size());
            } else {
                log.debug("Pipeline cache refreshed with {} pipelines", pipelines.size());
            }
        } catch (DataAccessException e) {
            lastRefreshFailure = e;
            log.warn("Failed to refresh pipeline cache: {}", e.getMessage());
        }
    }

    @Override
    public List<Pipeline> getPipelines() {
        List<Pipeline> pipelines = snapshot.get();
        if (pipelines != null) {
            return pipelines;
        }

        DataAccessException failure = lastRefreshFailure;
        if (failure != null) {
            throw new PipelineCacheException("Pipeline cache unavailable: " + failure.getMessage(), failure);
        }
        return List.of();
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }
}
