package com.pipelineops.compensation.scheduler;

import com.pipelineops.compensation.config.CompensationConfig;
import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.service.PipelineCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;

/**
 * Waits for the pipeline cache to be filled.
 * <p>
 * Samples the cache on a fixed interval on the supplied scheduler. Read errors are
 * logged and counted, and polling simply starts over: there is no backoff and no
 * attempt limit. The first non-empty snapshot is emitted and the interval is cancelled.
 * If the cache never fills, polling never stops.
 */
@Component
@ConditionalOnExpression(CompensationConfig.COMPENSATION_JOB_ENABLED)
@Slf4j
public class PipelineCacheReadinessPoller {

    public static final Duration POLLING_INTERVAL = Duration.ofSeconds(5);

    private final PipelineCache pipelineCache;
    private final Scheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final Duration pollingInterval;

    private Counter cacheErrorCounter;

    @Autowired
    public PipelineCacheReadinessPoller(PipelineCache pipelineCache,
                                        @Qualifier("compensationScheduler") Scheduler scheduler,
                                        MeterRegistry meterRegistry) {
        this(pipelineCache, scheduler, meterRegistry, POLLING_INTERVAL);
    }

    PipelineCacheReadinessPoller(PipelineCache pipelineCache,
                                 Scheduler scheduler,
                                 MeterRegistry meterRegistry,
                                 Duration pollingInterval) {
        this.pipelineCache = pipelineCache;
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;
        this.pollingInterval = pollingInterval;
    }

    @PostConstruct
    public void initMetrics() {
        cacheErrorCounter = Counter.builder("compensation.pipeline-cache.errors")
                .description("Errors reading the pipeline cache while waiting for it to fill")
                .register(meterRegistry);
    }

    /**
     * Emits the first non-empty pipeline snapshot. Nothing is read until subscription,
     * and disposing the subscription stops the polling.
     */
    public Mono<List<Pipeline>> awaitPipelines() {
        return Flux.interval(pollingInterval, scheduler)
                .doOnNext(this::onPipelineCacheAwait)
                .map(tick -> pipelineCache.getPipelines())
                .doOnError(this::onPipelineCacheError)
                .retry()
                .filter(pipelines -> !pipelines.isEmpty())
                .next();
    }

    void onPipelineCacheAwait(long tick) {
        log.info("Waiting for pipeline cache to fill");
    }

    void onPipelineCacheError(Throwable t) {
        log.error("Error waiting for pipeline cache: {}", t.getMessage());
        cacheErrorCounter.increment();
    }
}
