package com.pipelineops.compensation.service;

import com.pipelineops.compensation.entity.ExecutionStatus;
import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.entity.PipelineExecution;
import com.pipelineops.compensation.entity.TriggerType;
import com.pipelineops.compensation.exception.PipelineTriggerException;
import com.pipelineops.compensation.repository.PipelineExecutionRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Starts pipeline executions by recording them in the execution store.
 * <p>
 * Triggering can be switched off with {@code pipeline-initiator.enabled=false},
 * in which case requests are only logged.
 */
@Service
@Slf4j
public class PipelineInitiator implements TriggerInvocationService {

    private final PipelineExecutionRepository executionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final boolean enabled;

    private Counter startedCounter;

    public PipelineInitiator(PipelineExecutionRepository executionRepository,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             @Value("${pipeline-initiator.enabled:true}") boolean enabled) {
        this.executionRepository = executionRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.enabled = enabled;
    }

    @PostConstruct
    public void initMetrics() {
        startedCounter = Counter.builder("compensation.pipelines.started")
                .description("Pipeline executions started by the initiator")
                .register(meterRegistry);
    }

    @Override
    @CircuitBreaker(name = "pipelineInitiator", fallbackMethod = "startFallback")
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public void start(Pipeline pipeline) {
        if (!enabled) {
            log.info("Would trigger pipeline application:{}, pipelineConfigId:{} but triggering is disabled",
                    pipeline.getApplication(), pipeline.getId());
            return;
        }

        Instant now = clock.instant();
        PipelineExecution execution = executionRepository.save(PipelineExecution.builder()
                .pipelineConfigId(pipeline.getId())
                .application(pipeline.getApplication())
                .status(ExecutionStatus.RUNNING)
                .triggerType(TriggerType.CRON)
                .createdAt(now)
                .startTime(now)
                .build());

        startedCounter.increment();
        log.info("Started execution {} of pipeline application:{}, pipelineConfigId:{}",
                execution.getId(), pipeline.getApplication(), pipeline.getId());
    }

    /**
     * Called once retries are exhausted or the circuit is open.
     */
    public void startFallback(Pipeline pipeline, Throwable throwable) {
        log.warn("Could not start pipeline {}: {}", pipeline.getId(), throwable.getMessage());

        throw new PipelineTriggerException(
                "Failed to start pipeline " + pipeline.getId() + ": " + throwable.getMessage(),
                pipeline.getId(),
                throwable
        );
    }

    public boolean isEnabled() {
        return enabled;
    }
}
