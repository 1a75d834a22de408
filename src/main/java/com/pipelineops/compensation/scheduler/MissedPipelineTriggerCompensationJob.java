package com.pipelineops.compensation.scheduler;

import com.pipelineops.compensation.config.CompensationConfig;
import com.pipelineops.compensation.cron.MissedExecutionDetector;
import com.pipelineops.compensation.cron.WindowContext;
import com.pipelineops.compensation.dto.CompensationResult;
import com.pipelineops.compensation.dto.ExecutionRecord;
import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.entity.Trigger;
import com.pipelineops.compensation.exception.InvalidCronExpressionException;
import com.pipelineops.compensation.service.ExecutionHistoryService;
import com.pipelineops.compensation.service.TriggerFilter;
import com.pipelineops.compensation.service.TriggerInvocationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Finds and re-fires pipeline cron triggers that should have run during the configured
 * window before startup, e.g. while the service was being deployed or restarted.
 * <p>
 * The job waits until the pipeline cache has been filled, then runs a single compensation
 * pass and stops for the rest of the process lifetime, whether the pass succeeded or not.
 * Only the actual start times of the latest executions are used to avoid double-firing;
 * a trigger fired concurrently by the live cron dispatcher can still be fired twice.
 */
@Component
@ConditionalOnExpression(CompensationConfig.COMPENSATION_JOB_ENABLED)
@Slf4j
public class MissedPipelineTriggerCompensationJob implements ApplicationListener<ContextRefreshedEvent> {

    private final PipelineCacheReadinessPoller readinessPoller;
    private final ExecutionHistoryService executionHistoryService;
    private final TriggerInvocationService triggerInvocationService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final WindowContext windowContext;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<CompensationState> state =
            new AtomicReference<>(CompensationState.AWAITING_CACHE);
    private final AtomicReference<CompensationResult> lastResult = new AtomicReference<>();

    // owns the polling loop; written once by start()
    private volatile Disposable subscription;

    private Counter historyErrorCounter;
    private Counter evaluatedCounter;
    private Counter missedCounter;
    private Counter invalidCronCounter;
    private Counter invocationErrorCounter;

    @Autowired
    public MissedPipelineTriggerCompensationJob(PipelineCacheReadinessPoller readinessPoller,
                                                ExecutionHistoryService executionHistoryService,
                                                TriggerInvocationService triggerInvocationService,
                                                MeterRegistry meterRegistry,
                                                Clock clock,
                                                @Value("${scheduler.compensation-job.window-ms:1800000}") long compensationWindowMs,
                                                @Value("${scheduler.cron.timezone:America/Los_Angeles}") String timeZoneId) {
        this(readinessPoller, executionHistoryService, triggerInvocationService, meterRegistry, clock,
                WindowContext.fromCompensationWindow(timeZoneId, compensationWindowMs, clock));
    }

    public MissedPipelineTriggerCompensationJob(PipelineCacheReadinessPoller readinessPoller,
                                                ExecutionHistoryService executionHistoryService,
                                                TriggerInvocationService triggerInvocationService,
                                                MeterRegistry meterRegistry,
                                                Clock clock,
                                                WindowContext windowContext) {
        this.readinessPoller = readinessPoller;
        this.executionHistoryService = executionHistoryService;
        this.triggerInvocationService = triggerInvocationService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.windowContext = windowContext;
    }

    @PostConstruct
    public void initMetrics() {
        historyErrorCounter = Counter.builder("compensation.execution-history.errors")
                .description("Failures retrieving the latest pipeline executions")
                .register(meterRegistry);

        evaluatedCounter = Counter.builder("compensation.triggers.evaluated")
                .description("Cron triggers checked for a missed execution")
                .register(meterRegistry);

        missedCounter = Counter.builder("compensation.triggers.missed")
                .description("Cron triggers found to have missed an execution")
                .register(meterRegistry);

        invalidCronCounter = Counter.builder("compensation.triggers.invalid")
                .description("Cron triggers skipped because of an invalid expression")
                .register(meterRegistry);

        invocationErrorCounter = Counter.builder("compensation.trigger-invocation.errors")
                .description("Missed executions that could not be re-triggered")
                .register(meterRegistry);
    }

    @Override
    public void onApplicationEvent(ContextRefreshedEvent event) {
        start();
    }

    /**
     * Starts waiting for the pipeline cache. Only the first call has any effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("Missed pipeline trigger compensation already started");
            return;
        }

        log.info("Compensating cron triggers missed between {} and {} ({})",
                windowContext.getWindowFloor(), windowContext.getNow(), windowContext.getTimeZone());

        subscription = readinessPoller.awaitPipelines()
                .flatMap(this::triggerMissedExecutions)
                .doFinally(signal -> state.set(CompensationState.DONE))
                .subscribe(this::onCompensationComplete, this::onCompensationError);
    }

    @PreDestroy
    public void stop() {
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            log.info("Stopping missed pipeline trigger compensation in state {}", state.get());
            current.dispose();
        }
    }

    Mono<CompensationResult> triggerMissedExecutions(List<Pipeline> pipelines) {
        state.set(CompensationState.EVALUATING);
        log.info("Looking for missed pipeline executions from cron triggers");

        CompensationResult result = CompensationResult.builder()
                .startedAt(clock.instant())
                .pipelinesScanned(pipelines.size())
                .build();

        List<Pipeline> enabledPipelines = pipelines.stream()
                .filter(pipeline -> !pipeline.isDisabled())
                .collect(Collectors.toList());
        List<Trigger> triggers = TriggerFilter.getEnabledCronTriggers(enabledPipelines);
        result.setCronTriggers(triggers.size());

        if (triggers.isEmpty()) {
            log.info("No enabled cron triggers found in {} pipelines", pipelines.size());
            return Mono.just(complete(result));
        }

        List<String> ids = TriggerFilter.getPipelineConfigIds(enabledPipelines, triggers);
        return executionHistoryService.getLatestPipelineExecutions(ids)
                .defaultIfEmpty(List.of())
                .map(executions -> onExecutionHistory(executions, enabledPipelines, triggers, result))
                .onErrorResume(error -> Mono.just(onExecutionHistoryError(error, result)));
    }

    CompensationResult onExecutionHistory(List<ExecutionRecord> executions,
                                          List<Pipeline> pipelines,
                                          List<Trigger> triggers,
                                          CompensationResult result) {
        for (Trigger trigger : triggers) {
            Optional<Pipeline> owner = TriggerFilter.findOwningPipeline(pipelines, trigger);
            if (owner.isEmpty()) {
                continue;
            }

            Pipeline pipeline = owner.get();
            try {
                compensateTrigger(trigger, pipeline, executions, result);
            } catch (InvalidCronExpressionException e) {
                log.warn("Skipping trigger {} of pipeline {}: {}", trigger.getId(), pipeline.getId(), e.getMessage());
                invalidCronCounter.increment();
                result.addError(trigger.getId(), pipeline.getId(), e.getMessage(), clock.instant());
            } catch (RuntimeException e) {
                log.warn("Failed to trigger missed execution on pipeline application:{}, pipelineConfigId:{}",
                        pipeline.getApplication(), pipeline.getId(), e);
                invocationErrorCounter.increment();
                result.addError(trigger.getId(), pipeline.getId(), e.getMessage(), clock.instant());
            }
        }
        return complete(result);
    }

    private void compensateTrigger(Trigger trigger, Pipeline pipeline,
                                   List<ExecutionRecord> executions, CompensationResult result) {
        Optional<ExecutionRecord> latest = executions.stream()
                .filter(execution -> pipeline.getId().equals(execution.getPipelineConfigId()))
                .findFirst();

        // A null start time is valid; a pipeline that hasn't started won't get re-triggered.
        if (latest.isEmpty() || latest.get().getStartTime() == null) {
            result.incrementSkippedNeverExecuted();
            return;
        }

        Instant lastExecution = latest.get().getStartTime();
        result.incrementTriggersEvaluated();
        evaluatedCounter.increment();

        if (MissedExecutionDetector.missedExecution(trigger.getCronExpression(), lastExecution, windowContext)) {
            result.incrementMissedExecutions();
            missedCounter.increment();

            log.info("Triggering missed execution on pipeline application:{}, pipelineConfigId:{}",
                    pipeline.getApplication(), pipeline.getId());
            triggerInvocationService.start(pipeline);
            result.incrementTriggered();
        }
    }

    CompensationResult onExecutionHistoryError(Throwable error, CompensationResult result) {
        log.error("Error retrieving latest pipeline executions", error);
        historyErrorCounter.increment();

        result.setAbandoned(true);
        result.addError(null, null, error.getMessage(), clock.instant());
        return complete(result);
    }

    private CompensationResult complete(CompensationResult result) {
        result.setCompletedAt(clock.instant());
        return result;
    }

    private void onCompensationComplete(CompensationResult result) {
        lastResult.set(result);
        if (result.isAbandoned()) {
            log.warn("Missed pipeline trigger compensation abandoned after {} cron triggers were found",
                    result.getCronTriggers());
            return;
        }
        log.info("Missed pipeline trigger compensation completed in {}ms: {} cron triggers, {} evaluated, "
                        + "{} never executed, {} missed, {} triggered, {} errors",
                result.getDurationMs(),
                result.getCronTriggers(),
                result.getTriggersEvaluated(),
                result.getSkippedNeverExecuted(),
                result.getMissedExecutions(),
                result.getTriggered(),
                result.getErrors());
    }

    private void onCompensationError(Throwable error) {
        log.error("Missed pipeline trigger compensation failed with unexpected error", error);
    }

    public CompensationState getState() {
        return state.get();
    }

    public Optional<CompensationResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public WindowContext getWindowContext() {
        return windowContext;
    }

    public boolean isStarted() {
        return started.get();
    }
}
