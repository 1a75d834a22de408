package com.pipelineops.compensation.service;

import com.pipelineops.compensation.dto.ExecutionRecord;
import com.pipelineops.compensation.entity.PipelineExecution;
import com.pipelineops.compensation.exception.ExecutionHistoryException;
import com.pipelineops.compensation.exception.InvalidCompensationConfigException;
import com.pipelineops.compensation.repository.PipelineExecutionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution history served from the local execution store.
 * <p>
 * The blocking query runs on Reactor's bounded elastic scheduler so callers
 * can treat the lookup as asynchronous.
 */
@Service
@Slf4j
public class JpaExecutionHistoryService implements ExecutionHistoryService {

    private final PipelineExecutionRepository executionRepository;
    private final int maxPerPipeline;

    public JpaExecutionHistoryService(PipelineExecutionRepository executionRepository,
                                      @Value("${execution-history.max-per-pipeline:1}") int maxPerPipeline) {
        if (maxPerPipeline < 1) {
            throw new InvalidCompensationConfigException(
                    "execution-history.max-per-pipeline must be at least 1, got " + maxPerPipeline);
        }
        this.executionRepository = executionRepository;
        this.maxPerPipeline = maxPerPipeline;
    }

    @Override
    public Mono<List<ExecutionRecord>> getLatestPipelineExecutions(List<String> pipelineConfigIds) {
        if (pipelineConfigIds == null || pipelineConfigIds.isEmpty()) {
            return Mono.just(List.of());
        }

        List<String> ids = List.copyOf(pipelineConfigIds);
        return Mono.fromCallable(() -> findLatestExecutions(ids))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(DataAccessException.class, e -> new ExecutionHistoryException(
                        "Failed to load latest executions for " + ids.size() + " pipeline configs", ids, e));
    }

    List<ExecutionRecord> findLatestExecutions(List<String> ids) {
        List<PipelineExecution> executions = executionRepository.findByPipelineConfigIdsNewestFirst(ids);

        Map<String, Integer> keptPerPipeline = new HashMap<>();
        List<ExecutionRecord> records = new ArrayList<>();
        for (PipelineExecution execution : executions) {
            int kept = keptPerPipeline.merge(execution.getPipelineConfigId(), 1, Integer::sum);
            if (kept <= maxPerPipeline) {
                records.add(toRecord(execution));
            }
        }

        log.debug("Loaded {} latest executions for {} pipeline configs", records.size(), ids.size());
        return records;
    }

    private ExecutionRecord toRecord(PipelineExecution execution) {
        return ExecutionRecord.builder()
                .id(execution.getId())
                .pipelineConfigId(execution.getPipelineConfigId())
                .status(execution.getStatus())
                .startTime(execution.getStartTime())
                .build();
    }
}
