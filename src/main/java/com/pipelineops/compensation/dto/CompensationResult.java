package com.pipelineops.compensation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the compensation pass. Exposed on the status endpoint and logged at the end of the pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompensationResult {

    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private int pipelinesScanned = 0;

    @Builder.Default
    private int cronTriggers = 0;

    @Builder.Default
    private int triggersEvaluated = 0;

    @Builder.Default
    private int skippedNeverExecuted = 0;

    @Builder.Default
    private int missedExecutions = 0;

    @Builder.Default
    private int triggered = 0;

    @Builder.Default
    private int errors = 0;

    /**
     * Set when the execution history could not be read and no trigger was evaluated.
     */
    @Builder.Default
    private boolean abandoned = false;

    @Builder.Default
    private List<CompensationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompensationError {
        private String triggerId;
        private String pipelineConfigId;
        private String errorMessage;
        private Instant occurredAt;
    }

    public void incrementTriggersEvaluated() {
        this.triggersEvaluated++;
    }

    public void incrementSkippedNeverExecuted() {
        this.skippedNeverExecuted++;
    }

    public void incrementMissedExecutions() {
        this.missedExecutions++;
    }

    public void incrementTriggered() {
        this.triggered++;
    }

    public void addError(String triggerId, String pipelineConfigId, String errorMessage, Instant occurredAt) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(CompensationError.builder()
                .triggerId(triggerId)
                .pipelineConfigId(pipelineConfigId)
                .errorMessage(errorMessage)
                .occurredAt(occurredAt)
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
