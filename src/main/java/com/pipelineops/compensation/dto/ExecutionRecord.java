package com.pipelineops.compensation.dto;

import com.pipelineops.compensation.entity.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The execution history's view of a recent pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    private Long id;

    /**
     * Id of the pipeline definition that was executed.
     */
    private String pipelineConfigId;

    private ExecutionStatus status;

    /**
     * When the execution started. Null means it never started and must not
     * be used to decide that a run was missed.
     */
    private Instant startTime;
}
