package com.pipelineops.compensation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot of the compensation job for the status endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompensationStatus {

    public static final String DISABLED = "DISABLED";

    /**
     * One of the job states, or {@link #DISABLED} when the job is not configured.
     */
    private String state;

    private String timeZone;
    private Instant windowFloor;
    private Instant windowEnd;

    /**
     * Result of the pass, null while it has not finished.
     */
    private CompensationResult result;
}
