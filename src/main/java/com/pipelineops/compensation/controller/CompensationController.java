package com.pipelineops.compensation.controller;

import com.pipelineops.compensation.cron.WindowContext;
import com.pipelineops.compensation.dto.CompensationStatus;
import com.pipelineops.compensation.scheduler.MissedPipelineTriggerCompensationJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only view of the missed trigger compensation job.
 * <p>
 * No endpoint starts a pass; the job runs once per process.
 */
@RestController
@RequestMapping("/api/v1/compensation")
@RequiredArgsConstructor
@Tag(name = "Compensation", description = "Missed cron trigger compensation status API")
public class CompensationController {

    private final ObjectProvider<MissedPipelineTriggerCompensationJob> compensationJob;

    @Operation(
            summary = "Get compensation status",
            description = "Returns the job state, the lookback window and the result of the pass once it has finished."
    )
    @ApiResponse(responseCode = "200", description = "Status retrieved successfully",
            content = @Content(schema = @Schema(implementation = CompensationStatus.class)))
    @GetMapping("/status")
    public ResponseEntity<CompensationStatus> getStatus() {
        MissedPipelineTriggerCompensationJob job = compensationJob.getIfAvailable();
        if (job == null) {
            return ResponseEntity.ok(CompensationStatus.builder()
                    .state(CompensationStatus.DISABLED)
                    .build());
        }

        WindowContext window = job.getWindowContext();
        return ResponseEntity.ok(CompensationStatus.builder()
                .state(job.getState().name())
                .timeZone(window.getTimeZone().getId())
                .windowFloor(window.getWindowFloor())
                .windowEnd(window.getNow())
                .result(job.getLastResult().orElse(null))
                .build());
    }

    @Operation(
            summary = "Health check",
            description = "Returns UP together with the compensation job state."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        MissedPipelineTriggerCompensationJob job = compensationJob.getIfAvailable();
        String state = job == null ? CompensationStatus.DISABLED : job.getState().name();

        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "compensation", Map.of("state", state)
        ));
    }
}
