package com.pipelineops.compensation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single run of a pipeline config.
 * <p>
 * {@code startTime} stays null until the execution actually starts, which is
 * why the compensation job treats a null start time as "never ran".
 */
@Entity
@Table(name = "pipeline_executions", indexes = {
        @Index(name = "idx_execution_config_created", columnList = "pipeline_config_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pipeline_config_id", nullable = false, length = 100)
    private String pipelineConfigId;

    @Column(length = 100)
    private String application;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", length = 20)
    private TriggerType triggerType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "start_time")
    private Instant startTime;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
