package com.pipelineops.compensation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A trigger declared on a pipeline definition.
 * <p>
 * The id is unique across all pipelines, so a trigger can be matched back
 * to its owning pipeline by id alone.
 */
@Entity
@Table(name = "pipeline_triggers", indexes = {
        @Index(name = "idx_trigger_type", columnList = "type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trigger {

    @Id
    @Column(length = 100)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TriggerType type;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Quartz syntax, e.g. {@code 0 0 * * * ?}. Only set for CRON triggers.
     */
    @Column(name = "cron_expression", length = 120)
    private String cronExpression;

    public boolean isCron() {
        return type == TriggerType.CRON;
    }
}
