package com.pipelineops.compensation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A pipeline definition (pipeline config) and its ordered triggers.
 * <p>
 * The id is the pipeline config id that executions refer to.
 */
@Entity
@Table(name = "pipelines", indexes = {
        @Index(name = "idx_pipeline_application", columnList = "application")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pipeline {

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 100)
    private String application;

    @Column(length = 200)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean disabled = false;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "pipeline_id")
    @OrderColumn(name = "trigger_order")
    @Builder.Default
    private List<Trigger> triggers = new ArrayList<>();

    public boolean ownsTrigger(Trigger trigger) {
        if (triggers == null || trigger == null) {
            return false;
        }
        // an @OrderColumn gap loads as a null element
        return triggers.stream()
                .filter(Objects::nonNull)
                .anyMatch(t -> Objects.equals(t.getId(), trigger.getId()));
    }
}
