package com.pipelineops.compensation.service;

import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.entity.Trigger;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the cron triggers that take part in compensation.
 * All methods preserve input order.
 */
public final class TriggerFilter {

    private TriggerFilter() {
    }

    /**
     * Enabled CRON triggers of pipelines that are not disabled.
     */
    public static List<Trigger> getEnabledCronTriggers(Collection<Pipeline> pipelines) {
        return pipelines.stream()
                .filter(pipeline -> !pipeline.isDisabled())
                .filter(pipeline -> pipeline.getTriggers() != null)
                .flatMap(pipeline -> pipeline.getTriggers().stream())
                .filter(Objects::nonNull)
                .filter(trigger -> trigger.isEnabled() && trigger.isCron())
                .collect(Collectors.toList());
    }

    /**
     * Ids of non-disabled pipelines owning at least one of the given triggers.
     * These are the pipeline configs whose latest executions need to be looked up.
     */
    public static List<String> getPipelineConfigIds(Collection<Pipeline> pipelines,
                                                    Collection<Trigger> cronTriggers) {
        return pipelines.stream()
                .filter(pipeline -> !pipeline.isDisabled())
                .filter(pipeline -> cronTriggers.stream().anyMatch(pipeline::ownsTrigger))
                .map(Pipeline::getId)
                .collect(Collectors.toList());
    }

    public static Optional<Pipeline> findOwningPipeline(Collection<Pipeline> pipelines, Trigger trigger) {
        return pipelines.stream()
                .filter(pipeline -> pipeline.ownsTrigger(trigger))
                .findFirst();
    }
}
