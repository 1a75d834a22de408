package com.pipelineops.compensation.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wiring for the missed trigger compensation job.
 * <p>
 * The job only exists when both the scheduler and the compensation job are enabled.
 */
@Configuration
public class CompensationConfig {

    public static final String COMPENSATION_JOB_ENABLED =
            "${scheduler.enabled:false} and ${scheduler.compensation-job.enabled:false}";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Dedicated thread for the readiness poller so startup is never blocked.
     */
    @Bean(destroyMethod = "dispose")
    @ConditionalOnExpression(COMPENSATION_JOB_ENABLED)
    public Scheduler compensationScheduler() {
        return Schedulers.newSingle("compensation-poller", true);
    }
}
