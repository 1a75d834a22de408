package com.pipelineops.compensation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pipeline Trigger Compensation Service
 * <p>
 * On startup, finds pipeline cron triggers that should have fired while the scheduler
 * was unavailable (deploy, restart, crash) and fires them once.
 * <p>
 * Key Features:
 * - Waits for the pipeline cache before doing anything
 * - Single compensation pass per process
 * - Resilient pipeline starts with retry and circuit breaker
 * - Metrics and logging for every failure path
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class TriggerCompensationApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriggerCompensationApplication.class, args);
    }
}
