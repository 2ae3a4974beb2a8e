package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "publisher.scheduler.loop-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerLoop {

    private final SchedulerService schedulerService;

    /**
     * Entries still processing after a restart belong to a run that no longer exists.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        try {
            schedulerService.recoverStale();
        } catch (RuntimeException e) {
            log.error("Startup recovery of stale queue entries failed: {}", e.getMessage());
        }
    }

    /**
     * Runs the earliest due queue entry, if any.
     */
    @Scheduled(fixedRateString = "${publisher.scheduler.tick-interval-ms:60000}")
    public void runDueEntries() {
        log.debug("Running scheduler tick");

        schedulerService.tick()
                .doOnSuccess(v -> log.debug("Scheduler tick completed"))
                .doOnError(error -> log.error("Error in scheduler tick: {}", error.getMessage()))
                .subscribe();
    }

    /**
     * Reconciles local post records with the platform.
     */
    @Scheduled(fixedRateString = "${publisher.scheduler.sync-interval-ms:1800000}",
            initialDelayString = "${publisher.scheduler.sync-initial-delay-ms:120000}")
    public void reconcileWithPlatform() {
        log.debug("Running reconciliation sweep");

        schedulerService.sweep(null, null)
                .doOnSuccess(report -> log.debug("Reconciliation sweep completed"))
                .doOnError(error -> log.error("Error in reconciliation sweep: {}", error.getMessage()))
                .subscribe();
    }
}
