package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.dto.AutoFillResult;
import org.gc.socialpublisher.domain.dto.NextRun;
import org.gc.socialpublisher.domain.dto.QueueAddResult;
import org.gc.socialpublisher.domain.dto.QueueEntryRequest;
import org.gc.socialpublisher.domain.dto.ScheduleConfigRequest;
import org.gc.socialpublisher.domain.dto.SchedulerState;
import org.gc.socialpublisher.domain.dto.SyncReport;
import org.gc.socialpublisher.exception.ScheduleValidationException;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Composition root of the scheduling engine: the state the dashboard polls, the operator actions,
 * and the periodic tick and sweep invoked by {@link SchedulerLoop}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerService {

    private final ScheduleConfigService scheduleConfigService;
    private final QueueStore queueStore;
    private final AutoFillPlanner autoFillPlanner;
    private final RecurrenceCalculator recurrenceCalculator;
    private final ExecutionRunner executionRunner;
    private final ReconciliationSweeper reconciliationSweeper;
    private final QuotaTracker quotaTracker;
    private final PipelineLease pipelineLease;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final AtomicReference<Instant> lastTickAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastSweepAt = new AtomicReference<>();

    public Mono<SchedulerState> state() {
        return Mono.fromCallable(this::snapshot)
                .subscribeOn(Schedulers.boundedElastic());
    }

    SchedulerState snapshot() {
        ScheduleConfig config = scheduleConfigService.current();
        List<QueueEntry> queue = queueStore.listWindow(properties.getStateDaysBack(), properties.getStateDaysForward());
        Optional<PipelineLease.Holder> holder = pipelineLease.current();
        return SchedulerState.builder()
                .config(config)
                .queue(queue)
                .nextRun(nextRun(config, queue))
                .pipelineRunning(holder.isPresent())
                .pipelineLabel(holder.map(PipelineLease.Holder::getLabel).orElse(null))
                .pipelineStartedAt(holder.map(PipelineLease.Holder::getAcquiredAt).orElse(null))
                .timezone(clock.getZone().getId())
                .rateLimit(quotaTracker.current())
                .lastTickAt(lastTickAt.get())
                .lastSweepAt(lastSweepAt.get())
                .lastSweep(reconciliationSweeper.lastReport().orElse(null))
                .pollIntervalSeconds(properties.getPollIntervalSeconds())
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Null while scheduling is globally disabled.
     */
    public NextRun nextRun(ScheduleConfig config, List<QueueEntry> queue) {
        if (!config.isEnabled()) {
            return null;
        }
        return recurrenceCalculator.nextRun(config, ZonedDateTime.now(clock), queue);
    }

    public Mono<ScheduleConfig> saveConfig(ScheduleConfigRequest request) {
        return Mono.fromCallable(() -> scheduleConfigService.save(request));
    }

    public Mono<QueueAddResult> addEntry(QueueEntryRequest request) {
        return Mono.fromCallable(() -> {
            LocalDate date = parseDate(request.getScheduledDate());
            String time = request.getScheduledTime() == null || request.getScheduledTime().isBlank()
                    ? null : request.getScheduledTime().trim();
            boolean manualTopic = request.getTopic() != null && !request.getTopic().isBlank();
            int runsTotal = 1;
            if (time == null && !manualTopic) {
                DaySchedule day = scheduleConfigService.current().dayFor(date);
                runsTotal = Math.max(1, day.slots().size());
            }
            return queueStore.add(date, time, request.getTopic(), request.getTemplate(), runsTotal);
        });
    }

    public Mono<Void> removeEntry(Long id) {
        return Mono.fromRunnable(() -> queueStore.remove(id));
    }

    public Mono<AutoFillResult> autoFill(Integer days) {
        return Mono.fromCallable(() -> autoFillPlanner.autoFill(scheduleConfigService.current(), days));
    }

    /**
     * One scheduler tick: fail interrupted entries if nothing is running, then run whatever is due.
     */
    public Mono<Void> tick() {
        return Mono.fromRunnable(() -> {
                    lastTickAt.set(clock.instant());
                    if (!pipelineLease.isHeld()) {
                        recoverStale();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then(executionRunner.runDue());
    }

    public Mono<SyncReport> sweep(Integer limit, Double maxSeconds) {
        return reconciliationSweeper.syncRemote(limit, maxSeconds)
                .doOnSuccess(report -> {
                    if (report != null && !report.isAlreadyRunning()) {
                        lastSweepAt.set(clock.instant());
                    }
                });
    }

    public List<QueueEntry> recoverStale() {
        List<QueueEntry> recovered = queueStore.recoverStale(Duration.ofMinutes(properties.getStaleProcessingMinutes()));
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} interrupted queue entries", recovered.size());
        }
        return recovered;
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null) {
            throw new ScheduleValidationException("scheduled_date required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ScheduleValidationException("scheduled_date required (YYYY-MM-DD)");
        }
    }
}
