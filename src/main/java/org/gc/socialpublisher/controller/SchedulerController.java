package org.gc.socialpublisher.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.dto.AutoFillRequest;
import org.gc.socialpublisher.domain.dto.AutoFillResult;
import org.gc.socialpublisher.domain.dto.QueueEntryRequest;
import org.gc.socialpublisher.domain.dto.ScheduleConfigRequest;
import org.gc.socialpublisher.domain.dto.SchedulerState;
import org.gc.socialpublisher.domain.dto.StatusResponse;
import org.gc.socialpublisher.service.SchedulerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final SchedulerService schedulerService;

    /**
     * Composite state polled by the dashboard: config, queue window, next run, pipeline lease,
     * quota and last tick/sweep timestamps.
     *
     * Example:
     * GET /api/scheduler
     */
    @GetMapping
    public Mono<ResponseEntity<SchedulerState>> getState() {
        return schedulerService.state()
                .map(ResponseEntity::ok);
    }

    /**
     * Replaces the weekly schedule.
     *
     * Example:
     * POST /api/scheduler/config
     * {
     *   "enabled": true,
     *   "schedule": { "tuesday": { "enabled": true, "posts_per_day": 2, "times": ["08:30", "20:00"] } }
     * }
     */
    @PostMapping("/config")
    public Mono<ResponseEntity<ScheduleConfig>> saveConfig(@RequestBody ScheduleConfigRequest request) {
        log.info("Received scheduler config update: enabled={}", request.isEnabled());
        return schedulerService.saveConfig(request)
                .map(ResponseEntity::ok);
    }

    /**
     * Example:
     * POST /api/scheduler/queue
     * { "scheduled_date": "2026-10-21", "scheduled_time": "20:00", "topic": "Passkeys explained" }
     */
    @PostMapping("/queue")
    public Mono<ResponseEntity<Map<String, Object>>> addEntry(@Valid @RequestBody QueueEntryRequest request) {
        log.info("Received queue entry for {} {}", request.getScheduledDate(),
                request.getScheduledTime() != null ? request.getScheduledTime() : "");
        return schedulerService.addEntry(request)
                .map(result -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("entry", result.getEntry());
                    if (result.getWarning() != null) {
                        body.put("warning", result.getWarning());
                    }
                    return ResponseEntity.status(HttpStatus.CREATED).body(body);
                });
    }

    @DeleteMapping("/queue/{id}")
    public Mono<ResponseEntity<StatusResponse>> removeEntry(@PathVariable Long id) {
        log.info("Received request to remove queue entry {}", id);
        return schedulerService.removeEntry(id)
                .then(Mono.just(ResponseEntity.ok(StatusResponse.success("Queue entry " + id + " removed"))));
    }

    /**
     * Example:
     * POST /api/scheduler/queue/auto-fill
     * { "days": 7 }
     */
    @PostMapping("/queue/auto-fill")
    public Mono<ResponseEntity<AutoFillResult>> autoFill(@RequestBody(required = false) AutoFillRequest request) {
        Integer days = request != null ? request.getDays() : null;
        log.info("Received auto-fill request for {} days", days != null ? days : "default");
        return schedulerService.autoFill(days)
                .map(ResponseEntity::ok);
    }

    /**
     * Runs one scheduler tick now. Answers 202 because the run continues in the background.
     */
    @PostMapping("/run-due")
    public ResponseEntity<StatusResponse> runDue() {
        log.info("Received request to run due queue entries");

        schedulerService.tick()
                .doOnError(error -> log.error("Manual scheduler tick failed: {}", error.getMessage()))
                .subscribe();

        return ResponseEntity.accepted()
                .body(StatusResponse.success("Scheduler tick started"));
    }
}
