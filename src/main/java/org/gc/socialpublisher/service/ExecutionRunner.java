package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.dto.ProducedContent;
import org.gc.socialpublisher.exception.EntryNotFoundException;
import org.gc.socialpublisher.exception.PipelineFailureException;
import org.gc.socialpublisher.exception.QueueConflictException;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Single-flight worker: picks the earliest due pending entry, produces and publishes its content
 * and writes the outcome back to the queue. Holds the {@link PipelineLease} for the whole run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionRunner {

    static final String LEASE_LABEL = "scheduled run";
    private static final DateTimeFormatter RETRY_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final QueueStore queueStore;
    private final PostStore postStore;
    private final ScheduleConfigService scheduleConfigService;
    private final ContentPipelineService contentPipelineService;
    private final PublishService publishService;
    private final PlatformErrorClassifier errorClassifier;
    private final PipelineLease pipelineLease;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Runs at most one due entry. A call made while another run holds the lease completes
     * immediately without touching the queue. Failures end up on the entry, never in the returned Mono.
     */
    public Mono<Void> runDue() {
        return Mono.defer(() -> {
            Optional<String> token = pipelineLease.tryAcquire(LEASE_LABEL);
            if (token.isEmpty()) {
                log.debug("Pipeline already running, skipping this tick");
                return Mono.empty();
            }
            return Mono.fromRunnable(this::runOnce)
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorResume(error -> {
                        log.error("Queue run aborted: {}", error.getMessage(), error);
                        return Mono.empty();
                    })
                    .doFinally(signal -> pipelineLease.release(token.get()))
                    .then();
        });
    }

    /**
     * Blocking body of a run. The caller must hold the lease. Returns the entry that was executed,
     * or null when nothing was due.
     */
    QueueEntry runOnce() {
        ScheduleConfig config = scheduleConfigService.current();
        if (!config.isEnabled()) {
            return null;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        QueueEntry due = selectDue(config, now);
        if (due == null) {
            return null;
        }
        DaySchedule day = config.dayFor(due.getScheduledDate());
        List<LocalTime> slots = RecurrenceCalculator.slotsOf(due, day);

        QueueEntry claimed;
        try {
            claimed = queueStore.claim(due.getId(), slots.size());
        } catch (QueueConflictException | EntryNotFoundException e) {
            log.info("Entry {} changed before it could be claimed: {}", due.getId(), e.getMessage());
            return null;
        }
        log.info("Running queue entry {} ({} {}, run {}/{})", claimed.getId(), claimed.getScheduledDate(),
                RecurrenceCalculator.formatTime(slots.get(Math.min(claimed.completedRuns(), slots.size() - 1))),
                claimed.completedRuns() + 1, slots.size());
        return execute(claimed, slots);
    }

    private QueueEntry selectDue(ScheduleConfig config, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        Instant instant = now.toInstant();
        QueueEntry selected = null;
        LocalTime selectedSlot = null;

        for (QueueEntry entry : queueStore.pending()) {
            LocalDate date = entry.getScheduledDate();
            if (date == null || date.isAfter(today)) {
                continue;
            }
            if (date.isBefore(today)) {
                queueStore.transition(entry.getId(), QueueEntry.Status.SKIPPED, "Missed: its slot passed without a run");
                continue;
            }
            DaySchedule day = config.dayFor(date);
            if (!day.isEnabled()) {
                queueStore.transition(entry.getId(), QueueEntry.Status.SKIPPED, "Skipped: day disabled in the schedule");
                continue;
            }
            LocalTime slot = RecurrenceCalculator.nextSlotOf(entry, day);
            if (slot == null) {
                queueStore.transition(entry.getId(), QueueEntry.Status.SKIPPED, "Skipped: no remaining slots for the day");
                continue;
            }
            if (entry.getRetryAfterUtc() != null && entry.getRetryAfterUtc().isAfter(instant)) {
                continue;
            }
            if (slot.isAfter(now.toLocalTime())) {
                continue;
            }
            if (selected == null || slot.isBefore(selectedSlot)
                    || (slot.equals(selectedSlot) && entry.getId() < selected.getId())) {
                selected = entry;
                selectedSlot = slot;
            }
        }
        return selected;
    }

    private QueueEntry execute(QueueEntry entry, List<LocalTime> slots) {
        Long postId = entry.getPostId();
        int runsTotal = slots.size();
        try {
            Optional<PostRecord> unfinished = postStore.find(postId).filter(post -> post.getStatus().isRetryable());
            boolean published;
            if (unfinished.isPresent()) {
                log.info("Resuming publish of post {} for entry {}", postId, entry.getId());
                publishService.resume(postId);
                published = true;
            } else {
                boolean publish = properties.isAutoPublish();
                ProducedContent content = contentPipelineService
                        .produce(entry.getTopic(), entry.getTemplate(), publish)
                        .block();
                if (content == null) {
                    throw new PipelineFailureException("Content pipeline returned nothing");
                }
                PostRecord post = postStore.createFromPipeline(content, entry.getTemplate(), entry.getId(),
                        publish ? PostStatus.GENERATED : PostStatus.DRAFT);
                postId = post.getId();
                if (publish) {
                    publishService.publishNow(post);
                }
                published = publish;
            }

            int runsCompleted = entry.completedRuns() + 1;
            String verb = published ? "Published" : "Draft generated";
            if (runsCompleted < runsTotal) {
                String next = RecurrenceCalculator.formatTime(slots.get(runsCompleted));
                return queueStore.requeue(entry.getId(), postId, runsCompleted, 0, null,
                        verb + " " + runsCompleted + "/" + runsTotal + ". Next slot: " + next);
            }
            String message = runsTotal > 1 ? verb + " " + runsCompleted + "/" + runsTotal : verb;
            log.info("Queue entry {} completed: {} (post {})", entry.getId(), message, postId);
            return queueStore.complete(entry.getId(), postId, runsCompleted, message);
        } catch (RateLimitException rateLimit) {
            return defer(entry, postId, rateLimit);
        } catch (RuntimeException error) {
            PlatformErrorClassifier.PlatformError classified = errorClassifier.classify(error);
            log.error("Queue entry {} failed [{}]: {}", entry.getId(), classified.getTag(), error.getMessage());
            return queueStore.fail(entry.getId(), postId, classified.getSummary());
        }
    }

    /**
     * Rate limits are recoverable: the entry goes back to pending with an exponential backoff
     * until the deferral budget is used up.
     */
    private QueueEntry defer(QueueEntry entry, Long postId, RateLimitException rateLimit) {
        int deferrals = entry.deferrals() + 1;
        if (deferrals > properties.getMaxRateLimitDeferrals()) {
            log.error("Queue entry {} still rate limited after {} deferrals, giving up", entry.getId(), entry.deferrals());
            return queueStore.fail(entry.getId(), postId,
                    "Rate limited by the platform " + deferrals + " times in a row. Retry later.");
        }
        long backoffMinutes = properties.getRateLimitBackoffMinutes() * (1L << (deferrals - 1));
        if (rateLimit.getRetryAfterSeconds() != null) {
            backoffMinutes = Math.max(backoffMinutes, (rateLimit.getRetryAfterSeconds() + 59) / 60);
        }
        Instant retryAfter = clock.instant().plus(Duration.ofMinutes(backoffMinutes));
        String retryAt = RETRY_FORMAT.format(retryAfter.atZone(clock.getZone()));
        log.warn("Queue entry {} rate limited, deferring to {} (deferral {}/{})", entry.getId(), retryAt,
                deferrals, properties.getMaxRateLimitDeferrals());
        return queueStore.requeue(entry.getId(), postId, entry.completedRuns(), deferrals, retryAfter,
                "Rate limited by the platform. Retrying after " + retryAt);
    }
}
