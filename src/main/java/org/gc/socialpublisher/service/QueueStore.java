package org.gc.socialpublisher.service;

import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.dto.QueueAddResult;
import org.gc.socialpublisher.exception.EntryNotFoundException;
import org.gc.socialpublisher.exception.QueueConflictException;
import org.gc.socialpublisher.exception.ScheduleValidationException;
import org.gc.socialpublisher.repository.QueueEntryRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

/**
 * Durable queue of scheduled entries. Every mutation goes through one monitor so that a removal
 * can never interleave with the runner claiming the same entry.
 */
@Slf4j
@Service
public class QueueStore {

    static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    public static final Comparator<QueueEntry> SCHEDULE_ORDER = Comparator
            .comparing(QueueEntry::getScheduledDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(QueueEntry::getScheduledTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(QueueEntry::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final QueueEntryRepository queueEntryRepository;
    private final Clock clock;
    private final IdSequence ids;
    private final Object monitor = new Object();

    public QueueStore(QueueEntryRepository queueEntryRepository, Clock clock) {
        this.queueEntryRepository = queueEntryRepository;
        this.clock = clock;
        this.ids = new IdSequence(() -> queueEntryRepository.findFirstByOrderByIdDesc()
                .map(QueueEntry::getId)
                .orElse(0L));
    }

    public QueueAddResult add(LocalDate date, String time, String topic, Integer template, int runsTotal) {
        if (date == null) {
            throw new ScheduleValidationException("scheduled_date required (YYYY-MM-DD)");
        }
        String normalizedTime = time == null || time.isBlank() ? null : time.trim();
        if (normalizedTime != null && !TIME_PATTERN.matcher(normalizedTime).matches()) {
            throw new ScheduleValidationException("Invalid time format (HH:MM)");
        }
        if (date.isBefore(LocalDate.now(clock))) {
            throw new ScheduleValidationException("Cannot schedule in the past: " + date);
        }
        String normalizedTopic = topic == null || topic.isBlank() ? null : topic.trim();

        synchronized (monitor) {
            String warning = null;
            boolean duplicate = queueEntryRepository.findByScheduledDate(date).stream()
                    .anyMatch(existing -> Objects.equals(existing.getScheduledTime(), normalizedTime));
            if (duplicate) {
                warning = "An entry already exists for " + date + (normalizedTime != null ? " " + normalizedTime : "");
                log.warn("Duplicate queue slot: {}", warning);
            }
            QueueEntry entry = QueueEntry.create(ids.next(), date, normalizedTime, normalizedTopic, template,
                    runsTotal, clock.instant());
            QueueEntry saved = queueEntryRepository.save(entry);
            log.info("Queued entry {} for {} {} (topic={})", saved.getId(), date,
                    normalizedTime != null ? normalizedTime : "(day slots)", normalizedTopic != null ? normalizedTopic : "auto");
            return new QueueAddResult(saved, warning);
        }
    }

    public void remove(Long id) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            if (entry.getStatus() != QueueEntry.Status.PENDING) {
                throw new QueueConflictException("Only pending entries can be removed (entry " + id
                        + " is " + entry.getStatus().wireName() + ")");
            }
            queueEntryRepository.deleteById(id);
            log.info("Removed queue entry {}", id);
        }
    }

    public Optional<QueueEntry> find(Long id) {
        return queueEntryRepository.findById(id);
    }

    public List<QueueEntry> listUpcoming(int windowDays) {
        LocalDate today = LocalDate.now(clock);
        return listBetween(today, today.plusDays(Math.max(0, windowDays)));
    }

    public List<QueueEntry> listWindow(int daysBack, int daysForward) {
        LocalDate today = LocalDate.now(clock);
        return listBetween(today.minusDays(Math.max(0, daysBack)), today.plusDays(Math.max(0, daysForward)));
    }

    public List<QueueEntry> listAll() {
        List<QueueEntry> entries = new ArrayList<>(StreamSupport
                .stream(queueEntryRepository.findAll().spliterator(), false)
                .toList());
        entries.sort(SCHEDULE_ORDER);
        return entries;
    }

    public List<QueueEntry> pending() {
        List<QueueEntry> entries = new ArrayList<>(queueEntryRepository.findByStatus(QueueEntry.Status.PENDING));
        entries.sort(SCHEDULE_ORDER);
        return entries;
    }

    /**
     * The only way an entry changes status. Stamps {@code startedAtUtc} when processing starts and
     * {@code completedAtUtc} on terminal states.
     */
    public QueueEntry transition(Long id, QueueEntry.Status target, String resultMessage) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            applyTransition(entry, target, resultMessage);
            return queueEntryRepository.save(entry);
        }
    }

    /**
     * Moves a pending entry to processing, failing if someone else changed it first.
     */
    public QueueEntry claim(Long id, int runsTotal) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            if (entry.getStatus() != QueueEntry.Status.PENDING) {
                throw new QueueConflictException("Entry " + id + " is no longer pending");
            }
            applyTransition(entry, QueueEntry.Status.PROCESSING, "Running");
            entry.setRunsTotal(Math.max(1, runsTotal));
            entry.setRetryAfterUtc(null);
            return queueEntryRepository.save(entry);
        }
    }

    public QueueEntry complete(Long id, Long postId, int runsCompleted, String message) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            entry.setPostId(postId);
            entry.setRunsCompleted(runsCompleted);
            entry.setRateLimitDeferrals(0);
            applyTransition(entry, QueueEntry.Status.COMPLETED, message);
            return queueEntryRepository.save(entry);
        }
    }

    /**
     * Returns a processing entry to pending: either to run the day's next slot or to retry after a
     * rate limit. {@code retryAfter} null means eligible as soon as its slot is due.
     */
    public QueueEntry requeue(Long id, Long postId, int runsCompleted, int deferrals, Instant retryAfter, String message) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            entry.setPostId(postId);
            entry.setRunsCompleted(runsCompleted);
            entry.setRateLimitDeferrals(deferrals);
            entry.setRetryAfterUtc(retryAfter);
            applyTransition(entry, QueueEntry.Status.PENDING, message);
            return queueEntryRepository.save(entry);
        }
    }

    public QueueEntry fail(Long id, Long postId, String message) {
        synchronized (monitor) {
            QueueEntry entry = require(id);
            if (postId != null) {
                entry.setPostId(postId);
            }
            applyTransition(entry, QueueEntry.Status.ERROR, message);
            return queueEntryRepository.save(entry);
        }
    }

    /**
     * Fails entries left processing longer than {@code threshold}, typically after an ungraceful
     * shutdown. They are not reset to pending: the publish may have gone through and reconciliation
     * decides that.
     */
    public List<QueueEntry> recoverStale(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<QueueEntry> recovered = new ArrayList<>();
        synchronized (monitor) {
            for (QueueEntry entry : queueEntryRepository.findByStatus(QueueEntry.Status.PROCESSING)) {
                Instant since = entry.getStartedAtUtc() != null ? entry.getStartedAtUtc() : entry.getUpdatedAtUtc();
                if (since != null && since.isAfter(cutoff)) {
                    continue;
                }
                log.warn("Failing queue entry {} stuck in processing since {}", entry.getId(), since);
                applyTransition(entry, QueueEntry.Status.ERROR,
                        "Interrupted: still processing after " + threshold.toMinutes() + " minutes (service restart?)");
                recovered.add(queueEntryRepository.save(entry));
            }
        }
        return recovered;
    }

    private List<QueueEntry> listBetween(LocalDate from, LocalDate to) {
        List<QueueEntry> entries = new ArrayList<>(queueEntryRepository.findByScheduledDateBetween(from, to));
        entries.sort(SCHEDULE_ORDER);
        return entries;
    }

    private QueueEntry require(Long id) {
        return queueEntryRepository.findById(id)
                .orElseThrow(() -> new EntryNotFoundException("Queue entry", id));
    }

    private void applyTransition(QueueEntry entry, QueueEntry.Status target, String resultMessage) {
        QueueEntry.Status current = entry.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new QueueConflictException("Queue entry " + entry.getId() + " cannot move from "
                    + (current == null ? "unknown" : current.wireName()) + " to " + target.wireName());
        }
        Instant now = clock.instant();
        entry.setStatus(target);
        if (resultMessage != null) {
            entry.setResultMessage(resultMessage);
        }
        if (target == QueueEntry.Status.PROCESSING) {
            entry.setStartedAtUtc(now);
        }
        if (target.isTerminal()) {
            entry.setCompletedAtUtc(now);
        }
        entry.setUpdatedAtUtc(now);
    }
}
