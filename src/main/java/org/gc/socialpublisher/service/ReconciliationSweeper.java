package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.dto.MediaMetrics;
import org.gc.socialpublisher.domain.dto.MediaStatus;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.domain.dto.SyncReport;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Time-boxed cross-check of local post records against the platform:
 * recovery of unknown publish outcomes, metrics refresh with deletion detection, and import of
 * remote posts with no local record. The deadline is checked between records, never mid-call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationSweeper {

    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 200;

    private final PostStore postStore;
    private final PublishService publishService;
    private final RemotePlatformService remotePlatformService;
    private final RecoveryMatcher recoveryMatcher;
    private final PlatformProperties platformProperties;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SyncReport> lastReport = new AtomicReference<>();

    public Mono<SyncReport> syncRemote(Integer limit, Double maxSeconds) {
        return Mono.fromCallable(() -> sweep(limit, maxSeconds))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Optional<SyncReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public SyncReport sweep(Integer requestedLimit, Double requestedMaxSeconds) {
        if (!running.compareAndSet(false, true)) {
            log.info("Reconciliation sweep already in progress");
            return SyncReport.builder()
                    .alreadyRunning(true)
                    .partial(true)
                    .finishedAtUtc(clock.instant())
                    .build();
        }
        try {
            SyncReport report = doSweep(clampLimit(requestedLimit), maxSeconds(requestedMaxSeconds));
            lastReport.set(report);
            return report;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private SyncReport doSweep(int limit, double maxSeconds) {
        Instant start = clock.instant();
        Instant deadline = start.plusMillis((long) (maxSeconds * 1000));
        SyncReport report = SyncReport.builder().build();

        if (!remotePlatformService.isConfigured()) {
            report.addError(null, null, "Platform credentials are not configured");
            return finish(report, start);
        }

        int processed = 0;
        boolean halted = false;
        List<RemoteMedia> recent = null;
        Set<String> bound = postStore.boundMediaIds();

        List<PostRecord> pending = postStore.recoveryCandidates().stream()
                .filter(post -> recoveryMatcher.isRecoverable(post, start))
                .filter(post -> !publishService.isPublishing(post.getId()))
                .toList();
        int pendingDone = 0;
        if (!pending.isEmpty()) {
            try {
                recent = remotePlatformService.listRecentMedia(platformProperties.getRecentMediaLimit());
            } catch (RuntimeException error) {
                report.setFailed(report.getFailed() + 1);
                report.addError(null, null, "Recent media lookup failed: " + error.getMessage());
                halted = error instanceof RateLimitException;
            }
        }
        if (recent != null) {
            for (PostRecord post : pending) {
                if (processed >= limit || !clock.instant().isBefore(deadline)) {
                    break;
                }
                processed++;
                pendingDone++;
                if (publishService.isPublishing(post.getId())) {
                    // the publish call owns the post until it returns
                    continue;
                }
                report.setPendingChecked(report.getPendingChecked() + 1);
                try {
                    Optional<PostRecord> recovered = publishService.recover(post, recent, bound);
                    if (recovered.isPresent()) {
                        bound.add(recovered.get().getIgMediaId());
                        report.setPendingReconciled(report.getPendingReconciled() + 1);
                        report.setUpdated(report.getUpdated() + 1);
                    }
                } catch (RuntimeException error) {
                    report.setFailed(report.getFailed() + 1);
                    report.addError(post.getId(), null, error.getMessage());
                }
            }
        }

        List<PostRecord> active = postStore.activeByCheckAge();
        int activeDone = 0;
        for (PostRecord post : active) {
            if (halted || processed >= limit || !clock.instant().isBefore(deadline)) {
                break;
            }
            processed++;
            activeDone++;
            report.setChecked(report.getChecked() + 1);
            try {
                refresh(post, report);
            } catch (RuntimeException error) {
                report.setFailed(report.getFailed() + 1);
                report.addError(post.getId(), post.getIgMediaId(), error.getMessage());
                postStore.markChecked(post.getId());
                if (error instanceof RateLimitException) {
                    log.warn("Sweep stopped by platform rate limit after {} records", processed);
                    halted = true;
                }
            }
        }

        int remaining = (pending.size() - pendingDone) + (active.size() - activeDone);
        report.setRemaining(remaining);
        boolean outOfTime = !clock.instant().isBefore(deadline);

        if (platformProperties.isImportUnseen() && !halted && !outOfTime) {
            importUnseen(recent, bound, report);
        }
        report.setPartial(report.isPartial() || remaining > 0 || halted || (platformProperties.isImportUnseen() && outOfTime));
        return finish(report, start);
    }

    private void refresh(PostRecord post, SyncReport report) {
        MediaStatus status = remotePlatformService.getMediaStatus(post.getIgMediaId());
        if (status == MediaStatus.NOT_FOUND) {
            postStore.markDeleted(post.getId());
            report.setDeleted(report.getDeleted() + 1);
            report.setUpdated(report.getUpdated() + 1);
            log.info("Post {} was deleted on the platform (media {})", post.getId(), post.getIgMediaId());
            return;
        }
        MediaMetrics metrics = remotePlatformService.getMetrics(post.getIgMediaId());
        postStore.applyMetrics(post.getId(), metrics);
        report.setUpdated(report.getUpdated() + 1);
    }

    private void importUnseen(List<RemoteMedia> alreadyFetched, Set<String> bound, SyncReport report) {
        List<RemoteMedia> recent = alreadyFetched;
        try {
            if (recent == null) {
                recent = remotePlatformService.listRecentMedia(platformProperties.getRecentMediaLimit());
            }
        } catch (RuntimeException error) {
            report.setFailed(report.getFailed() + 1);
            report.addError(null, null, "Import lookup failed: " + error.getMessage());
            return;
        }
        for (RemoteMedia media : recent) {
            if (publishService.hasPublishInFlight()) {
                log.info("Publish in progress, leaving the import of unseen media to the next sweep");
                report.setPartial(true);
                return;
            }
            if (media.getId() == null) {
                continue;
            }
            if (bound.contains(media.getId()) || postStore.findByMediaId(media.getId()).isPresent()) {
                report.setImportExisting(report.getImportExisting() + 1);
                continue;
            }
            postStore.createImported(media);
            bound.add(media.getId());
            report.setImportCreated(report.getImportCreated() + 1);
        }
    }

    private SyncReport finish(SyncReport report, Instant start) {
        Instant end = clock.instant();
        report.setElapsedSeconds(Math.round(Duration.between(start, end).toMillis() / 10.0) / 100.0);
        report.setFinishedAtUtc(end);
        log.info("Sweep finished in {}s: checked={}, updated={}, deleted={}, failed={}, pending_reconciled={}, "
                        + "import_created={}, remaining={}, partial={}",
                report.getElapsedSeconds(), report.getChecked(), report.getUpdated(), report.getDeleted(),
                report.getFailed(), report.getPendingReconciled(), report.getImportCreated(), report.getRemaining(),
                report.isPartial());
        return report;
    }

    int clampLimit(Integer requested) {
        int limit = requested == null ? schedulerProperties.getSyncLimit() : requested;
        return Math.max(MIN_LIMIT, Math.min(limit, MAX_LIMIT));
    }

    private double maxSeconds(Double requested) {
        if (requested == null || requested <= 0) {
            return schedulerProperties.getSyncMaxSeconds();
        }
        return requested;
    }
}
