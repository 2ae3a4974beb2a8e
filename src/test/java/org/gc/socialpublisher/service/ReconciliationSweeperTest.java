package org.gc.socialpublisher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.gc.socialpublisher.domain.PostMetricsSnapshot;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.gc.socialpublisher.domain.dto.MediaMetrics;
import org.gc.socialpublisher.domain.dto.MediaStatus;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.domain.dto.SyncReport;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.gc.socialpublisher.support.InMemoryRepositories;
import org.gc.socialpublisher.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSweeperTest {

    @Mock
    private RemotePlatformService remotePlatformService;

    private Map<Long, PostRecord> postRows;
    private List<PostMetricsSnapshot> snapshots;
    private MutableClock clock;
    private PlatformProperties platformProperties;
    private ReconciliationSweeper sweeper;

    @BeforeEach
    void setUp() {
        postRows = new ConcurrentHashMap<>();
        snapshots = new ArrayList<>();
        clock = MutableClock.at(LocalDateTime.of(2026, 10, 19, 10, 0));
        platformProperties = new PlatformProperties();
        PostStore postStore = new PostStore(InMemoryRepositories.posts(postRows), InMemoryRepositories.snapshots(snapshots), clock);
        RecoveryMatcher matcher = new RecoveryMatcher(platformProperties);
        PublishService publishService = new PublishService(postStore, remotePlatformService, matcher,
                new PlatformErrorClassifier(new ObjectMapper()), new PipelineLease(clock), platformProperties, clock);
        sweeper = new ReconciliationSweeper(postStore, publishService, remotePlatformService, matcher,
                platformProperties, new SchedulerProperties(), clock);
    }

    @Test
    @DisplayName("A post that went live despite a local error is bound, and a second sweep finds nothing to fix")
    void recoversAndConverges() {
        PostRecord pending = store(post(1L, PostStatus.PUBLISH_ERROR, null, "Passkeys  explained\n in 5 slides"));
        pending.setLastPublishAttemptUtc(clock.instant().minus(Duration.ofMinutes(20)));
        RemoteMedia live = media("m-9", "passkeys explained in 5 slides", clock.instant().minus(Duration.ofMinutes(18)));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.listRecentMedia(anyInt())).thenReturn(List.of(live));
        when(remotePlatformService.getMediaStatus("m-9")).thenReturn(MediaStatus.ACTIVE);
        when(remotePlatformService.getMetrics("m-9")).thenReturn(metrics(40, 200));

        SyncReport first = sweeper.sweep(30, 35.0);

        assertThat(first.getPendingChecked()).isEqualTo(1);
        assertThat(first.getPendingReconciled()).isEqualTo(1);
        assertThat(first.getChecked()).isEqualTo(1);
        assertThat(first.getImportCreated()).isZero();
        assertThat(first.getImportExisting()).isEqualTo(1);
        assertThat(first.isPartial()).isFalse();
        PostRecord recovered = postRows.get(1L);
        assertThat(recovered.getStatus()).isEqualTo(PostStatus.PUBLISHED_ACTIVE);
        assertThat(recovered.getIgMediaId()).isEqualTo("m-9");
        assertThat(recovered.getLastErrorTag()).isNull();
        assertThat(recovered.getLikes()).isEqualTo(40);
        assertThat(recovered.getEngagementRate()).isEqualTo(20.0);

        SyncReport second = sweeper.sweep(30, 35.0);

        assertThat(second.getPendingReconciled()).isZero();
        assertThat(second.getDeleted()).isZero();
        assertThat(second.getImportCreated()).isZero();
        assertThat(postRows).hasSize(1);
        assertThat(snapshots).hasSize(2);
        assertThat(sweeper.lastReport()).contains(second);
    }

    @Test
    @DisplayName("Media missing on the platform marks the post deleted")
    void detectsDeletion() {
        platformProperties.setImportUnseen(false);
        store(post(1L, PostStatus.PUBLISHED_ACTIVE, "m-1", "Gone"));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.getMediaStatus("m-1")).thenReturn(MediaStatus.NOT_FOUND);

        SyncReport report = sweeper.sweep(null, null);

        assertThat(report.getDeleted()).isEqualTo(1);
        assertThat(report.getUpdated()).isEqualTo(1);
        assertThat(postRows.get(1L).getStatus()).isEqualTo(PostStatus.PUBLISHED_DELETED);
        verify(remotePlatformService, never()).getMetrics(anyString());
    }

    @Test
    @DisplayName("Running out of time reports the rest as remaining")
    void partialWhenOutOfTime() {
        platformProperties.setImportUnseen(false);
        store(post(1L, PostStatus.PUBLISHED_ACTIVE, "m-1", "One"));
        store(post(2L, PostStatus.PUBLISHED_ACTIVE, "m-2", "Two"));
        store(post(3L, PostStatus.PUBLISHED_ACTIVE, "m-3", "Three"));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.getMediaStatus(anyString())).thenReturn(MediaStatus.ACTIVE);
        when(remotePlatformService.getMetrics(anyString())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(6));
            return metrics(1, 10);
        });

        SyncReport report = sweeper.sweep(30, 10.0);

        assertThat(report.getChecked()).isEqualTo(2);
        assertThat(report.getRemaining()).isEqualTo(1);
        assertThat(report.isPartial()).isTrue();
        assertThat(report.getElapsedSeconds()).isEqualTo(12.0);
    }

    @Test
    void limitCapsTheRecordsChecked() {
        platformProperties.setImportUnseen(false);
        store(post(1L, PostStatus.PUBLISHED_ACTIVE, "m-1", "One"));
        store(post(2L, PostStatus.PUBLISHED_ACTIVE, "m-2", "Two"));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.getMediaStatus(anyString())).thenReturn(MediaStatus.ACTIVE);
        when(remotePlatformService.getMetrics(anyString())).thenReturn(metrics(1, 10));

        SyncReport report = sweeper.sweep(1, null);

        assertThat(report.getChecked()).isEqualTo(1);
        assertThat(report.getRemaining()).isEqualTo(1);
        assertThat(report.isPartial()).isTrue();
    }

    @Test
    @DisplayName("A rate limit stops the sweep early")
    void rateLimitHaltsSweep() {
        platformProperties.setImportUnseen(false);
        store(post(1L, PostStatus.PUBLISHED_ACTIVE, "m-1", "One"));
        store(post(2L, PostStatus.PUBLISHED_ACTIVE, "m-2", "Two"));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.getMediaStatus("m-1"))
                .thenThrow(new RateLimitException("media status m-1 failed: limit", "4", 60L, null));

        SyncReport report = sweeper.sweep(30, null);

        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getRemaining()).isEqualTo(1);
        assertThat(report.isPartial()).isTrue();
        assertThat(report.getErrors()).hasSize(1);
        assertThat(postRows.get(1L).getIgLastCheckedAtUtc()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Remote posts without a local record are imported once")
    void importsUnseenMedia() {
        store(post(1L, PostStatus.PUBLISHED_ACTIVE, "m-1", "Known"));
        when(remotePlatformService.isConfigured()).thenReturn(true);
        when(remotePlatformService.getMediaStatus("m-1")).thenReturn(MediaStatus.ACTIVE);
        when(remotePlatformService.getMetrics("m-1")).thenReturn(metrics(5, 50));
        when(remotePlatformService.listRecentMedia(anyInt())).thenReturn(List.of(
                media("m-1", "Known", clock.instant().minus(Duration.ofDays(2))),
                media("m-2", "Posted from the phone", clock.instant().minus(Duration.ofDays(1)))));

        SyncReport report = sweeper.sweep(30, null);

        assertThat(report.getImportCreated()).isEqualTo(1);
        assertThat(report.getImportExisting()).isEqualTo(1);
        PostRecord imported = postRows.values().stream()
                .filter(post -> "m-2".equals(post.getIgMediaId()))
                .findFirst()
                .orElseThrow();
        assertThat(imported.getOrigin()).isEqualTo(PostRecord.Origin.IMPORTED);
        assertThat(imported.getStatus()).isEqualTo(PostStatus.PUBLISHED_ACTIVE);
        assertThat(imported.getId()).isEqualTo(2L);
    }

    @Test
    void unconfiguredPlatformReportsError() {
        SyncReport report = sweeper.sweep(null, null);

        assertThat(report.getErrors()).hasSize(1);
        assertThat(report.getChecked()).isZero();
        verify(remotePlatformService, never()).listRecentMedia(anyInt());
    }

    @Test
    @DisplayName("A sweep requested while one runs returns immediately")
    void concurrentSweepIsRejected() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(remotePlatformService.isConfigured()).thenAnswer(invocation -> {
            inside.countDown();
            release.await(5, TimeUnit.SECONDS);
            return false;
        });
        CompletableFuture<SyncReport> first = CompletableFuture.supplyAsync(() -> sweeper.sweep(null, null));
        assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();

        SyncReport second = sweeper.sweep(null, null);
        release.countDown();

        assertThat(second.isAlreadyRunning()).isTrue();
        assertThat(second.isPartial()).isTrue();
        assertThat(first.get(5, TimeUnit.SECONDS).isAlreadyRunning()).isFalse();
        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void syncRemoteClampsTheLimit() {
        StepVerifier.create(sweeper.syncRemote(500, null))
                .assertNext(report -> assertThat(report.getErrors()).isNotEmpty())
                .verifyComplete();
        assertThat(sweeper.clampLimit(500)).isEqualTo(200);
        assertThat(sweeper.clampLimit(0)).isEqualTo(1);
        assertThat(sweeper.clampLimit(null)).isEqualTo(40);
    }

    private PostRecord store(PostRecord post) {
        postRows.put(post.getId(), post);
        return post;
    }

    private PostRecord post(Long id, PostStatus status, String mediaId, String caption) {
        Instant created = clock.instant().minus(Duration.ofHours(1));
        return PostRecord.builder()
                .id(id)
                .caption(caption)
                .status(status)
                .origin(PostRecord.Origin.PIPELINE)
                .igMediaId(mediaId)
                .publishAttempts(1)
                .createdAtUtc(created)
                .updatedAtUtc(created)
                .build();
    }

    private static RemoteMedia media(String id, String caption, Instant timestamp) {
        return RemoteMedia.builder()
                .id(id)
                .caption(caption)
                .timestamp(timestamp)
                .mediaType("CAROUSEL_ALBUM")
                .mediaProductType("FEED")
                .permalink("https://www.instagram.com/p/" + id)
                .build();
    }

    private static MediaMetrics metrics(int likes, int reach) {
        return MediaMetrics.builder()
                .likes(likes)
                .comments(0)
                .reach(reach)
                .impressions(reach * 2)
                .saves(0)
                .shares(0)
                .build();
    }
}
