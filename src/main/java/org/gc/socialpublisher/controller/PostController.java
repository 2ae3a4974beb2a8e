package org.gc.socialpublisher.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.PostMetricsSnapshot;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.dto.PublishResult;
import org.gc.socialpublisher.domain.dto.RateLimitSnapshot;
import org.gc.socialpublisher.domain.dto.SyncReport;
import org.gc.socialpublisher.domain.dto.SyncRequest;
import org.gc.socialpublisher.service.PostStore;
import org.gc.socialpublisher.service.PublishService;
import org.gc.socialpublisher.service.QuotaTracker;
import org.gc.socialpublisher.service.SchedulerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
public class PostController {

    static final int DEFAULT_SYNC_LIMIT = 30;

    private final PostStore postStore;
    private final PublishService publishService;
    private final QuotaTracker quotaTracker;
    private final SchedulerService schedulerService;

    @GetMapping
    public Mono<ResponseEntity<List<PostRecord>>> listPosts(@RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> postStore.listRecent(limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/metrics")
    public Mono<ResponseEntity<List<PostMetricsSnapshot>>> metricsHistory(@PathVariable Long id) {
        return Mono.fromCallable(() -> postStore.metricsHistory(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * Publishes in the trailing 24 hours against the platform limit.
     *
     * Example:
     * GET /api/posts/rate-limit
     */
    @GetMapping("/rate-limit")
    public Mono<ResponseEntity<RateLimitSnapshot>> rateLimit() {
        return Mono.fromCallable(quotaTracker::current)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/publish")
    public Mono<ResponseEntity<PublishResult>> publish(@PathVariable Long id) {
        log.info("Received request to publish post {}", id);
        return publishService.publish(id)
                .map(ResponseEntity::ok);
    }

    /**
     * Looks the post up on the platform first and only publishes again when it is not live.
     */
    @PostMapping("/{id}/retry-publish")
    public Mono<ResponseEntity<PublishResult>> retryPublish(@PathVariable Long id) {
        log.info("Received request to retry publishing post {}", id);
        return publishService.retryPublish(id)
                .map(ResponseEntity::ok);
    }

    /**
     * Example:
     * POST /api/posts/sync-instagram
     * { "limit": 30, "max_seconds": 35 }
     */
    @PostMapping("/sync-instagram")
    public Mono<ResponseEntity<SyncReport>> syncRemote(@RequestBody(required = false) SyncRequest request) {
        Integer limit = request != null && request.getLimit() != null ? request.getLimit() : DEFAULT_SYNC_LIMIT;
        Double maxSeconds = request != null ? request.getMaxSeconds() : null;
        log.info("Received sync request: limit={}, max_seconds={}", limit, maxSeconds);
        return schedulerService.sweep(limit, maxSeconds)
                .map(ResponseEntity::ok);
    }
}
