package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.gc.socialpublisher.domain.dto.PublishResult;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.exception.IllegalPostTransitionException;
import org.gc.socialpublisher.exception.QueueConflictException;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishing of stored posts, manual or on behalf of the execution runner. Every retry looks for
 * the post on the platform first so that a publish that went through despite a local error is
 * never issued twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishService {

    private final PostStore postStore;
    private final RemotePlatformService remotePlatformService;
    private final RecoveryMatcher recoveryMatcher;
    private final PlatformErrorClassifier errorClassifier;
    private final PipelineLease pipelineLease;
    private final PlatformProperties platformProperties;
    private final Clock clock;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Manual publish of a draft or generated post.
     */
    public Mono<PublishResult> publish(Long postId) {
        return withLease("manual publish " + postId, () -> {
            PostRecord post = postStore.require(postId);
            if (post.getStatus() != PostStatus.DRAFT && post.getStatus() != PostStatus.GENERATED) {
                throw new IllegalPostTransitionException(postId, post.getStatus(), PostStatus.PUBLISHED_ACTIVE);
            }
            return publishNow(post);
        });
    }

    public Mono<PublishResult> retryPublish(Long postId) {
        return withLease("retry publish " + postId, () -> resume(postId));
    }

    /**
     * Retry path without taking the lease; the caller must already hold it.
     */
    PublishResult resume(Long postId) {
        PostRecord post = postStore.require(postId);
        if (!post.getStatus().isRetryable()) {
            throw new IllegalPostTransitionException(postId, post.getStatus(), PostStatus.PUBLISHED_ACTIVE);
        }
        Optional<PostRecord> recovered = recover(post);
        if (recovered.isPresent()) {
            return reconciledResult(recovered.get());
        }
        return publishNow(post);
    }

    /**
     * Issues the publish. A rate limit is ambiguous (the container may have been published anyway),
     * so it is followed by one recovery lookup before being reported.
     */
    PublishResult publishNow(PostRecord post) {
        inFlight.add(post.getId());
        try {
            return doPublish(post);
        } finally {
            inFlight.remove(post.getId());
        }
    }

    /**
     * Whether a publish call for this post is under way. Sweeps leave such posts alone.
     */
    public boolean isPublishing(Long postId) {
        return inFlight.contains(postId);
    }

    public boolean hasPublishInFlight() {
        return !inFlight.isEmpty();
    }

    private PublishResult doPublish(PostRecord post) {
        PostRecord attempted = postStore.recordPublishAttempt(post.getId());
        try {
            String mediaId = remotePlatformService.publishMedia(attempted.getArtifactUrls(), attempted.getCaption());
            PostRecord published = postStore.markPublished(attempted.getId(), mediaId, null, clock.instant());
            return PublishResult.builder()
                    .ok(true)
                    .postId(published.getId())
                    .mediaId(mediaId)
                    .status(published.getStatus())
                    .build();
        } catch (RateLimitException rateLimit) {
            Optional<PostRecord> recovered = alreadyLive(attempted.getId());
            if (recovered.isEmpty()) {
                recovered = recoverQuietly(attempted);
            }
            if (recovered.isPresent()) {
                log.info("Post {} went live despite the rate limit response", attempted.getId());
                return reconciledResult(recovered.get());
            }
            recordFailure(attempted, rateLimit);
            throw rateLimit;
        } catch (RuntimeException error) {
            Optional<PostRecord> live = alreadyLive(attempted.getId());
            if (live.isPresent()) {
                log.warn("Publish call for post {} failed after the post was bound to media {}: {}",
                        attempted.getId(), live.get().getIgMediaId(), error.getMessage());
                return reconciledResult(live.get());
            }
            recordFailure(attempted, error);
            throw error;
        }
    }

    private Optional<PostRecord> alreadyLive(Long postId) {
        return postStore.find(postId)
                .filter(current -> current.getStatus() == PostStatus.PUBLISHED_ACTIVE && current.hasMediaId());
    }

    /**
     * Looks for the post among the recent remote media and binds it when found.
     */
    public Optional<PostRecord> recover(PostRecord post) {
        if (post.hasMediaId() || !remotePlatformService.isConfigured()) {
            return Optional.empty();
        }
        List<RemoteMedia> recent = remotePlatformService.listRecentMedia(platformProperties.getRecentMediaLimit());
        return recover(post, recent, postStore.boundMediaIds());
    }

    /**
     * Variant reused by sweeps that already fetched the recent media.
     */
    public Optional<PostRecord> recover(PostRecord post, List<RemoteMedia> recent, Set<String> boundMediaIds) {
        Set<String> excluded = new HashSet<>(boundMediaIds);
        if (post.getIgMediaId() != null) {
            excluded.remove(post.getIgMediaId());
        }
        return recoveryMatcher.findMatch(post, recent, excluded)
                .map(media -> {
                    log.info("Recovered media {} for post {}", media.getId(), post.getId());
                    return postStore.markPublished(post.getId(), media.getId(), media.getPermalink(),
                            media.getTimestamp());
                });
    }

    private Optional<PostRecord> recoverQuietly(PostRecord post) {
        try {
            return recover(post);
        } catch (RuntimeException lookupError) {
            log.warn("Recovery lookup for post {} failed: {}", post.getId(), lookupError.getMessage());
            return Optional.empty();
        }
    }

    private void recordFailure(PostRecord post, RuntimeException error) {
        PlatformErrorClassifier.PlatformError classified = errorClassifier.classify(error);
        log.error("Publishing post {} failed [{}]: {}", post.getId(), classified.getTag(), classified.getSummary());
        postStore.recordPublishFailure(post.getId(), classified.getTag(), classified.getCode(), classified.getSummary());
    }

    private PublishResult reconciledResult(PostRecord post) {
        return PublishResult.builder()
                .ok(true)
                .postId(post.getId())
                .mediaId(post.getIgMediaId())
                .status(post.getStatus())
                .reconciled(true)
                .build();
    }

    private <T> Mono<T> withLease(String label, Callable<T> work) {
        return Mono.defer(() -> {
            Optional<String> token = pipelineLease.tryAcquire(label);
            if (token.isEmpty()) {
                return Mono.error(new QueueConflictException("Pipeline is busy, try again when the current run finishes"));
            }
            return Mono.fromCallable(work)
                    .subscribeOn(Schedulers.boundedElastic())
                    .doFinally(signal -> pipelineLease.release(token.get()));
        });
    }
}
