package org.gc.socialpublisher.service;

import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.PostMetricsSnapshot;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.gc.socialpublisher.domain.dto.MediaMetrics;
import org.gc.socialpublisher.domain.dto.ProducedContent;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.exception.EntryNotFoundException;
import org.gc.socialpublisher.exception.IllegalPostTransitionException;
import org.gc.socialpublisher.repository.PostMetricsSnapshotRepository;
import org.gc.socialpublisher.repository.PostRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Persistence of post records. Status changes are checked against {@link PostStatus#successors()}.
 */
@Slf4j
@Service
public class PostStore {

    private final PostRecordRepository postRecordRepository;
    private final PostMetricsSnapshotRepository snapshotRepository;
    private final Clock clock;
    private final IdSequence ids;

    public PostStore(PostRecordRepository postRecordRepository, PostMetricsSnapshotRepository snapshotRepository,
                     Clock clock) {
        this.postRecordRepository = postRecordRepository;
        this.snapshotRepository = snapshotRepository;
        this.clock = clock;
        this.ids = new IdSequence(() -> postRecordRepository.findFirstByOrderByIdDesc()
                .map(PostRecord::getId)
                .orElse(0L));
    }

    public PostRecord require(Long id) {
        return postRecordRepository.findById(id)
                .orElseThrow(() -> new EntryNotFoundException("Post", id));
    }

    public Optional<PostRecord> find(Long id) {
        return id == null ? Optional.empty() : postRecordRepository.findById(id);
    }

    public List<PostRecord> listRecent(int limit) {
        int size = Math.max(1, Math.min(limit, 200));
        return postRecordRepository.findAll(PageRequest.of(0, size, Sort.by(Sort.Direction.DESC, "id"))).getContent();
    }

    public List<PostMetricsSnapshot> metricsHistory(Long postId) {
        require(postId);
        return snapshotRepository.findByPostIdOrderByCollectedAtUtcDesc(postId);
    }

    public synchronized PostRecord createFromPipeline(ProducedContent content, Integer template, Long queueEntryId,
                                                      PostStatus initialStatus) {
        Instant now = clock.instant();
        PostRecord post = PostRecord.builder()
                .id(ids.next())
                .topic(content.getTopic())
                .caption(content.getCaption())
                .template(template)
                .artifactUrls(new ArrayList<>(content.getArtifactUrls()))
                .pipelineRef(content.getPipelineRef())
                .status(initialStatus)
                .origin(PostRecord.Origin.PIPELINE)
                .queueEntryId(queueEntryId)
                .publishAttempts(0)
                .createdAtUtc(now)
                .updatedAtUtc(now)
                .build();
        PostRecord saved = postRecordRepository.save(post);
        log.info("Stored post {} ({}) from pipeline ref {}", saved.getId(), initialStatus.wireName(), content.getPipelineRef());
        return saved;
    }

    /**
     * Minimal local record for remote media that was published outside this service.
     */
    public synchronized PostRecord createImported(RemoteMedia media) {
        Instant now = clock.instant();
        PostRecord post = PostRecord.builder()
                .id(ids.next())
                .caption(media.getCaption())
                .status(PostStatus.PUBLISHED_ACTIVE)
                .origin(PostRecord.Origin.IMPORTED)
                .igMediaId(media.getId())
                .permalink(media.getPermalink())
                .publishedAtUtc(media.getTimestamp() != null ? media.getTimestamp() : now)
                .publishAttempts(0)
                .createdAtUtc(now)
                .updatedAtUtc(now)
                .build();
        PostRecord saved = postRecordRepository.save(post);
        log.info("Imported remote media {} as post {}", media.getId(), saved.getId());
        return saved;
    }

    public synchronized PostRecord recordPublishAttempt(Long id) {
        PostRecord post = require(id);
        Instant now = clock.instant();
        post.setPublishAttempts(post.attempts() + 1);
        post.setLastPublishAttemptUtc(now);
        post.setUpdatedAtUtc(now);
        return postRecordRepository.save(post);
    }

    /**
     * Binds the post to its remote media. Binding an active post again to the same media is a no-op,
     * which happens when a sweep recovers a post whose publish call is still returning.
     */
    public synchronized PostRecord markPublished(Long id, String mediaId, String permalink, Instant publishedAt) {
        PostRecord post = require(id);
        if (post.getStatus() == PostStatus.PUBLISHED_ACTIVE && mediaId != null && mediaId.equals(post.getIgMediaId())) {
            log.debug("Post {} already bound to media {}", id, mediaId);
            return post;
        }
        moveTo(post, PostStatus.PUBLISHED_ACTIVE);
        post.setIgMediaId(mediaId);
        if (permalink != null) {
            post.setPermalink(permalink);
        }
        post.setPublishedAtUtc(publishedAt != null ? publishedAt : clock.instant());
        post.setLastErrorTag(null);
        post.setLastErrorCode(null);
        post.setLastErrorMessage(null);
        return postRecordRepository.save(post);
    }

    /**
     * Records a failed publish. A draft stays a draft; anything else lands in publish_error.
     */
    public synchronized PostRecord recordPublishFailure(Long id, String tag, String code, String message) {
        PostRecord post = require(id);
        if (post.getStatus() != PostStatus.DRAFT) {
            moveTo(post, PostStatus.PUBLISH_ERROR);
        } else {
            post.setUpdatedAtUtc(clock.instant());
        }
        post.setLastErrorTag(tag);
        post.setLastErrorCode(code);
        post.setLastErrorMessage(message);
        return postRecordRepository.save(post);
    }

    public synchronized PostRecord markDeleted(Long id) {
        PostRecord post = require(id);
        moveTo(post, PostStatus.PUBLISHED_DELETED);
        post.setIgLastCheckedAtUtc(clock.instant());
        return postRecordRepository.save(post);
    }

    public synchronized PostRecord applyMetrics(Long id, MediaMetrics metrics) {
        PostRecord post = require(id);
        Instant now = clock.instant();
        post.setLikes(metrics.getLikes());
        post.setComments(metrics.getComments());
        post.setReach(metrics.getReach());
        post.setImpressions(metrics.getImpressions());
        post.setSaves(metrics.getSaves());
        post.setShares(metrics.getShares());
        post.setEngagementRate(metrics.engagementRate());
        if (metrics.getPermalink() != null) {
            post.setPermalink(metrics.getPermalink());
        }
        post.setMetricsCollectedAtUtc(now);
        post.setIgLastCheckedAtUtc(now);
        post.setUpdatedAtUtc(now);
        PostRecord saved = postRecordRepository.save(post);
        snapshotRepository.save(PostMetricsSnapshot.of(saved, now));
        return saved;
    }

    public synchronized void markChecked(Long id) {
        find(id).ifPresent(post -> {
            post.setIgLastCheckedAtUtc(clock.instant());
            postRecordRepository.save(post);
        });
    }

    public Optional<PostRecord> findByMediaId(String mediaId) {
        return postRecordRepository.findByIgMediaId(mediaId);
    }

    public Set<String> boundMediaIds() {
        return StreamSupport.stream(postRecordRepository.findAll().spliterator(), false)
                .filter(PostRecord::hasMediaId)
                .map(PostRecord::getIgMediaId)
                .collect(Collectors.toSet());
    }

    /**
     * Records whose publish outcome is unknown locally: generated or failed, without a media id.
     */
    public List<PostRecord> recoveryCandidates() {
        return postRecordRepository.findByStatusIn(EnumSet.of(PostStatus.GENERATED, PostStatus.PUBLISH_ERROR)).stream()
                .filter(post -> !post.hasMediaId())
                .sorted(Comparator.comparing(PostRecord::getId))
                .toList();
    }

    /**
     * Active records, least recently checked first.
     */
    public List<PostRecord> activeByCheckAge() {
        return postRecordRepository.findByStatus(PostStatus.PUBLISHED_ACTIVE).stream()
                .filter(PostRecord::hasMediaId)
                .sorted(Comparator.comparing(PostRecord::getIgLastCheckedAtUtc, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(PostRecord::getId))
                .toList();
    }

    private void moveTo(PostRecord post, PostStatus target) {
        PostStatus current = post.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new IllegalPostTransitionException(post.getId(), current == null ? PostStatus.DRAFT : current, target);
        }
        post.setStatus(target);
        post.setUpdatedAtUtc(clock.instant());
    }
}
