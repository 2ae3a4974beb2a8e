package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the remote media that a local post ended up as when the publish call itself failed
 * ambiguously. A match requires the same normalized caption, a feed carousel and a timestamp
 * inside the window around the last publish attempt.
 */
@Component
@RequiredArgsConstructor
public class RecoveryMatcher {

    static final String CAROUSEL = "CAROUSEL_ALBUM";
    static final String FEED = "FEED";

    private final PlatformProperties properties;

    public Optional<RemoteMedia> findMatch(PostRecord post, List<RemoteMedia> candidates, Collection<String> boundMediaIds) {
        String caption = normalizeCaption(post.getCaption());
        if (caption.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Instant anchor = anchorOf(post);
        Instant earliest = anchor == null ? null : anchor.minus(Duration.ofMinutes(properties.getRecoveryEarlyToleranceMinutes()));
        Instant latest = anchor == null ? null : anchor.plus(Duration.ofMinutes(properties.getRecoveryLookbackMinutes()));

        return candidates.stream()
                .filter(media -> media.getId() != null && !boundMediaIds.contains(media.getId()))
                .filter(media -> media.getMediaType() == null || CAROUSEL.equalsIgnoreCase(media.getMediaType()))
                .filter(media -> media.getMediaProductType() == null || FEED.equalsIgnoreCase(media.getMediaProductType()))
                .filter(media -> caption.equals(normalizeCaption(media.getCaption())))
                .filter(media -> withinWindow(media.getTimestamp(), earliest, latest))
                .min(Comparator
                        .comparingLong((RemoteMedia media) -> distance(media.getTimestamp(), anchor))
                        .thenComparing(RemoteMedia::getId));
    }

    /**
     * Whether the post is still young enough for recovery to be attempted at all.
     */
    public boolean isRecoverable(PostRecord post, Instant now) {
        Instant anchor = anchorOf(post);
        return anchor == null || !anchor.plus(Duration.ofMinutes(properties.getRecoveryLookbackMinutes())).isBefore(now);
    }

    static String normalizeCaption(String caption) {
        if (caption == null) {
            return "";
        }
        return caption.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    static Instant anchorOf(PostRecord post) {
        return post.getLastPublishAttemptUtc() != null ? post.getLastPublishAttemptUtc() : post.getCreatedAtUtc();
    }

    private static boolean withinWindow(Instant timestamp, Instant earliest, Instant latest) {
        if (earliest == null) {
            return true;
        }
        if (timestamp == null) {
            return false;
        }
        return !timestamp.isBefore(earliest) && !timestamp.isAfter(latest);
    }

    private static long distance(Instant timestamp, Instant anchor) {
        if (timestamp == null || anchor == null) {
            return Long.MAX_VALUE;
        }
        return Math.abs(Duration.between(anchor, timestamp).toSeconds());
    }
}
