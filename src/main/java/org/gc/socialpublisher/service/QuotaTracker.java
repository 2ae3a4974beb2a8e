package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.dto.RateLimitSnapshot;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.gc.socialpublisher.repository.PostRecordRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Publishing quota over a rolling 24h window. Computed from the local publish history only;
 * the platform's own counter is never consulted.
 */
@Component
@RequiredArgsConstructor
public class QuotaTracker {

    static final Duration WINDOW = Duration.ofHours(24);

    private final PostRecordRepository postRecordRepository;
    private final PlatformProperties properties;
    private final Clock clock;

    public RateLimitSnapshot current() {
        Instant now = clock.instant();
        List<Instant> history = postRecordRepository.findByPublishedAtUtcAfter(now.minus(WINDOW)).stream()
                .map(PostRecord::getPublishedAtUtc)
                .filter(Objects::nonNull)
                .toList();
        return snapshot(history, properties.getPublishLimit(), now);
    }

    /**
     * {@code nextSlotInMinutes} is the wait until the window frees enough room for one more
     * publish: the oldest publish leaving when under the limit, or the one that brings the count
     * back below the limit when at or over it. Null when the window is empty.
     */
    public static RateLimitSnapshot snapshot(Collection<Instant> publishTimes, int limit, Instant now) {
        Instant windowStart = now.minus(WINDOW);
        List<Instant> inWindow = publishTimes.stream()
                .filter(Objects::nonNull)
                .filter(time -> time.isAfter(windowStart) && !time.isAfter(now))
                .sorted()
                .toList();

        int count = inWindow.size();
        Long nextSlot = null;
        if (count > 0) {
            int index = count >= limit ? Math.min(count - limit, count - 1) : 0;
            Instant leaves = inWindow.get(index).plus(WINDOW);
            long seconds = Math.max(0, Duration.between(now, leaves).toSeconds());
            nextSlot = (seconds + 59) / 60;
        }
        return RateLimitSnapshot.builder()
                .count(count)
                .limit(limit)
                .nextSlotInMinutes(nextSlot)
                .build();
    }
}
