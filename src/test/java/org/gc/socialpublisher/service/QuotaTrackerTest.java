package org.gc.socialpublisher.service;

import org.gc.socialpublisher.domain.dto.RateLimitSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaTrackerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @Test
    @DisplayName("Empty window reports zero and no wait")
    void emptyWindow() {
        RateLimitSnapshot snapshot = QuotaTracker.snapshot(List.of(), 25, NOW);

        assertThat(snapshot.getCount()).isZero();
        assertThat(snapshot.getLimit()).isEqualTo(25);
        assertThat(snapshot.getNextSlotInMinutes()).isNull();
        assertThat(snapshot.isExhausted()).isFalse();
    }

    @Test
    @DisplayName("At the limit, the wait is until the oldest publish leaves the window")
    void exhaustedWindow() {
        List<Instant> publishes = new ArrayList<>();
        publishes.add(NOW.minus(Duration.ofHours(20)));
        for (int i = 1; i < 25; i++) {
            publishes.add(NOW.minus(Duration.ofMinutes(i * 10L)));
        }

        RateLimitSnapshot snapshot = QuotaTracker.snapshot(publishes, 25, NOW);

        assertThat(snapshot.getCount()).isEqualTo(25);
        assertThat(snapshot.isExhausted()).isTrue();
        assertThat(snapshot.getNextSlotInMinutes()).isEqualTo(240L);
    }

    @Test
    void overTheLimitWaitsForTheExcess() {
        List<Instant> publishes = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            publishes.add(NOW.minus(Duration.ofHours(23 - i)));
        }

        RateLimitSnapshot snapshot = QuotaTracker.snapshot(publishes, 3, NOW);

        // 23h, 22h, 21h, 20h old; one over the limit of 3, so the second oldest must leave
        assertThat(snapshot.getCount()).isEqualTo(4);
        assertThat(snapshot.getNextSlotInMinutes()).isEqualTo(120L);
    }

    @Test
    void publishesOutsideTheWindowAreIgnored() {
        List<Instant> publishes = List.of(
                NOW.minus(Duration.ofHours(30)),
                NOW.minus(Duration.ofHours(24)),
                NOW.minus(Duration.ofMinutes(90)),
                NOW.plus(Duration.ofMinutes(5)));

        RateLimitSnapshot snapshot = QuotaTracker.snapshot(publishes, 25, NOW);

        assertThat(snapshot.getCount()).isEqualTo(1);
        assertThat(snapshot.getNextSlotInMinutes()).isEqualTo(Duration.ofHours(24).minusMinutes(90).toMinutes());
    }

    @Test
    void partialMinutesRoundUp() {
        RateLimitSnapshot snapshot = QuotaTracker.snapshot(
                List.of(NOW.minus(Duration.ofHours(24)).plusSeconds(30)), 25, NOW);

        assertThat(snapshot.getNextSlotInMinutes()).isEqualTo(1L);
    }
}
