package org.gc.socialpublisher.service;

import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.Weekday;
import org.gc.socialpublisher.domain.dto.DayScheduleRequest;
import org.gc.socialpublisher.domain.dto.ScheduleConfigRequest;
import org.gc.socialpublisher.exception.ScheduleValidationException;
import org.gc.socialpublisher.repository.ScheduleConfigRepository;
import org.gc.socialpublisher.support.InMemoryRepositories;
import org.gc.socialpublisher.support.MutableClock;
import org.gc.socialpublisher.support.Schedules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ScheduleConfigServiceTest {

    private ScheduleConfigRepository repository;
    private MutableClock clock;
    private ScheduleConfigService service;

    @BeforeEach
    void setUp() {
        repository = InMemoryRepositories.config(null);
        clock = MutableClock.at(LocalDateTime.of(2026, 10, 19, 10, 0));
        service = new ScheduleConfigService(repository, clock);
    }

    @Test
    @DisplayName("Without a stored config every day is disabled")
    void defaults() {
        ScheduleConfig config = service.current();

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.getSchedule()).hasSize(7);
        assertThat(config.getSchedule().values()).noneMatch(DaySchedule::isEnabled);
        assertThat(config.dayFor(Weekday.SUNDAY).getTime()).isEqualTo("08:30");
        assertThat(config.getUpdatedAtUtc()).isEqualTo(clock.instant());
    }

    @Test
    void savesSortedDistinctTimes() {
        ScheduleConfig saved = service.save(request(true, Map.of("tuesday", day(true, 2, "20:00", "08:30"))));

        DaySchedule tuesday = saved.dayFor(Weekday.TUESDAY);
        assertThat(tuesday.isEnabled()).isTrue();
        assertThat(tuesday.getTimes()).containsExactly("08:30", "20:00");
        assertThat(tuesday.getTime()).isEqualTo("08:30");
        assertThat(saved.dayFor(Weekday.MONDAY).isEnabled()).isFalse();
        assertThat(service.current().isEnabled()).isTrue();
    }

    @Test
    @DisplayName("A legacy single time is accepted")
    void legacyTimeField() {
        DayScheduleRequest legacy = new DayScheduleRequest();
        legacy.setEnabled(true);
        legacy.setTime("07:15");

        ScheduleConfig saved = service.save(request(true, Map.of("friday", legacy)));

        assertThat(saved.dayFor(Weekday.FRIDAY).getTimes()).containsExactly("07:15");
        assertThat(saved.dayFor(Weekday.FRIDAY).getPostsPerDay()).isEqualTo(1);
    }

    @Test
    @DisplayName("Malformed schedules are rejected and nothing is stored")
    void rejectsInvalidSchedules() {
        assertThatThrownBy(() -> service.save(request(true, Map.of("funday", day(true, 1, "08:00")))))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("funday");
        assertThatThrownBy(() -> service.save(request(true, Map.of("monday", day(true, 1, "8:00")))))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("HH:MM");
        assertThatThrownBy(() -> service.save(request(true, Map.of("monday", day(true, 2, "08:00", "08:00")))))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("distinct");
        assertThatThrownBy(() -> service.save(request(true, Map.of("monday", day(true, 11, "08:00")))))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("between 1 and 10");
        verify(repository, never()).save(any(ScheduleConfig.class));
    }

    @Test
    void missingScheduleKeepsStoredDays() {
        repository.save(Schedules.enabledOn(Weekday.WEDNESDAY, "12:00"));

        ScheduleConfig saved = service.save(request(false, null));

        assertThat(saved.isEnabled()).isFalse();
        assertThat(saved.dayFor(Weekday.WEDNESDAY).getTimes()).containsExactly("12:00");
    }

    private static ScheduleConfigRequest request(boolean enabled, Map<String, DayScheduleRequest> schedule) {
        ScheduleConfigRequest request = new ScheduleConfigRequest();
        request.setEnabled(enabled);
        request.setSchedule(schedule == null ? null : new LinkedHashMap<>(schedule));
        return request;
    }

    private static DayScheduleRequest day(boolean enabled, int postsPerDay, String... times) {
        DayScheduleRequest day = new DayScheduleRequest();
        day.setEnabled(enabled);
        day.setPostsPerDay(postsPerDay);
        day.setTimes(List.of(times));
        return day;
    }
}
