package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.Weekday;
import org.gc.socialpublisher.domain.dto.DayScheduleRequest;
import org.gc.socialpublisher.domain.dto.ScheduleConfigRequest;
import org.gc.socialpublisher.exception.ScheduleValidationException;
import org.gc.socialpublisher.repository.ScheduleConfigRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Loads and validates the weekly schedule. A malformed request is rejected as a whole and
 * nothing is persisted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleConfigService {

    private final ScheduleConfigRepository scheduleConfigRepository;
    private final Clock clock;

    public ScheduleConfig current() {
        return scheduleConfigRepository.findById(ScheduleConfig.SINGLETON_ID)
                .orElseGet(() -> ScheduleConfig.defaults(clock.instant()));
    }

    public ScheduleConfig save(ScheduleConfigRequest request) {
        ScheduleConfig existing = current();
        Map<String, DaySchedule> schedule = request.getSchedule() == null
                ? existing.getSchedule()
                : validate(request.getSchedule());

        ScheduleConfig config = ScheduleConfig.builder()
                .id(ScheduleConfig.SINGLETON_ID)
                .enabled(request.isEnabled())
                .schedule(schedule)
                .updatedAtUtc(clock.instant())
                .build();
        ScheduleConfig saved = scheduleConfigRepository.save(config);
        log.info("Scheduler config saved: enabled={}, active days={}", saved.isEnabled(),
                saved.getSchedule().entrySet().stream().filter(day -> day.getValue().isEnabled()).map(Map.Entry::getKey).toList());
        return saved;
    }

    Map<String, DaySchedule> validate(Map<String, DayScheduleRequest> requested) {
        for (String key : requested.keySet()) {
            if (Weekday.fromKey(key).isEmpty()) {
                throw new ScheduleValidationException("Unknown day: " + key);
            }
        }
        Map<String, DaySchedule> schedule = new LinkedHashMap<>();
        for (Weekday weekday : Weekday.values()) {
            DayScheduleRequest day = requested.get(weekday.key());
            schedule.put(weekday.key(), day == null ? DaySchedule.disabled() : validateDay(weekday, day));
        }
        return schedule;
    }

    private DaySchedule validateDay(Weekday weekday, DayScheduleRequest day) {
        List<String> rawTimes;
        if (day.getTimes() != null && !day.getTimes().isEmpty()) {
            rawTimes = day.getTimes();
        } else if (day.getTime() != null && !day.getTime().isBlank()) {
            rawTimes = List.of(day.getTime());
        } else {
            rawTimes = List.of(DaySchedule.DEFAULT_TIME);
        }

        TreeSet<String> times = new TreeSet<>();
        for (String raw : rawTimes) {
            String time = raw == null ? "" : raw.trim();
            if (!QueueStore.TIME_PATTERN.matcher(time).matches()) {
                throw new ScheduleValidationException("Invalid time '" + raw + "' for " + weekday.key() + " (HH:MM)");
            }
            times.add(time);
        }

        int postsPerDay = day.getPostsPerDay() != null ? day.getPostsPerDay() : times.size();
        if (postsPerDay < DaySchedule.MIN_POSTS_PER_DAY || postsPerDay > DaySchedule.MAX_POSTS_PER_DAY) {
            throw new ScheduleValidationException("posts_per_day for " + weekday.key() + " must be between "
                    + DaySchedule.MIN_POSTS_PER_DAY + " and " + DaySchedule.MAX_POSTS_PER_DAY);
        }
        if (times.size() != postsPerDay) {
            throw new ScheduleValidationException(weekday.key() + " needs " + postsPerDay
                    + " distinct times, got " + times.size());
        }
        return DaySchedule.builder()
                .enabled(Boolean.TRUE.equals(day.getEnabled()))
                .postsPerDay(postsPerDay)
                .times(new ArrayList<>(times))
                .build();
    }
}
