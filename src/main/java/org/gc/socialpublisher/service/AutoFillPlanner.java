package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.dto.AutoFillResult;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Materializes pending entries for every configured slot of the coming days.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoFillPlanner {

    private final QueueStore queueStore;
    private final SchedulerProperties properties;
    private final Clock clock;

    public int clampDays(Integer requested) {
        int days = requested == null ? properties.getAutoFillDefaultDays() : requested;
        return Math.max(1, Math.min(days, properties.getAutoFillMaxDays()));
    }

    public synchronized AutoFillResult autoFill(ScheduleConfig config, Integer requestedDays) {
        int days = clampDays(requestedDays);
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        AutoFillResult result = AutoFillResult.builder().days(days).build();

        List<QueueEntry> existing = queueStore.listUpcoming(days);
        for (int offset = 0; offset < days; offset++) {
            LocalDate date = today.plusDays(offset);
            DaySchedule day = config.dayFor(date);
            if (!day.isEnabled() || day.slots().isEmpty()) {
                result.setSkippedDisabled(result.getSkippedDisabled() + 1);
                continue;
            }
            List<QueueEntry> entriesOfDay = existing.stream()
                    .filter(entry -> date.equals(entry.getScheduledDate()))
                    .toList();
            boolean timelessEntry = entriesOfDay.stream().anyMatch(entry -> entry.getScheduledTime() == null);

            for (LocalTime slot : day.slots()) {
                String time = RecurrenceCalculator.formatTime(slot);
                boolean taken = timelessEntry || entriesOfDay.stream().anyMatch(entry -> time.equals(entry.getScheduledTime()));
                if (taken) {
                    result.setSkippedExisting(result.getSkippedExisting() + 1);
                } else if (!date.atTime(slot).atZone(now.getZone()).isAfter(now)) {
                    result.setSkippedPast(result.getSkippedPast() + 1);
                } else {
                    result.getCreated().add(queueStore.add(date, time, null, null, 1).getEntry());
                }
            }
        }
        log.info("Auto-fill over {} days: created={}, skipped_existing={}, skipped_disabled={}, skipped_past={}",
                days, result.getCreated().size(), result.getSkippedExisting(), result.getSkippedDisabled(),
                result.getSkippedPast());
        return result;
    }
}
