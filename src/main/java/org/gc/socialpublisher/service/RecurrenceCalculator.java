package org.gc.socialpublisher.service;

import lombok.RequiredArgsConstructor;
import org.gc.socialpublisher.domain.DaySchedule;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.domain.Weekday;
import org.gc.socialpublisher.domain.dto.NextRun;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Weekly recurrence. Pure: depends only on the configuration, the clock value passed in and the
 * queue snapshot.
 */
@Component
@RequiredArgsConstructor
public class RecurrenceCalculator {

    private final SchedulerProperties properties;

    /**
     * First enabled slot strictly after {@code now} that no completed or processing entry has
     * consumed, or null when the horizon holds none.
     */
    public NextRun nextRun(ScheduleConfig config, ZonedDateTime now, Collection<QueueEntry> queue) {
        if (config == null || !config.hasEnabledDay()) {
            return null;
        }
        LocalDate today = now.toLocalDate();
        for (int offset = 0; offset < properties.getHorizonDays(); offset++) {
            LocalDate date = today.plusDays(offset);
            DaySchedule day = config.dayFor(date);
            if (!day.isEnabled()) {
                continue;
            }
            List<QueueEntry> entriesOfDay = queue.stream()
                    .filter(entry -> date.equals(entry.getScheduledDate()))
                    .toList();
            Set<LocalTime> consumed = consumedSlots(entriesOfDay, day);

            for (LocalTime slot : day.slots()) {
                ZonedDateTime slotAt = date.atTime(slot).atZone(now.getZone());
                if (!slotAt.isAfter(now) || consumed.contains(slot)) {
                    continue;
                }
                QueueEntry pending = pendingEntryOn(entriesOfDay, day, slot);
                double hoursUntil = Duration.between(now, slotAt).toMillis() / 3_600_000.0;
                return NextRun.builder()
                        .dayName(Weekday.of(date).key())
                        .date(date)
                        .time(formatTime(slot))
                        .hoursUntil(hoursUntil)
                        .topic(pending != null ? pending.getTopic() : null)
                        .queueEntryId(pending != null ? pending.getId() : null)
                        .build();
            }
        }
        return null;
    }

    /**
     * Slots an entry is responsible for: its explicit time, the first slot for a time-less manual
     * topic, or every slot of the day for a time-less automatic entry.
     */
    public static List<LocalTime> slotsOf(QueueEntry entry, DaySchedule day) {
        if (entry.getScheduledTime() != null && !entry.getScheduledTime().isBlank()) {
            return List.of(LocalTime.parse(entry.getScheduledTime()));
        }
        List<LocalTime> slots = day.slots();
        if (slots.isEmpty()) {
            return List.of(LocalTime.parse(DaySchedule.DEFAULT_TIME));
        }
        return entry.hasManualTopic() ? List.of(slots.get(0)) : slots;
    }

    /**
     * The slot the entry fires at next, or null once every slot has run.
     */
    public static LocalTime nextSlotOf(QueueEntry entry, DaySchedule day) {
        List<LocalTime> slots = slotsOf(entry, day);
        int done = entry.completedRuns();
        return done < slots.size() ? slots.get(done) : null;
    }

    static Set<LocalTime> consumedSlots(List<QueueEntry> entriesOfDay, DaySchedule day) {
        Set<LocalTime> consumed = new HashSet<>();
        for (QueueEntry entry : entriesOfDay) {
            List<LocalTime> slots = slotsOf(entry, day);
            switch (entry.getStatus()) {
                case COMPLETED -> consumed.addAll(slots);
                case PROCESSING -> consumed.addAll(slots.subList(0, Math.min(slots.size(), entry.completedRuns() + 1)));
                case PENDING, ERROR, SKIPPED -> consumed.addAll(slots.subList(0, Math.min(slots.size(), entry.completedRuns())));
            }
        }
        return consumed;
    }

    private static QueueEntry pendingEntryOn(List<QueueEntry> entriesOfDay, DaySchedule day, LocalTime slot) {
        return entriesOfDay.stream()
                .filter(entry -> entry.getStatus() == QueueEntry.Status.PENDING)
                .filter(entry -> slot.equals(nextSlotOf(entry, day)))
                .findFirst()
                .orElse(null);
    }

    static String formatTime(LocalTime time) {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
