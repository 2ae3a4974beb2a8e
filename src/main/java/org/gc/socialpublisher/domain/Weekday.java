package org.gc.socialpublisher.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lowercase weekday keys used by the persisted schedule ("monday" .. "sunday").
 */
public enum Weekday {
    MONDAY,
    TUESDAY,
    WEDNESDAY,
    THURSDAY,
    FRIDAY,
    SATURDAY,
    SUNDAY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Weekday of(DayOfWeek dayOfWeek) {
        return values()[dayOfWeek.getValue() - 1];
    }

    public static Weekday of(LocalDate date) {
        return of(date.getDayOfWeek());
    }

    public static Optional<Weekday> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(day -> day.key().equals(normalized))
                .findFirst();
    }
}
