package org.gc.socialpublisher.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Document(indexName = "scheduler_config")
public class ScheduleConfig {

    public static final String SINGLETON_ID = "default";

    @Id
    private String id;

    @Field(type = FieldType.Boolean)
    private boolean enabled;

    /** Keyed by {@link Weekday#key()}. */
    @Builder.Default
    @Field(type = FieldType.Object)
    private Map<String, DaySchedule> schedule = new LinkedHashMap<>();

    @Field(type = FieldType.Date)
    private Instant updatedAtUtc;

    public static ScheduleConfig defaults(Instant now) {
        Map<String, DaySchedule> days = new LinkedHashMap<>();
        for (Weekday day : Weekday.values()) {
            days.put(day.key(), DaySchedule.disabled());
        }
        return ScheduleConfig.builder()
                .id(SINGLETON_ID)
                .enabled(false)
                .schedule(days)
                .updatedAtUtc(now)
                .build();
    }

    public DaySchedule dayFor(Weekday weekday) {
        DaySchedule day = schedule == null ? null : schedule.get(weekday.key());
        return day != null ? day : DaySchedule.disabled();
    }

    public DaySchedule dayFor(LocalDate date) {
        return dayFor(Weekday.of(date));
    }

    public boolean hasEnabledDay() {
        return schedule != null && schedule.values().stream()
                .anyMatch(day -> day != null && day.isEnabled() && !day.slots().isEmpty());
    }
}
