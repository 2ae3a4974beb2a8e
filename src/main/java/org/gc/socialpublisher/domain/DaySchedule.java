package org.gc.socialpublisher.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Transient;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DaySchedule {

    public static final int MIN_POSTS_PER_DAY = 1;
    public static final int MAX_POSTS_PER_DAY = 10;
    public static final String DEFAULT_TIME = "08:30";

    @Field(type = FieldType.Boolean)
    private boolean enabled;

    @Field(type = FieldType.Integer)
    private Integer postsPerDay;

    /** Ordered, deduplicated HH:MM slots. */
    @Builder.Default
    @Field(type = FieldType.Keyword)
    private List<String> times = new ArrayList<>();

    public static DaySchedule disabled() {
        return DaySchedule.builder()
                .enabled(false)
                .postsPerDay(MIN_POSTS_PER_DAY)
                .times(new ArrayList<>(List.of(DEFAULT_TIME)))
                .build();
    }

    /**
     * Legacy single-slot value, always the first configured time.
     */
    @Transient
    @JsonProperty(value = "time", access = JsonProperty.Access.READ_ONLY)
    public String getTime() {
        return times == null || times.isEmpty() ? null : times.get(0);
    }

    @JsonIgnore
    public List<LocalTime> slots() {
        if (times == null) {
            return List.of();
        }
        return times.stream()
                .map(LocalTime::parse)
                .sorted()
                .distinct()
                .toList();
    }
}
