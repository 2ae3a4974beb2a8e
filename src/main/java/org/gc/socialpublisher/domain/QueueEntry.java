package org.gc.socialpublisher.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.DateFormat;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Document(indexName = "content_queue")
public class QueueEntry {

    @Id
    private Long id;

    @Field(type = FieldType.Date, format = DateFormat.date)
    private LocalDate scheduledDate;

    /** HH:MM; null means the slots of the day schedule apply. */
    @Field(type = FieldType.Keyword)
    private String scheduledTime;

    /** Manual topic override; null selects a trending topic automatically. */
    @Field(type = FieldType.Text)
    private String topic;

    @Field(type = FieldType.Integer)
    private Integer template;

    @Field(type = FieldType.Keyword)
    private Status status;

    @Field(type = FieldType.Integer)
    private Integer runsTotal;

    @Field(type = FieldType.Integer)
    private Integer runsCompleted;

    @Field(type = FieldType.Long)
    private Long postId;

    @Field(type = FieldType.Text)
    private String resultMessage;

    @Field(type = FieldType.Integer)
    private Integer rateLimitDeferrals;

    @Field(type = FieldType.Date)
    private Instant retryAfterUtc;

    @Field(type = FieldType.Date)
    private Instant createdAtUtc;

    @Field(type = FieldType.Date)
    private Instant startedAtUtc;

    @Field(type = FieldType.Date)
    private Instant completedAtUtc;

    @Field(type = FieldType.Date)
    private Instant updatedAtUtc;

    public enum Status {
        PENDING,
        PROCESSING,
        COMPLETED,
        ERROR,
        SKIPPED;

        public boolean isTerminal() {
            return this == COMPLETED || this == ERROR || this == SKIPPED;
        }

        public Set<Status> successors() {
            return switch (this) {
                case PENDING -> EnumSet.of(PROCESSING, SKIPPED);
                case PROCESSING -> EnumSet.of(COMPLETED, ERROR, PENDING);
                case COMPLETED, ERROR, SKIPPED -> EnumSet.noneOf(Status.class);
            };
        }

        public boolean canTransitionTo(Status target) {
            return successors().contains(target);
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromWireName(String value) {
            return Status.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static QueueEntry create(Long id, LocalDate scheduledDate, String scheduledTime,
                                    String topic, Integer template, int runsTotal, Instant now) {
        return QueueEntry.builder()
                .id(id)
                .scheduledDate(scheduledDate)
                .scheduledTime(scheduledTime)
                .topic(topic)
                .template(template)
                .status(Status.PENDING)
                .runsTotal(Math.max(1, runsTotal))
                .runsCompleted(0)
                .rateLimitDeferrals(0)
                .createdAtUtc(now)
                .updatedAtUtc(now)
                .build();
    }

    public boolean hasManualTopic() {
        return topic != null && !topic.isBlank();
    }

    public int completedRuns() {
        return runsCompleted == null ? 0 : Math.max(0, runsCompleted);
    }

    public int deferrals() {
        return rateLimitDeferrals == null ? 0 : rateLimitDeferrals;
    }
}
