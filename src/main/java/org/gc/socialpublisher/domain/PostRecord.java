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
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Document(indexName = "posts")
public class PostRecord {

    @Id
    private Long id;

    @Field(type = FieldType.Text)
    private String topic;

    @Field(type = FieldType.Text)
    private String caption;

    @Field(type = FieldType.Integer)
    private Integer template;

    @Builder.Default
    @Field(type = FieldType.Keyword)
    private List<String> artifactUrls = new ArrayList<>();

    /** Reference handed back by the content pipeline. */
    @Field(type = FieldType.Keyword)
    private String pipelineRef;

    @Field(type = FieldType.Keyword)
    private PostStatus status;

    @Field(type = FieldType.Keyword)
    private Origin origin;

    @Field(type = FieldType.Long)
    private Long queueEntryId;

    @Field(type = FieldType.Integer)
    private Integer publishAttempts;

    @Field(type = FieldType.Date)
    private Instant lastPublishAttemptUtc;

    @Field(type = FieldType.Keyword)
    private String lastErrorTag;

    @Field(type = FieldType.Keyword)
    private String lastErrorCode;

    @Field(type = FieldType.Text)
    private String lastErrorMessage;

    @Field(type = FieldType.Keyword)
    private String igMediaId;

    @Field(type = FieldType.Keyword)
    private String permalink;

    @Field(type = FieldType.Date)
    private Instant publishedAtUtc;

    @Field(type = FieldType.Integer)
    private Integer likes;

    @Field(type = FieldType.Integer)
    private Integer comments;

    @Field(type = FieldType.Integer)
    private Integer reach;

    @Field(type = FieldType.Integer)
    private Integer impressions;

    @Field(type = FieldType.Integer)
    private Integer saves;

    @Field(type = FieldType.Integer)
    private Integer shares;

    @Field(type = FieldType.Double)
    private Double engagementRate;

    @Field(type = FieldType.Date)
    private Instant metricsCollectedAtUtc;

    @Field(type = FieldType.Date)
    private Instant igLastCheckedAtUtc;

    @Field(type = FieldType.Date)
    private Instant createdAtUtc;

    @Field(type = FieldType.Date)
    private Instant updatedAtUtc;

    public enum Origin {
        PIPELINE,
        IMPORTED
    }

    public int attempts() {
        return publishAttempts == null ? 0 : publishAttempts;
    }

    public boolean hasMediaId() {
        return igMediaId != null && !igMediaId.isBlank();
    }
}
