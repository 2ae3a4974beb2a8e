package org.gc.socialpublisher.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "post_metrics_snapshots")
public class PostMetricsSnapshot {

    @Id
    private String id;

    @Field(type = FieldType.Long)
    private Long postId;

    @Field(type = FieldType.Keyword)
    private String igMediaId;

    @Field(type = FieldType.Date)
    private Instant collectedAtUtc;

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

    public static PostMetricsSnapshot of(PostRecord post, Instant collectedAt) {
        return PostMetricsSnapshot.builder()
                .id(UUID.randomUUID().toString())
                .postId(post.getId())
                .igMediaId(post.getIgMediaId())
                .collectedAtUtc(collectedAt)
                .likes(post.getLikes())
                .comments(post.getComments())
                .reach(post.getReach())
                .impressions(post.getImpressions())
                .saves(post.getSaves())
                .shares(post.getShares())
                .engagementRate(post.getEngagementRate())
                .build();
    }
}
