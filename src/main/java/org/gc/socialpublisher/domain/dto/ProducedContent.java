package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload returned by the content pipeline for one produced post.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProducedContent {

    @JsonProperty("post_id")
    private String pipelineRef;

    private String topic;

    private String caption;

    @Builder.Default
    @JsonProperty("artifacts")
    private List<String> artifactUrls = new ArrayList<>();
}
