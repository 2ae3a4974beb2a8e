package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class SyncRequest {

    private Integer limit;

    @JsonProperty("max_seconds")
    private Double maxSeconds;
}
