package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw day settings as submitted by the dashboard. Validation happens in the config service
 * so that every malformed field is reported with the day it belongs to.
 */
@Data
public class DayScheduleRequest {

    private Boolean enabled;

    @JsonProperty("posts_per_day")
    private Integer postsPerDay;

    private List<String> times;

    /** Legacy single-slot field. */
    private String time;
}
