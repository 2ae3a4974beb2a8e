package org.gc.socialpublisher.domain.dto;

import lombok.Data;

import java.util.Map;

@Data
public class ScheduleConfigRequest {

    private boolean enabled;

    /** Null keeps the currently stored schedule. */
    private Map<String, DayScheduleRequest> schedule;
}
