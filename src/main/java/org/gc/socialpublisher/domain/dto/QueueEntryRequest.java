package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class QueueEntryRequest {

    @NotBlank(message = "scheduled_date required (YYYY-MM-DD)")
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "scheduled_date required (YYYY-MM-DD)")
    @JsonProperty("scheduled_date")
    private String scheduledDate;

    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "Invalid time format (HH:MM)")
    @JsonProperty("scheduled_time")
    private String scheduledTime;

    private String topic;

    private Integer template;
}
