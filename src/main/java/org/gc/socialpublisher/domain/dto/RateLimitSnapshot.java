package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RateLimitSnapshot {

    private int count;
    private int limit;
    /** Null when nothing was published inside the window. */
    private Long nextSlotInMinutes;

    public boolean isExhausted() {
        return count >= limit;
    }
}
