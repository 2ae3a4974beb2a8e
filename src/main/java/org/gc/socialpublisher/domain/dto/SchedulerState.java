package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;

import java.time.Instant;
import java.util.List;

/**
 * Composite snapshot polled by the dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SchedulerState {

    private ScheduleConfig config;
    private List<QueueEntry> queue;
    private NextRun nextRun;
    private boolean pipelineRunning;
    private String pipelineLabel;
    private Instant pipelineStartedAt;
    private String timezone;
    private RateLimitSnapshot rateLimit;
    private Instant lastTickAt;
    private Instant lastSweepAt;
    private SyncReport lastSweep;
    private int pollIntervalSeconds;
    private Instant generatedAt;
}
