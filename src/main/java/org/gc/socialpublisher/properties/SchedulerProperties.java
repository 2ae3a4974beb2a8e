package org.gc.socialpublisher.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "publisher.scheduler")
public class SchedulerProperties {

    /** Zone used for day boundaries and HH:MM slots. */
    private String timezone = "Europe/Madrid";

    private long tickIntervalMs = 60_000;

    private long syncIntervalMs = 1_800_000;

    private int syncLimit = 40;

    private double syncMaxSeconds = 35;

    /** Days scanned by the next-run calculation. */
    private int horizonDays = 14;

    private int autoFillDefaultDays = 7;

    private int autoFillMaxDays = 30;

    private int stateDaysBack = 3;

    private int stateDaysForward = 14;

    private int pollIntervalSeconds = 30;

    /** An entry left processing longer than this is treated as interrupted. */
    private int staleProcessingMinutes = 120;

    /** False runs in dry-run mode: content is produced as a draft and not published. */
    private boolean autoPublish = true;

    private int maxRateLimitDeferrals = 3;

    private int rateLimitBackoffMinutes = 15;
}
