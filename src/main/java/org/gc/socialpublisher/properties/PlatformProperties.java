package org.gc.socialpublisher.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "publisher.platform")
public class PlatformProperties {

    private String accountId;

    private String accessToken;

    /** Content publishing limit over a rolling 24h window. */
    private int publishLimit = 25;

    private int containerPollAttempts = 12;

    private long containerPollIntervalMs = 5_000;

    private int recentMediaLimit = 40;

    /** How far after the last publish attempt a remote post may appear and still match. */
    private int recoveryLookbackMinutes = 4_320;

    /** Remote timestamps may precede the local anchor by this much (clock skew). */
    private int recoveryEarlyToleranceMinutes = 10;

    private boolean importUnseen = true;
}
