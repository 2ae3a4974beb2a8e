package org.gc.socialpublisher.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "publisher.pipeline")
public class ContentPipelineProperties {

    private String baseUrl = "http://localhost:8000";

    /** Research, writing and slide rendering can take several minutes. */
    private int timeoutSeconds = 900;
}
