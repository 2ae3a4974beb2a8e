package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.socialpublisher.domain.PostStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PublishResult {

    private boolean ok;
    private Long postId;
    private String mediaId;
    private PostStatus status;
    /** True when the post turned out to be live already and no new publish was issued. */
    private boolean reconciled;
}
