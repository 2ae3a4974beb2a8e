package org.gc.socialpublisher.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteMedia {

    private String id;
    private String caption;
    private Instant timestamp;
    private String mediaType;
    private String mediaProductType;
    private String permalink;
}
