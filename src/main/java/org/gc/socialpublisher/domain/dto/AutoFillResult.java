package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gc.socialpublisher.domain.QueueEntry;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AutoFillResult {

    @Builder.Default
    private List<QueueEntry> created = new ArrayList<>();
    private int skippedExisting;
    private int skippedDisabled;
    private int skippedPast;
    private int days;
}
