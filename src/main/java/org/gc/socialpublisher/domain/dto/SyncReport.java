package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation sweep. {@code partial} means the time budget ran out
 * before the backlog was covered and the caller should sweep again later.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncReport {

    static final int MAX_ERRORS = 20;

    private int checked;
    private int updated;
    private int failed;
    private int deleted;
    private int pendingChecked;
    private int pendingReconciled;
    private int importCreated;
    private int importExisting;
    private boolean partial;
    private int remaining;
    private double elapsedSeconds;
    private boolean alreadyRunning;
    private Instant finishedAtUtc;

    @Builder.Default
    private List<Map<String, Object>> errors = new ArrayList<>();

    public void addError(Long postId, String igMediaId, String message) {
        if (errors.size() >= MAX_ERRORS) {
            return;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("post_id", postId);
        error.put("ig_media_id", igMediaId);
        error.put("error", message);
        errors.add(error);
    }
}
