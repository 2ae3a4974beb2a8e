package org.gc.socialpublisher.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaMetrics {

    private Integer likes;
    private Integer comments;
    private Integer reach;
    private Integer impressions;
    private Integer saves;
    private Integer shares;
    private String permalink;

    /**
     * Interactions over reach, as a percentage rounded to four decimals. Null without reach.
     */
    public Double engagementRate() {
        if (reach == null || reach <= 0) {
            return null;
        }
        int interactions = nz(likes) + nz(comments) + nz(saves) + nz(shares);
        return Math.round(interactions * 100.0 / reach * 10_000.0) / 10_000.0;
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
