package org.gc.socialpublisher.service;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.clients.GraphApiClient;
import org.gc.socialpublisher.domain.dto.MediaMetrics;
import org.gc.socialpublisher.domain.dto.MediaStatus;
import org.gc.socialpublisher.domain.dto.RemoteMedia;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.exception.RemotePlatformException;
import org.gc.socialpublisher.properties.PlatformProperties;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking facade over the Graph API. Every client failure leaves this class either as a
 * {@link RateLimitException} or a {@link RemotePlatformException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemotePlatformService {

    static final String MEDIA_FIELDS = "id,caption,timestamp,media_type,media_product_type,permalink";
    static final String METRIC_FIELDS = "id,like_count,comments_count,permalink";
    static final List<String> INSIGHT_METRIC_SETS = List.of(
            "impressions,reach,saved,shares",
            "impressions,reach,saved",
            "impressions,reach");

    private static final DateTimeFormatter GRAPH_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final GraphApiClient graphApiClient;
    private final PlatformProperties properties;
    private final PlatformErrorClassifier errorClassifier;

    public boolean isConfigured() {
        return notBlank(properties.getAccountId()) && notBlank(properties.getAccessToken());
    }

    /**
     * Publishes the slides as a carousel (or a single image post) and returns the new media id.
     */
    public String publishMedia(List<String> imageUrls, String caption) {
        requireConfigured();
        if (imageUrls == null || imageUrls.isEmpty()) {
            throw new RemotePlatformException("Nothing to publish: no slide URLs", 0, null, null);
        }
        String creationId;
        if (imageUrls.size() == 1) {
            Map<String, String> params = baseParams();
            params.put("image_url", imageUrls.get(0));
            params.put("caption", caption == null ? "" : caption);
            creationId = createContainer(params);
        } else {
            List<String> children = new ArrayList<>();
            for (String imageUrl : imageUrls) {
                Map<String, String> params = baseParams();
                params.put("image_url", imageUrl);
                params.put("is_carousel_item", "true");
                children.add(createContainer(params));
            }
            Map<String, String> params = baseParams();
            params.put("media_type", "CAROUSEL");
            params.put("children", String.join(",", children));
            params.put("caption", caption == null ? "" : caption);
            creationId = createContainer(params);
        }

        awaitContainer(creationId);

        Map<String, Object> published = call("media_publish",
                () -> graphApiClient.publishContainer(properties.getAccountId(), creationId, properties.getAccessToken()));
        String mediaId = asString(published.get("id"));
        if (mediaId == null) {
            throw new RemotePlatformException("media_publish returned no media id", 0, null, null);
        }
        log.info("Published media {} from container {} ({} slides)", mediaId, creationId, imageUrls.size());
        return mediaId;
    }

    public MediaStatus getMediaStatus(String mediaId) {
        requireConfigured();
        try {
            graphApiClient.getMedia(mediaId, "id", properties.getAccessToken());
            return MediaStatus.ACTIVE;
        } catch (FeignException error) {
            PlatformErrorClassifier.PlatformError classified = errorClassifier.classify(error);
            if (classified.getKind() == PlatformErrorClassifier.Kind.NOT_FOUND) {
                log.info("Media {} no longer exists on the platform", mediaId);
                return MediaStatus.NOT_FOUND;
            }
            throw errorClassifier.translate(error, "media status " + mediaId);
        }
    }

    /**
     * Public counters plus insights. Insights degrade through smaller metric sets because
     * older media do not support every metric.
     */
    public MediaMetrics getMetrics(String mediaId) {
        requireConfigured();
        Map<String, Object> media = call("media " + mediaId,
                () -> graphApiClient.getMedia(mediaId, METRIC_FIELDS, properties.getAccessToken()));

        MediaMetrics metrics = MediaMetrics.builder()
                .likes(asInteger(media.get("like_count")))
                .comments(asInteger(media.get("comments_count")))
                .permalink(asString(media.get("permalink")))
                .build();

        Map<String, Integer> insights = fetchInsights(mediaId);
        metrics.setImpressions(insights.get("impressions"));
        metrics.setReach(insights.get("reach"));
        metrics.setSaves(insights.get("saved"));
        metrics.setShares(insights.get("shares"));
        return metrics;
    }

    public List<RemoteMedia> listRecentMedia(int limit) {
        requireConfigured();
        int boundedLimit = Math.max(1, Math.min(limit, 100));
        Map<String, Object> response = call("media listing",
                () -> graphApiClient.listMedia(properties.getAccountId(), MEDIA_FIELDS, boundedLimit, properties.getAccessToken()));

        List<RemoteMedia> media = new ArrayList<>();
        Object data = response.get("data");
        if (data instanceof List) {
            for (Object item : (List<?>) data) {
                if (item instanceof Map) {
                    media.add(toRemoteMedia((Map<?, ?>) item));
                }
            }
        }
        log.debug("Fetched {} recent media items", media.size());
        return media;
    }

    private Map<String, Integer> fetchInsights(String mediaId) {
        RuntimeException lastError = null;
        for (String metricSet : INSIGHT_METRIC_SETS) {
            try {
                return parseInsights(graphApiClient.getInsights(mediaId, metricSet, properties.getAccessToken()));
            } catch (FeignException error) {
                RuntimeException translated = errorClassifier.translate(error, "insights " + mediaId);
                if (translated instanceof RateLimitException) {
                    throw translated;
                }
                log.debug("Insights [{}] unavailable for {}: {}", metricSet, mediaId, translated.getMessage());
                lastError = translated;
            }
        }
        log.warn("No insights available for media {}: {}", mediaId, lastError != null ? lastError.getMessage() : "-");
        return Map.of();
    }

    static Map<String, Integer> parseInsights(Map<String, Object> response) {
        Map<String, Integer> values = new LinkedHashMap<>();
        if (response == null || !(response.get("data") instanceof List)) {
            return values;
        }
        for (Object item : (List<?>) response.get("data")) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> metric = (Map<?, ?>) item;
            String name = asString(metric.get("name"));
            Integer value = null;
            Object total = metric.get("total_value");
            Object series = metric.get("values");
            if (total instanceof Map) {
                value = asInteger(((Map<?, ?>) total).get("value"));
            } else if (series instanceof List && !((List<?>) series).isEmpty()
                    && ((List<?>) series).get(0) instanceof Map) {
                value = asInteger(((Map<?, ?>) ((List<?>) series).get(0)).get("value"));
            }
            if (name != null && value != null) {
                values.put(name, value);
            }
        }
        return values;
    }

    private String createContainer(Map<String, String> params) {
        Map<String, Object> response = call("container creation",
                () -> graphApiClient.createContainer(properties.getAccountId(), params));
        String id = asString(response.get("id"));
        if (id == null) {
            throw new RemotePlatformException("Container creation returned no id", 0, null, null);
        }
        return id;
    }

    private void awaitContainer(String containerId) {
        for (int attempt = 1; attempt <= properties.getContainerPollAttempts(); attempt++) {
            Map<String, Object> status = call("container status",
                    () -> graphApiClient.getContainerStatus(containerId, "status_code", properties.getAccessToken()));
            String code = asString(status.get("status_code"));
            if ("FINISHED".equals(code)) {
                return;
            }
            if ("ERROR".equals(code) || "EXPIRED".equals(code)) {
                throw new RemotePlatformException("Container " + containerId + " ended in " + code, 0, null, null);
            }
            log.debug("Container {} is {} (attempt {}/{})", containerId, code, attempt, properties.getContainerPollAttempts());
            pause(properties.getContainerPollIntervalMs());
        }
        throw new RemotePlatformException("Container " + containerId + " was not ready after "
                + properties.getContainerPollAttempts() + " checks", 0, null, null);
    }

    private Map<String, Object> call(String operation, GraphCall graphCall) {
        try {
            Map<String, Object> response = graphCall.execute();
            return response == null ? Map.of() : response;
        } catch (FeignException error) {
            throw errorClassifier.translate(error, operation);
        }
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new RemotePlatformException("Platform credentials are not configured", 0, null, null);
        }
    }

    private Map<String, String> baseParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_token", properties.getAccessToken());
        return params;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemotePlatformException("Interrupted while waiting for the media container", 0, null, e);
        }
    }

    private static RemoteMedia toRemoteMedia(Map<?, ?> entry) {
        return RemoteMedia.builder()
                .id(asString(entry.get("id")))
                .caption(asString(entry.get("caption")))
                .timestamp(parseTimestamp(asString(entry.get("timestamp"))))
                .mediaType(asString(entry.get("media_type")))
                .mediaProductType(asString(entry.get("media_product_type")))
                .permalink(asString(entry.get("permalink")))
                .build();
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw, GRAPH_TIMESTAMP).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException fallback) {
                log.warn("Unparseable media timestamp: {}", raw);
                return null;
            }
        }
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    @FunctionalInterface
    private interface GraphCall {
        Map<String, Object> execute();
    }
}
