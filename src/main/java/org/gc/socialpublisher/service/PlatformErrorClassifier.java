package org.gc.socialpublisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.exception.PipelineFailureException;
import org.gc.socialpublisher.exception.RateLimitException;
import org.gc.socialpublisher.exception.RemotePlatformException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns Graph API failures into a tag, a short operator-facing summary and a recoverability flag.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformErrorClassifier {

    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 17, 32, 613);
    private static final int SUBCODE_REQUEST_LIMIT = 2207051;
    private static final int SUBCODE_FATAL_AFTER_LIMIT = 2207085;
    private static final int CODE_INVALID_TOKEN = 190;
    private static final int CODE_INVALID_PARAMETER = 100;
    private static final int SUBCODE_OBJECT_MISSING = 33;
    private static final Pattern CODE_PATTERN = Pattern.compile("code=(-?\\d+)");
    private static final Pattern SUBCODE_PATTERN = Pattern.compile("subcode=(\\d+)");

    private final ObjectMapper objectMapper;

    public enum Kind {
        RATE_LIMIT("meta_rate_limit", "Platform applied a temporary request limit. Wait a few minutes and retry."),
        FATAL_AFTER_LIMIT("meta_fatal_after_limit", "Platform returned a fatal error right after a rate limit. Retry later."),
        AUTH("meta_auth", "Platform token or permissions are invalid or expired."),
        INVALID_MEDIA_URL("image_url_invalid", "Platform cannot read the public slide images. Check the public image base URL."),
        NOT_FOUND("media_not_found", "Media no longer exists on the platform."),
        TRANSIENT("meta_transient", "Platform had a transient failure."),
        UNKNOWN("publish_unknown", null);

        private final String tag;
        private final String summary;

        Kind(String tag, String summary) {
            this.tag = tag;
            this.summary = summary;
        }

        public String tag() {
            return tag;
        }

        /** Throttling family: back off and retry rather than fail permanently. */
        public boolean isRateLimited() {
            return this == RATE_LIMIT || this == FATAL_AFTER_LIMIT;
        }
    }

    @Data
    @Builder
    @AllArgsConstructor
    public static class PlatformError {
        private Kind kind;
        private String summary;
        private String code;
        private int httpStatus;
        private Long retryAfterSeconds;
        private String detail;

        public String getTag() {
            return kind.tag();
        }
    }

    public PlatformError classify(Throwable error) {
        if (error instanceof RateLimitException) {
            RateLimitException rateLimit = (RateLimitException) error;
            return build(Kind.RATE_LIMIT, rateLimit.getCode(), 429, rateLimit.getRetryAfterSeconds(), rateLimit.getMessage());
        }
        if (error instanceof RemotePlatformException) {
            RemotePlatformException remote = (RemotePlatformException) error;
            return classifyText(remote.getMessage(), remote.getHttpStatus());
        }
        if (error instanceof PipelineFailureException) {
            PlatformError classified = classifyText(error.getMessage(), 0);
            if (classified.getKind() == Kind.UNKNOWN) {
                classified.setSummary(abbreviate(error.getMessage(), 220));
            }
            return classified;
        }
        if (error instanceof FeignException) {
            return classifyFeign((FeignException) error);
        }
        return classifyText(error.getMessage(), 0);
    }

    /**
     * Converts a raw client failure into the exception type callers branch on.
     */
    public RuntimeException translate(Throwable error, String operation) {
        PlatformError classified = classify(error);
        String message = operation + " failed: " + classified.getSummary();
        if (classified.getKind().isRateLimited()) {
            return new RateLimitException(message, classified.getCode(), classified.getRetryAfterSeconds(), error);
        }
        return new RemotePlatformException(message + describeDetail(classified), classified.getHttpStatus(),
                classified.getCode(), error);
    }

    PlatformError classifyFeign(FeignException error) {
        int status = error.status();
        String body = error.contentUTF8();
        Integer code = null;
        Integer subcode = null;
        boolean transientFlag = false;
        String message = null;

        if (body != null && !body.isBlank()) {
            try {
                JsonNode root = objectMapper.readTree(body);
                JsonNode err = root.path("error");
                if (err.isObject()) {
                    code = err.hasNonNull("code") ? err.get("code").asInt() : null;
                    subcode = err.hasNonNull("error_subcode") ? err.get("error_subcode").asInt() : null;
                    transientFlag = err.path("is_transient").asBoolean(false);
                    message = err.path("message").asText(null);
                }
            } catch (Exception parseError) {
                log.debug("Graph API error body is not JSON: {}", abbreviate(body, 200));
            }
        }

        String detail = "HTTP " + status + (message != null ? " | " + message : "")
                + (code != null ? " | code=" + code : "")
                + (subcode != null ? " | subcode=" + subcode : "");
        String codeText = formatCode(code, subcode);
        Long retryAfter = retryAfterSeconds(error.responseHeaders());
        String lowered = detail.toLowerCase(Locale.ROOT);

        Kind kind;
        if (status == 429 || (code != null && RATE_LIMIT_CODES.contains(code))
                || (subcode != null && subcode == SUBCODE_REQUEST_LIMIT)
                || lowered.contains("application request limit reached")) {
            kind = Kind.RATE_LIMIT;
        } else if (subcode != null && subcode == SUBCODE_FATAL_AFTER_LIMIT) {
            kind = Kind.FATAL_AFTER_LIMIT;
        } else if (status == 401 || (code != null && code == CODE_INVALID_TOKEN)) {
            kind = Kind.AUTH;
        } else if (status == 404 || (code != null && code == CODE_INVALID_PARAMETER
                && subcode != null && subcode == SUBCODE_OBJECT_MISSING)
                || lowered.contains("does not exist")) {
            kind = Kind.NOT_FOUND;
        } else if (lowered.contains("image url is not valid")) {
            kind = Kind.INVALID_MEDIA_URL;
        } else if (status >= 500 || transientFlag) {
            kind = Kind.TRANSIENT;
        } else {
            kind = Kind.UNKNOWN;
        }
        return build(kind, codeText, status, retryAfter, detail);
    }

    PlatformError classifyText(String rawError, int httpStatus) {
        String text = rawError == null ? "" : rawError.strip();
        String lowered = text.toLowerCase(Locale.ROOT);
        String code = extractCode(text);

        Kind kind;
        if (lowered.contains("application request limit reached") || text.contains(String.valueOf(SUBCODE_REQUEST_LIMIT))) {
            kind = Kind.RATE_LIMIT;
        } else if (text.contains(String.valueOf(SUBCODE_FATAL_AFTER_LIMIT)) && lowered.contains("fatal")) {
            kind = Kind.FATAL_AFTER_LIMIT;
        } else if (lowered.contains("image url is not valid")) {
            kind = Kind.INVALID_MEDIA_URL;
        } else if (lowered.contains("unauthorized") || text.contains("code=" + CODE_INVALID_TOKEN)) {
            kind = Kind.AUTH;
        } else if (lowered.contains("media_not_found") || lowered.contains("does not exist")) {
            kind = Kind.NOT_FOUND;
        } else {
            kind = Kind.UNKNOWN;
        }
        return build(kind, code, httpStatus, null, text);
    }

    private PlatformError build(Kind kind, String code, int httpStatus, Long retryAfter, String detail) {
        String summary = kind.summary != null ? kind.summary : abbreviate(detail, 220);
        return PlatformError.builder()
                .kind(kind)
                .summary(summary)
                .code(code)
                .httpStatus(httpStatus)
                .retryAfterSeconds(retryAfter)
                .detail(detail == null ? null : abbreviate(detail, 1800))
                .build();
    }

    private static String describeDetail(PlatformError classified) {
        if (classified.getKind() == Kind.UNKNOWN || classified.getDetail() == null) {
            return "";
        }
        return " (" + abbreviate(classified.getDetail(), 300) + ")";
    }

    private static String extractCode(String text) {
        Matcher codeMatch = CODE_PATTERN.matcher(text);
        Matcher subcodeMatch = SUBCODE_PATTERN.matcher(text);
        String code = codeMatch.find() ? codeMatch.group(1) : null;
        String subcode = subcodeMatch.find() ? subcodeMatch.group(1) : null;
        if (code != null && subcode != null) {
            return code + ":" + subcode;
        }
        return code != null ? code : subcode;
    }

    private static String formatCode(Integer code, Integer subcode) {
        if (code != null && subcode != null) {
            return code + ":" + subcode;
        }
        if (code != null) {
            return String.valueOf(code);
        }
        return subcode != null ? String.valueOf(subcode) : null;
    }

    private static Long retryAfterSeconds(Map<String, Collection<String>> headers) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, Collection<String>> header : headers.entrySet()) {
            if (!"retry-after".equalsIgnoreCase(header.getKey()) || header.getValue() == null) {
                continue;
            }
            for (String value : header.getValue()) {
                try {
                    return (long) Math.ceil(Double.parseDouble(value.trim()));
                } catch (NumberFormatException ignored) {
                    log.debug("Ignoring non-numeric Retry-After header: {}", value);
                }
            }
        }
        return null;
    }

    static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }
}
