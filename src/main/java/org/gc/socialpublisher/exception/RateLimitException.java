package org.gc.socialpublisher.exception;

/**
 * The remote platform throttled the call. Recoverable: callers back off and retry instead of
 * marking the work as permanently failed.
 */
public class RateLimitException extends RuntimeException {

    private final String code;
    private final Long retryAfterSeconds;

    public RateLimitException(String message, String code, Long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getCode() {
        return code;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
