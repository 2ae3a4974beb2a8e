package org.gc.socialpublisher.exception;

/**
 * Content generation or publishing failed. The message is the human readable summary that
 * ends up on the queue entry or post record.
 */
public class PipelineFailureException extends RuntimeException {

    private final String tag;
    private final String code;

    public PipelineFailureException(String message) {
        this(message, "pipeline_failure", null, null);
    }

    public PipelineFailureException(String message, Throwable cause) {
        this(message, "pipeline_failure", null, cause);
    }

    public PipelineFailureException(String message, String tag, String code, Throwable cause) {
        super(message, cause);
        this.tag = tag;
        this.code = code;
    }

    public String getTag() {
        return tag;
    }

    public String getCode() {
        return code;
    }
}
