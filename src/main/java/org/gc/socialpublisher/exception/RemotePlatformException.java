package org.gc.socialpublisher.exception;

/**
 * Non-recoverable error reported by the remote platform.
 */
public class RemotePlatformException extends RuntimeException {

    private final int httpStatus;
    private final String code;

    public RemotePlatformException(String message, int httpStatus, String code, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }
}
