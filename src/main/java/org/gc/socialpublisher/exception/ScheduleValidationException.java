package org.gc.socialpublisher.exception;

/**
 * Malformed schedule or queue input. Rejected synchronously and never persisted.
 */
public class ScheduleValidationException extends RuntimeException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
