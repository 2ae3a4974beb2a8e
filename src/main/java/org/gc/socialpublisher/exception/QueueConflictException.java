package org.gc.socialpublisher.exception;

/**
 * Operation not allowed in the current state (non-pending removal, illegal queue transition,
 * pipeline busy). No state is changed when this is thrown.
 */
public class QueueConflictException extends RuntimeException {

    public QueueConflictException(String message) {
        super(message);
    }
}
