package org.gc.socialpublisher.exception;

public class EntryNotFoundException extends RuntimeException {

    public EntryNotFoundException(String kind, Object id) {
        super(kind + " " + id + " not found");
    }
}
