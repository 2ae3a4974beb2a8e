package org.gc.socialpublisher.domain.dto;

public enum MediaStatus {
    ACTIVE,
    NOT_FOUND
}
