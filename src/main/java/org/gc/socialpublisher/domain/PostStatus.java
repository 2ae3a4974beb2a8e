package org.gc.socialpublisher.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a produced post. The transition graph is closed: anything not listed in
 * {@link #successors()} is rejected by the post store.
 */
public enum PostStatus {
    DRAFT,
    GENERATED,
    PUBLISHED_ACTIVE,
    PUBLISHED_DELETED,
    PUBLISH_ERROR;

    public Set<PostStatus> successors() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PUBLISHED_ACTIVE, GENERATED);
            case GENERATED -> EnumSet.of(PUBLISHED_ACTIVE, PUBLISH_ERROR);
            case PUBLISH_ERROR -> EnumSet.of(PUBLISHED_ACTIVE, PUBLISH_ERROR);
            case PUBLISHED_ACTIVE -> EnumSet.of(PUBLISHED_DELETED);
            case PUBLISHED_DELETED -> EnumSet.noneOf(PostStatus.class);
        };
    }

    public boolean canTransitionTo(PostStatus target) {
        return successors().contains(target);
    }

    /** Statuses a retry-publish may start from. */
    public boolean isRetryable() {
        return this == GENERATED || this == PUBLISH_ERROR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PostStatus fromWireName(String value) {
        return PostStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
