package org.gc.socialpublisher.exception;

import org.gc.socialpublisher.domain.PostStatus;

public class IllegalPostTransitionException extends RuntimeException {

    private final PostStatus from;
    private final PostStatus to;

    public IllegalPostTransitionException(Long postId, PostStatus from, PostStatus to) {
        super("Post " + postId + " cannot move from " + from.wireName() + " to " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public PostStatus getFrom() {
        return from;
    }

    public PostStatus getTo() {
        return to;
    }
}
