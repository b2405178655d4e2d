package com.forumbot.channel.forum;

/**
 * A platform call failed. {@link #getFailure()} drives how the handlers react.
 */
public class ForumPlatformException extends RuntimeException {

    public enum Failure {
        PERMISSION, NOT_FOUND, TRANSPORT, UNKNOWN
    }

    private final Failure failure;
    private final int status;

    public ForumPlatformException(Failure failure, int status, String message) {
        super(message);
        this.failure = failure;
        this.status = status;
    }

    public ForumPlatformException(Failure failure, int status, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.status = status;
    }

    public Failure getFailure() {
        return failure;
    }

    /** HTTP status when known, otherwise 0. */
    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return failure == Failure.NOT_FOUND;
    }
}
