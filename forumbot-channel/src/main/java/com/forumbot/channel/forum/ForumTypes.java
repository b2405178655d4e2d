package com.forumbot.channel.forum;

import java.util.List;

/**
 * Value types shared by the forum handlers and the platform seam.
 */
public final class ForumTypes {

    private ForumTypes() {
    }

    // =========================================================================
    // Creation outcome
    // =========================================================================

    public enum CreationStatus {
        /** Bot author, DM, or a channel that is not watched. */
        IGNORED,
        /** The source message was deleted before creation started. */
        SOURCE_DELETED,
        /** Routing produced no forum that exists in the guild. */
        NO_ELIGIBLE_FORUM,
        /** Every target forum was processed (individual forums may still fail). */
        PROCESSED
    }

    public enum ForumResult {
        CREATED, SKIPPED_EXISTING, SKIPPED_SOURCE_DELETED, FAILED
    }

    public record ForumOutcome(long forumId, String forumName, ForumResult result,
            Long threadId, String detail) {
    }

    public record CreationReport(long messageId, CreationStatus status, String threadName,
            List<ForumOutcome> forums) {

        public CreationReport {
            forums = forums != null ? List.copyOf(forums) : List.of();
        }

        static CreationReport of(long messageId, CreationStatus status) {
            return new CreationReport(messageId, status, null, List.of());
        }

        public long count(ForumResult result) {
            return forums.stream().filter(f -> f.result() == result).count();
        }
    }

    // =========================================================================
    // Deletion outcome
    // =========================================================================

    public enum ThreadResult {
        DELETED, ALREADY_GONE, NOT_A_THREAD, FAILED
    }

    public record ThreadOutcome(long threadId, ThreadResult result, String detail) {
    }

    public record DeletionReport(long messageId, List<ThreadOutcome> threads) {

        public DeletionReport {
            threads = threads != null ? List.copyOf(threads) : List.of();
        }

        public boolean isEmpty() {
            return threads.isEmpty();
        }
    }
}
