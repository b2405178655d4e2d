package com.forumbot.channel.forum;

import com.forumbot.channel.forum.ForumTypes.CreationReport;
import com.forumbot.channel.forum.ForumTypes.CreationStatus;
import com.forumbot.channel.forum.ForumTypes.DeletionReport;
import com.forumbot.channel.forum.ForumTypes.ForumOutcome;
import com.forumbot.channel.forum.ForumTypes.ForumResult;
import com.forumbot.channel.forum.ForumTypes.ThreadOutcome;
import com.forumbot.channel.forum.ForumTypes.ThreadResult;
import com.forumbot.common.config.ForumBotConfig;
import com.forumbot.common.infra.ErrorUtils;
import com.forumbot.common.infra.ExpiringIdSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Message-created and message-deleted handlers.
 * <p>
 * Creation routes the author to forums, skips forums where the author already
 * owns a thread, creates the rest and links each new thread to the source
 * message. Deletion pops those links and deletes the threads. Each forum and
 * each thread is an independent unit: one failure never stops the others.
 * <p>
 * A deletion can overtake a creation still in flight. Deleted message ids are
 * remembered for a while; creation checks them before creating and after
 * linking, and cleans up its own threads if the source is already gone.
 * <p>
 * Creations by the same author run one at a time, so two quick posts cannot
 * both miss the other's thread and open duplicates. Authors are mapped onto a
 * fixed set of locks; unrelated authors sharing a lock only wait.
 */
@Slf4j
public class ForumPostHandlers {

    public static final Duration DELETION_MEMORY = Duration.ofMinutes(15);
    static final int DELETION_MEMORY_SIZE = 10_000;
    static final int AUTHOR_LOCK_STRIPES = 64;

    private final ForumBotConfig config;
    private final ForumPlatform platform;
    private final ThreadOwnershipResolver resolver;
    private final ThreadLinkStore linkStore;
    private final ExpiringIdSet deletedMessages;
    private final Clock clock;
    private final ReentrantLock[] authorLocks = new ReentrantLock[AUTHOR_LOCK_STRIPES];

    public ForumPostHandlers(ForumBotConfig config, ForumPlatform platform, ThreadLinkStore linkStore) {
        this(config, platform, new ThreadOwnershipResolver(platform), linkStore,
                new ExpiringIdSet(DELETION_MEMORY.toMillis(), DELETION_MEMORY_SIZE), Clock.systemUTC());
    }

    public ForumPostHandlers(ForumBotConfig config, ForumPlatform platform, ThreadOwnershipResolver resolver,
            ThreadLinkStore linkStore, ExpiringIdSet deletedMessages, Clock clock) {
        this.config = config;
        this.platform = platform;
        this.resolver = resolver;
        this.linkStore = linkStore;
        this.deletedMessages = deletedMessages;
        this.clock = clock;
        for (int i = 0; i < authorLocks.length; i++) {
            authorLocks[i] = new ReentrantLock();
        }
    }

    // =========================================================================
    // Creation
    // =========================================================================

    /**
     * Handle a newly posted message.
     */
    public CreationReport handleMessageCreated(TriggerMessage message) {
        long messageId = message.getMessageId();
        if (message.isAuthorBot() || !message.isFromGuild())
            return CreationReport.of(messageId, CreationStatus.IGNORED);
        if (!config.isSourceChannel(message.getChannelId()))
            return CreationReport.of(messageId, CreationStatus.IGNORED);
        if (deletedMessages.contains(messageId)) {
            log.info("Message {} was deleted before its threads were created, ignoring", messageId);
            return CreationReport.of(messageId, CreationStatus.SOURCE_DELETED);
        }

        ReentrantLock authorLock = authorLock(message.getAuthorId());
        authorLock.lock();
        try {
            return createForAuthor(message);
        } finally {
            authorLock.unlock();
        }
    }

    private CreationReport createForAuthor(TriggerMessage message) {
        long messageId = message.getMessageId();
        long guildId = message.getGuildId();
        List<ForumRef> forums = ForumRouter.route(message.getAuthorRoleIds(), config.getRoutingTable(),
                forumId -> platform.resolveForum(guildId, forumId));
        if (forums.isEmpty()) {
            log.error("No eligible forum for {} ({}) in guild {}, check the role forum lists and DEFAULT_FORUM_IDS",
                    message.getAuthorDisplayName(), message.getAuthorId(), guildId);
            return CreationReport.of(messageId, CreationStatus.NO_ELIGIBLE_FORUM);
        }

        String displayName = message.getAuthorDisplayName();
        Instant createdAt = message.getCreatedAt() != null ? message.getCreatedAt() : clock.instant();
        String threadName = ForumThreadNames.threadName(displayName, createdAt);
        String body = message.getPermalink();
        String reason = String.format("Triggered by message in #%s from %s (%d)",
                message.getChannelName(), message.getAuthorTag(), message.getAuthorId());

        List<ForumOutcome> outcomes = new ArrayList<>();
        for (ForumRef forum : forums) {
            outcomes.add(createInForum(messageId, forum, displayName, threadName, body, reason));
        }

        if (outcomes.stream().anyMatch(o -> o.result() == ForumResult.CREATED)
                && deletedMessages.contains(messageId)) {
            log.info("Message {} was deleted while its threads were being created, cleaning up", messageId);
            cascadeDelete(messageId);
        }
        return new CreationReport(messageId, CreationStatus.PROCESSED, threadName, outcomes);
    }

    private ReentrantLock authorLock(long authorId) {
        return authorLocks[Math.floorMod(Long.hashCode(authorId), authorLocks.length)];
    }

    private ForumOutcome createInForum(long messageId, ForumRef forum, String displayName,
            String threadName, String body, String reason) {
        if (deletedMessages.contains(messageId)) {
            return new ForumOutcome(forum.id(), forum.name(), ForumResult.SKIPPED_SOURCE_DELETED, null,
                    "source message deleted");
        }
        try {
            Optional<ForumThread> existing = resolver.findExisting(forum, displayName);
            if (existing.isPresent()) {
                log.info("Skipping forum '{}': {} already has thread '{}' ({})",
                        forum.name(), displayName, existing.get().name(), existing.get().id());
                return new ForumOutcome(forum.id(), forum.name(), ForumResult.SKIPPED_EXISTING,
                        existing.get().id(), existing.get().name());
            }

            ForumThread created = platform.createThread(forum, threadName, body, reason);
            linkStore.add(messageId, created.id());
            log.info("Created thread '{}' ({}) in forum '{}' for message {}",
                    created.name(), created.id(), forum.name(), messageId);
            return new ForumOutcome(forum.id(), forum.name(), ForumResult.CREATED, created.id(), created.name());
        } catch (ForumPlatformException e) {
            log.error("Failed to create thread in forum '{}' ({}) [{}]: {}",
                    forum.name(), forum.id(), e.getFailure(), ErrorUtils.formatErrorMessage(e), e);
            return new ForumOutcome(forum.id(), forum.name(), ForumResult.FAILED, null,
                    e.getFailure() + ": " + ErrorUtils.formatErrorMessage(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error creating thread in forum '{}' ({}): {}",
                    forum.name(), forum.id(), ErrorUtils.formatErrorMessage(e), e);
            return new ForumOutcome(forum.id(), forum.name(), ForumResult.FAILED, null,
                    ErrorUtils.formatErrorMessage(e));
        }
    }

    // =========================================================================
    // Deletion
    // =========================================================================

    /**
     * Handle a deleted message. Only the id is needed, so this works for
     * messages that were never cached.
     */
    public DeletionReport handleMessageDeleted(long messageId) {
        deletedMessages.mark(messageId);
        return cascadeDelete(messageId);
    }

    private DeletionReport cascadeDelete(long messageId) {
        List<Long> threadIds = linkStore.popAll(messageId);
        if (threadIds.isEmpty())
            return new DeletionReport(messageId, List.of());

        String reason = String.format("Source message %d deleted; auto-clean thread.", messageId);
        List<ThreadOutcome> outcomes = new ArrayList<>();
        for (long threadId : threadIds) {
            outcomes.add(deleteThread(messageId, threadId, reason));
        }
        return new DeletionReport(messageId, outcomes);
    }

    private ThreadOutcome deleteThread(long messageId, long threadId, String reason) {
        try {
            Optional<ChannelInfo> channel = platform.fetchChannel(threadId);
            if (channel.isEmpty()) {
                log.info("Thread {} not found (already deleted?)", threadId);
                return new ThreadOutcome(threadId, ThreadResult.ALREADY_GONE, "not found");
            }
            if (!channel.get().thread()) {
                log.warn("Channel {} linked to message {} is not a thread, leaving it", threadId, messageId);
                return new ThreadOutcome(threadId, ThreadResult.NOT_A_THREAD, channel.get().name());
            }
            platform.deleteThread(threadId, reason);
            log.info("Deleted thread {} because source message {} was deleted", threadId, messageId);
            return new ThreadOutcome(threadId, ThreadResult.DELETED, channel.get().name());
        } catch (ForumPlatformException e) {
            if (e.isNotFound()) {
                log.info("Thread {} not found (already deleted?)", threadId);
                return new ThreadOutcome(threadId, ThreadResult.ALREADY_GONE, "not found");
            }
            log.error("Failed to delete thread {} [{}]: {}",
                    threadId, e.getFailure(), ErrorUtils.formatErrorMessage(e), e);
            return new ThreadOutcome(threadId, ThreadResult.FAILED,
                    e.getFailure() + ": " + ErrorUtils.formatErrorMessage(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error deleting thread {}: {}", threadId, ErrorUtils.formatErrorMessage(e), e);
            return new ThreadOutcome(threadId, ThreadResult.FAILED, ErrorUtils.formatErrorMessage(e));
        }
    }
}
