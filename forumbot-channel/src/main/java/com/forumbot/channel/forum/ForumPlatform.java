package com.forumbot.channel.forum;

import java.util.List;
import java.util.Optional;

/**
 * Outbound operations the forum handlers need from the chat platform.
 * <p>
 * Every operation may throw {@link ForumPlatformException}; callers decide per
 * operation whether that aborts a single unit of work or is swallowed.
 */
public interface ForumPlatform {

    /**
     * Resolve a configured id to a forum channel of the given guild.
     *
     * @return empty if the id is unknown, belongs to another guild, or is not a
     *         forum
     */
    Optional<ForumRef> resolveForum(long guildId, long forumId);

    /**
     * Currently active (non-archived) threads, in the platform's order.
     */
    List<ForumThread> listActiveThreads(ForumRef forum);

    /**
     * Archived threads, fetched lazily page by page, at most {@code limit}.
     * Iteration may throw.
     */
    Iterable<ForumThread> listArchivedThreads(ForumRef forum, int limit);

    /**
     * Create a thread (forum post) whose starter message is {@code body}.
     */
    ForumThread createThread(ForumRef forum, String name, String body, String reason);

    /**
     * Look a channel up by id, bypassing any local cache if needed.
     *
     * @return empty if the platform reports the channel as unknown
     */
    Optional<ChannelInfo> fetchChannel(long channelId);

    /**
     * Delete a thread. A thread that no longer exists surfaces as
     * {@link ForumPlatformException.Failure#NOT_FOUND}.
     */
    void deleteThread(long threadId, String reason);
}
