package com.forumbot.channel.discord;

import com.forumbot.channel.forum.ChannelInfo;
import com.forumbot.channel.forum.ForumPlatform;
import com.forumbot.channel.forum.ForumPlatformException;
import com.forumbot.channel.forum.ForumPlatformException.Failure;
import com.forumbot.channel.forum.ForumRef;
import com.forumbot.channel.forum.ForumThread;
import com.forumbot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.concrete.ForumChannel;
import net.dv8tion.jda.api.entities.channel.concrete.ThreadChannel;
import net.dv8tion.jda.api.entities.channel.forums.ForumPost;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.exceptions.PermissionException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * {@link ForumPlatform} backed by a logged-in JDA session. Blocking calls
 * ({@code complete()}), so callers must run off the JDA event thread.
 * Threads missing from the gateway cache are fetched and deleted through
 * {@link DiscordRestClient}.
 */
@Slf4j
public class JdaForumPlatform implements ForumPlatform {

    /** Discord's maximum page size for archived thread listing. */
    static final int ARCHIVED_PAGE_SIZE = 100;

    private final JDA jda;
    private final DiscordRestClient rest;

    public JdaForumPlatform(JDA jda, DiscordRestClient rest) {
        this.jda = jda;
        this.rest = rest;
    }

    @Override
    public Optional<ForumRef> resolveForum(long guildId, long forumId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null)
            return Optional.empty();
        ForumChannel forum = guild.getForumChannelById(forumId);
        if (forum == null)
            return Optional.empty();
        return Optional.of(new ForumRef(forum.getIdLong(), guildId, forum.getName()));
    }

    @Override
    public List<ForumThread> listActiveThreads(ForumRef forum) {
        return requireForum(forum).getThreadChannels().stream()
                .filter(thread -> !thread.isArchived())
                .map(JdaForumPlatform::toForumThread)
                .toList();
    }

    @Override
    public Iterable<ForumThread> listArchivedThreads(ForumRef forum, int limit) {
        ForumChannel channel = requireForum(forum);
        return () -> new Iterator<>() {
            private final Iterator<ThreadChannel> pages = channel.retrieveArchivedPublicThreadChannels()
                    .limit(Math.min(Math.max(limit, 1), ARCHIVED_PAGE_SIZE))
                    .cache(false)
                    .iterator();
            private int returned;

            @Override
            public boolean hasNext() {
                if (returned >= limit)
                    return false;
                try {
                    return pages.hasNext();
                } catch (RuntimeException e) {
                    throw translate(e, "list archived threads of forum " + forum.id());
                }
            }

            @Override
            public ForumThread next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                returned++;
                return toForumThread(pages.next());
            }
        };
    }

    @Override
    public ForumThread createThread(ForumRef forum, String name, String body, String reason) {
        ForumChannel channel = requireForum(forum);
        try {
            ForumPost post = channel.createForumPost(name, MessageCreateData.fromContent(body))
                    .reason(reason)
                    .complete();
            return toForumThread(post.getThreadChannel());
        } catch (RuntimeException e) {
            throw translate(e, "create thread in forum " + forum.id());
        }
    }

    @Override
    public Optional<ChannelInfo> fetchChannel(long channelId) {
        ThreadChannel cached = jda.getThreadChannelById(channelId);
        if (cached != null)
            return Optional.of(new ChannelInfo(cached.getIdLong(), cached.getName(), true));
        GuildChannel other = jda.getGuildChannelById(channelId);
        if (other != null)
            return Optional.of(new ChannelInfo(other.getIdLong(), other.getName(),
                    other.getType().isThread()));
        log.debug("Channel {} is not cached, fetching through REST", channelId);
        return rest.fetchChannel(channelId);
    }

    @Override
    public void deleteThread(long threadId, String reason) {
        ThreadChannel cached = jda.getThreadChannelById(threadId);
        if (cached == null) {
            log.debug("Thread {} is not cached, deleting through REST", threadId);
            rest.deleteChannel(threadId, reason);
            return;
        }
        try {
            cached.delete().reason(reason).complete();
        } catch (RuntimeException e) {
            throw translate(e, "delete thread " + threadId);
        }
    }

    // =========================================================================
    // Internal helpers
    // =========================================================================

    private ForumChannel requireForum(ForumRef forum) {
        ForumChannel channel = jda.getForumChannelById(forum.id());
        if (channel == null)
            throw new DiscordApi.ApiError(Failure.NOT_FOUND, 404,
                    "Forum " + forum.id() + " is not in the cache");
        return channel;
    }

    static ForumThread toForumThread(ThreadChannel thread) {
        return new ForumThread(thread.getIdLong(), thread.getName(),
                thread.getParentChannel().getIdLong(), thread.isArchived());
    }

    /**
     * Map JDA failures onto {@link ForumPlatformException} kinds.
     */
    static ForumPlatformException translate(RuntimeException e, String what) {
        if (e instanceof ForumPlatformException platformError)
            return platformError;
        if (e instanceof InsufficientPermissionException missing)
            return new DiscordApi.ApiError(Failure.PERMISSION, 403,
                    what + ": missing permission " + missing.getPermission().getName(), e);
        if (e instanceof PermissionException)
            return new DiscordApi.ApiError(Failure.PERMISSION, 403, what + ": " + e.getMessage(), e);
        if (e instanceof ErrorResponseException response) {
            if (response.isServerError())
                return new DiscordApi.ApiError(Failure.TRANSPORT, 500, what + ": " + response.getMeaning(), e);
            Failure failure = response.getErrorResponse() == ErrorResponse.UNKNOWN_CHANNEL
                    ? Failure.NOT_FOUND
                    : DiscordApi.classify(0, response.getErrorCode());
            return new DiscordApi.ApiError(failure, 0,
                    what + ": " + response.getErrorCode() + " " + response.getMeaning(), e);
        }
        if (ErrorUtils.rootCause(e) instanceof IOException)
            return new DiscordApi.ApiError(Failure.TRANSPORT, 0, what + ": " + ErrorUtils.formatErrorMessage(e), e);
        return new DiscordApi.ApiError(Failure.UNKNOWN, 0, what + ": " + ErrorUtils.formatErrorMessage(e), e);
    }
}
