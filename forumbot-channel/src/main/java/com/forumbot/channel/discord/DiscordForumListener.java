package com.forumbot.channel.discord;

import com.forumbot.channel.forum.ForumPostHandlers;
import com.forumbot.channel.forum.ForumTypes.CreationReport;
import com.forumbot.channel.forum.ForumTypes.DeletionReport;
import com.forumbot.channel.forum.TriggerMessage;
import com.forumbot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.entities.ISnowflake;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.MessageBulkDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Gateway listener. Converts JDA events into handler calls and runs them on a
 * worker pool, keeping blocking REST calls off the JDA event thread.
 */
@Slf4j
public class DiscordForumListener extends ListenerAdapter {

    private final ForumPostHandlers handlers;
    private final ExecutorService workers;

    public DiscordForumListener(ForumPostHandlers handlers, int workerThreads) {
        this(handlers, newWorkerPool(workerThreads));
    }

    DiscordForumListener(ForumPostHandlers handlers, ExecutorService workers) {
        this.handlers = handlers;
        this.workers = workers;
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (!event.isFromGuild() || event.getAuthor().isBot())
            return;
        TriggerMessage trigger = toTrigger(event);
        submit("message " + trigger.getMessageId(), () -> {
            CreationReport report = handlers.handleMessageCreated(trigger);
            log.debug("Creation for message {}: {}", report.messageId(), report);
        });
    }

    @Override
    public void onMessageDelete(MessageDeleteEvent event) {
        long messageId = event.getMessageIdLong();
        submit("deletion of " + messageId, () -> logDeletion(handlers.handleMessageDeleted(messageId)));
    }

    @Override
    public void onMessageBulkDelete(MessageBulkDeleteEvent event) {
        for (String id : event.getMessageIds()) {
            long messageId = Long.parseLong(id);
            submit("deletion of " + messageId, () -> logDeletion(handlers.handleMessageDeleted(messageId)));
        }
    }

    /**
     * Stop accepting events and wait briefly for in-flight work.
     */
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not finish in time, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // =========================================================================
    // Internal helpers
    // =========================================================================

    static TriggerMessage toTrigger(MessageReceivedEvent event) {
        Message message = event.getMessage();
        User author = event.getAuthor();
        Member member = event.getMember();
        Set<Long> roleIds = member == null ? Set.of()
                : member.getRoles().stream().map(ISnowflake::getIdLong).collect(Collectors.toUnmodifiableSet());
        return TriggerMessage.builder()
                .messageId(message.getIdLong())
                .channelId(event.getChannel().getIdLong())
                .channelName(event.getChannel().getName())
                .guildId(event.getGuild().getIdLong())
                .authorId(author.getIdLong())
                .authorDisplayName(member != null ? member.getEffectiveName() : author.getEffectiveName())
                .authorTag(author.getName())
                .authorRoleIds(roleIds)
                .authorBot(author.isBot())
                .createdAt(message.getTimeCreated().toInstant())
                .permalink(message.getJumpUrl())
                .build();
    }

    private void logDeletion(DeletionReport report) {
        if (!report.isEmpty())
            log.info("Deletion cascade for message {}: {}", report.messageId(), report.threads());
    }

    private void submit(String what, Runnable task) {
        try {
            workers.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unhandled error while processing {}: {}", what, ErrorUtils.formatErrorMessage(e), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dropping {}: worker pool is shut down", what);
        }
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "forumbot-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
