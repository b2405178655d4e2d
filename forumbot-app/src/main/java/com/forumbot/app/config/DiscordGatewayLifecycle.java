package com.forumbot.app.config;

import com.forumbot.channel.discord.DiscordForumListener;
import com.forumbot.channel.forum.ThreadLinkStore;
import com.forumbot.common.config.ForumBotConfig;
import com.forumbot.common.config.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches the forum listener once the context is ready, then waits for the
 * gateway session and logs what the bot is watching.
 */
@Slf4j
@Component
public class DiscordGatewayLifecycle {

    private final JDA jda;
    private final DiscordForumListener listener;
    private final ForumBotConfig config;
    private final ThreadLinkStore linkStore;

    public DiscordGatewayLifecycle(JDA jda, DiscordForumListener listener, ForumBotConfig config,
            ThreadLinkStore linkStore) {
        this.jda = jda;
        this.listener = listener;
        this.config = config;
        this.linkStore = linkStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        jda.addEventListener(listener);
        try {
            jda.awaitReady();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the gateway session");
            return;
        }
        String botUser = jda.getSelfUser().getName() + " (" + jda.getSelfUser().getId() + ")";
        for (String line : startupSummary(botUser, config, linkStore.size())) {
            log.info(line);
        }
        if (config.getSourceChannelIds().isEmpty()) {
            log.warn("SOURCE_TEXT_CHANNEL_IDS is empty, no message will create threads");
        }
    }

    static List<String> startupSummary(String botUser, ForumBotConfig config, int linkedMessages) {
        List<String> lines = new ArrayList<>();
        lines.add("Logged in as " + botUser);
        lines.add("Source channels: " + config.getSourceChannelIds());
        for (RoutingTable.RoleRoute route : config.getRoutingTable().routes()) {
            lines.add("Route " + route.label() + ": role " + route.roleId() + " -> forums " + route.forumIds());
        }
        lines.add("Default forums: " + config.getRoutingTable().defaultForumIds());
        lines.add("Thread links: " + linkedMessages + " messages in " + config.getLinksFile());
        return lines;
    }
}
