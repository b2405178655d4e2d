package com.forumbot.app.config;

import com.forumbot.channel.discord.DiscordForumListener;
import com.forumbot.channel.discord.DiscordRestClient;
import com.forumbot.channel.discord.JdaForumPlatform;
import com.forumbot.channel.forum.ForumPlatform;
import com.forumbot.channel.forum.ForumPostHandlers;
import com.forumbot.channel.forum.ThreadLinkStore;
import com.forumbot.common.config.ForumBotConfig;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the gateway session and forum handlers.
 */
@Slf4j
@Configuration
public class ForumBotBeanConfig {

    @Bean
    public ThreadLinkStore threadLinkStore(ForumBotConfig config) {
        ThreadLinkStore store = new ThreadLinkStore(config.getLinksFile());
        store.load();
        log.info("Thread link store {} loaded ({} messages)", store.getFile(), store.size());
        return store;
    }

    /**
     * Starts logging in immediately; {@link DiscordGatewayLifecycle} waits for
     * READY.
     */
    @Bean(destroyMethod = "shutdown")
    public JDA jda(ForumBotConfig config) {
        return JDABuilder.createLight(config.getToken(), GatewayIntent.GUILD_MESSAGES, GatewayIntent.GUILD_MEMBERS)
                .build();
    }

    @Bean
    public DiscordRestClient discordRestClient(ForumBotConfig config) {
        return new DiscordRestClient(config.getToken());
    }

    @Bean
    public ForumPlatform forumPlatform(JDA jda, DiscordRestClient discordRestClient) {
        return new JdaForumPlatform(jda, discordRestClient);
    }

    @Bean
    public ForumPostHandlers forumPostHandlers(ForumBotConfig config, ForumPlatform forumPlatform,
            ThreadLinkStore threadLinkStore) {
        return new ForumPostHandlers(config, forumPlatform, threadLinkStore);
    }

    @Bean(destroyMethod = "shutdown")
    public DiscordForumListener discordForumListener(ForumPostHandlers forumPostHandlers, ForumBotConfig config) {
        return new DiscordForumListener(forumPostHandlers, config.getWorkerThreads());
    }
}
