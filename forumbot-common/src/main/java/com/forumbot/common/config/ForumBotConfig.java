package com.forumbot.common.config;

import com.forumbot.common.logging.LogLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.List;

/**
 * Process-wide settings, built once by {@link ForumBotConfigLoader}.
 */
@Getter
@Builder
@ToString(exclude = "token")
public class ForumBotConfig {

    public static final Path DEFAULT_LINKS_FILE = Path.of("data", "thread_links.json");
    public static final int DEFAULT_WORKER_THREADS = 4;

    /** Bot token with any "Bot " prefix removed. */
    private final String token;

    /** Channels whose messages trigger thread creation. */
    @Builder.Default
    private final List<Long> sourceChannelIds = List.of();

    @Builder.Default
    private final RoutingTable routingTable = RoutingTable.empty();

    /** Message → thread link store location. */
    @Builder.Default
    private final Path linksFile = DEFAULT_LINKS_FILE;

    @Builder.Default
    private final LogLevel logLevel = LogLevel.INFO;

    @Builder.Default
    private final int workerThreads = DEFAULT_WORKER_THREADS;

    public boolean isSourceChannel(long channelId) {
        return sourceChannelIds.contains(channelId);
    }
}
