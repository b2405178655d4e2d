package com.forumbot.common.config;

import com.forumbot.common.infra.DotEnv;
import com.forumbot.common.infra.EnvUtils;
import com.forumbot.common.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ForumBotConfig} from environment variables.
 */
@Slf4j
public final class ForumBotConfigLoader {

    private ForumBotConfigLoader() {
    }

    public static final String ENV_TOKEN = "DISCORD_TOKEN";
    public static final String ENV_SOURCE_CHANNELS = "SOURCE_TEXT_CHANNEL_IDS";
    public static final String ENV_MALE_ROLE = "MALE_ROLE_ID";
    public static final String ENV_FEMALE_ROLE = "FEMALE_ROLE_ID";
    public static final String ENV_MALE_FORUMS = "MALE_FORUM_IDS";
    public static final String ENV_FEMALE_FORUMS = "FEMALE_FORUM_IDS";
    public static final String ENV_DEFAULT_FORUMS = "DEFAULT_FORUM_IDS";
    public static final String ENV_LINKS_FILE = "THREAD_LINKS_FILE";
    public static final String ENV_LOG_LEVEL = "LOG_LEVEL";
    public static final String ENV_WORKERS = "FORUMBOT_WORKERS";

    public static final long DEFAULT_MALE_ROLE_ID = 1399390214295785623L;
    public static final long DEFAULT_FEMALE_ROLE_ID = 1399390384756363264L;

    public static final String LABEL_MALE = "male";
    public static final String LABEL_FEMALE = "female";

    /**
     * Load from the process environment overlaid on {@code ./.env}.
     */
    public static ForumBotConfig fromEnvironment() {
        return load(DotEnv.processEnvironment());
    }

    /**
     * Load from an explicit environment map.
     *
     * @throws ConfigurationException if {@code DISCORD_TOKEN} is absent
     */
    public static ForumBotConfig load(Map<String, String> env) {
        String token = normalizeToken(env.get(ENV_TOKEN));
        if (token == null) {
            throw new ConfigurationException(ENV_TOKEN, ENV_TOKEN + " is not set");
        }

        RoutingTable routing = new RoutingTable(
                List.of(
                        new RoutingTable.RoleRoute(LABEL_MALE,
                                parseId(env.get(ENV_MALE_ROLE), DEFAULT_MALE_ROLE_ID),
                                parseIdList(env.get(ENV_MALE_FORUMS))),
                        new RoutingTable.RoleRoute(LABEL_FEMALE,
                                parseId(env.get(ENV_FEMALE_ROLE), DEFAULT_FEMALE_ROLE_ID),
                                parseIdList(env.get(ENV_FEMALE_FORUMS)))),
                parseIdList(env.get(ENV_DEFAULT_FORUMS)));

        String linksFile = EnvUtils.getEnv(env, ENV_LINKS_FILE, null);

        EnvUtils.logAcceptedEnvOption(env, ENV_TOKEN, "bot token", true);
        EnvUtils.logAcceptedEnvOption(env, ENV_SOURCE_CHANNELS, "source channels", false);
        EnvUtils.logAcceptedEnvOption(env, ENV_LINKS_FILE, "thread link store", false);
        EnvUtils.logAcceptedEnvOption(env, ENV_LOG_LEVEL, "log level", false);

        return ForumBotConfig.builder()
                .token(token)
                .sourceChannelIds(parseIdList(env.get(ENV_SOURCE_CHANNELS)))
                .routingTable(routing)
                .linksFile(linksFile != null ? Path.of(linksFile) : ForumBotConfig.DEFAULT_LINKS_FILE)
                .logLevel(LogLevel.fromEnv(env.get(ENV_LOG_LEVEL)))
                .workerThreads(Math.max(1, EnvUtils.getEnvInt(env, ENV_WORKERS,
                        ForumBotConfig.DEFAULT_WORKER_THREADS)))
                .build();
    }

    /**
     * Parse a comma-separated id list. Entries that are not plain digit strings
     * are dropped; order is preserved.
     */
    public static List<Long> parseIdList(String raw) {
        if (raw == null || raw.isBlank())
            return Collections.emptyList();
        List<Long> ids = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!isDigits(trimmed))
                continue;
            try {
                ids.add(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                log.debug("Dropping out-of-range id: {}", trimmed);
            }
        }
        return List.copyOf(ids);
    }

    static long parseId(String raw, long defaultValue) {
        String trimmed = raw != null ? raw.trim() : "";
        if (!isDigits(trimmed))
            return defaultValue;
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Trim a bot token and strip a leading "Bot " prefix.
     *
     * @return the token, or null when blank
     */
    static String normalizeToken(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String stripped = raw.trim().replaceFirst("(?i)^Bot\\s+", "");
        return stripped.isBlank() ? null : stripped;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty())
            return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9')
                return false;
        }
        return true;
    }
}
