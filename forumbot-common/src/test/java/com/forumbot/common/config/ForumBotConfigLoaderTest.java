package com.forumbot.common.config;

import com.forumbot.common.infra.EnvUtils;
import com.forumbot.common.logging.LogLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ForumBotConfigLoaderTest {

    private Map<String, String> env;

    @BeforeEach
    void setUp() {
        EnvUtils.resetForTest();
        env = new HashMap<>();
        env.put("DISCORD_TOKEN", "token-123");
    }

    @Nested
    class Token {
        @Test
        void missingToken_throwsConfigurationException() {
            env.remove("DISCORD_TOKEN");
            var e = assertThrows(ConfigurationException.class, () -> ForumBotConfigLoader.load(env));
            assertEquals("DISCORD_TOKEN", e.getKey());
        }

        @Test
        void blankToken_throwsConfigurationException() {
            env.put("DISCORD_TOKEN", "   ");
            assertThrows(ConfigurationException.class, () -> ForumBotConfigLoader.load(env));
        }

        @Test
        void botPrefix_isStripped() {
            env.put("DISCORD_TOKEN", "  Bot token-123 ");
            assertEquals("token-123", ForumBotConfigLoader.load(env).getToken());
        }

        @Test
        void tokenIsNotPrinted() {
            assertFalse(ForumBotConfigLoader.load(env).toString().contains("token-123"));
        }
    }

    @Nested
    class Defaults {
        @Test
        void onlyTokenSet_usesDefaults() {
            ForumBotConfig config = ForumBotConfigLoader.load(env);

            assertTrue(config.getSourceChannelIds().isEmpty());
            assertEquals(ForumBotConfig.DEFAULT_LINKS_FILE, config.getLinksFile());
            assertEquals(LogLevel.INFO, config.getLogLevel());
            assertEquals(4, config.getWorkerThreads());

            List<RoutingTable.RoleRoute> routes = config.getRoutingTable().routes();
            assertEquals(2, routes.size());
            assertEquals("male", routes.get(0).label());
            assertEquals(ForumBotConfigLoader.DEFAULT_MALE_ROLE_ID, routes.get(0).roleId());
            assertEquals("female", routes.get(1).label());
            assertEquals(ForumBotConfigLoader.DEFAULT_FEMALE_ROLE_ID, routes.get(1).roleId());
            assertTrue(routes.get(0).forumIds().isEmpty());
            assertTrue(config.getRoutingTable().defaultForumIds().isEmpty());
        }

        @Test
        void invalidRoleId_fallsBackToDefault() {
            env.put("MALE_ROLE_ID", "abc");
            env.put("FEMALE_ROLE_ID", "77");
            RoutingTable table = ForumBotConfigLoader.load(env).getRoutingTable();
            assertEquals(ForumBotConfigLoader.DEFAULT_MALE_ROLE_ID, table.routes().get(0).roleId());
            assertEquals(77L, table.routes().get(1).roleId());
        }

        @Test
        void invalidWorkerCount_usesDefault() {
            env.put("FORUMBOT_WORKERS", "many");
            assertEquals(4, ForumBotConfigLoader.load(env).getWorkerThreads());
            env.put("FORUMBOT_WORKERS", "0");
            assertEquals(1, ForumBotConfigLoader.load(env).getWorkerThreads());
        }
    }

    @Nested
    class Lists {
        @Test
        void fullConfiguration() {
            env.put("SOURCE_TEXT_CHANNEL_IDS", "10, 20");
            env.put("MALE_FORUM_IDS", "100,101");
            env.put("FEMALE_FORUM_IDS", "200");
            env.put("DEFAULT_FORUM_IDS", "300");
            env.put("THREAD_LINKS_FILE", "/var/lib/forumbot/links.json");
            env.put("LOG_LEVEL", "debug");

            ForumBotConfig config = ForumBotConfigLoader.load(env);

            assertEquals(List.of(10L, 20L), config.getSourceChannelIds());
            assertTrue(config.isSourceChannel(20L));
            assertFalse(config.isSourceChannel(30L));
            assertEquals(List.of(100L, 101L), config.getRoutingTable().routes().get(0).forumIds());
            assertEquals(List.of(200L), config.getRoutingTable().routes().get(1).forumIds());
            assertEquals(List.of(300L), config.getRoutingTable().defaultForumIds());
            assertEquals(Path.of("/var/lib/forumbot/links.json"), config.getLinksFile());
            assertEquals(LogLevel.DEBUG, config.getLogLevel());
        }

        @Test
        void parseIdList_dropsNonNumericEntries_andKeepsOrder() {
            assertEquals(List.of(3L, 1L, 2L), ForumBotConfigLoader.parseIdList("3, x1, 1,,-5, 2 ,4a"));
        }

        @Test
        void parseIdList_blankOrNull_isEmpty() {
            assertTrue(ForumBotConfigLoader.parseIdList(null).isEmpty());
            assertTrue(ForumBotConfigLoader.parseIdList("  ").isEmpty());
        }

        @Test
        void parseIdList_outOfRange_isDropped() {
            assertEquals(List.of(5L), ForumBotConfigLoader.parseIdList("99999999999999999999999,5"));
        }

        @Test
        void parseIdList_resultIsImmutable() {
            List<Long> ids = ForumBotConfigLoader.parseIdList("1,2");
            assertThrows(UnsupportedOperationException.class, () -> ids.add(3L));
        }
    }
}
