package com.forumbot.app;

import com.forumbot.common.config.ConfigurationException;
import com.forumbot.common.config.ForumBotConfig;
import com.forumbot.common.config.ForumBotConfigLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Forum bot entry point.
 * <p>
 * Configuration is read before Spring starts so a missing token stops the
 * process with status 1 before any gateway connection is attempted.
 */
@Slf4j
@SpringBootApplication
public class ForumBotApplication {

    public static final String LOG_LEVEL_PROPERTY = "logging.level.com.forumbot";

    public static void main(String[] args) {
        ForumBotConfig config;
        try {
            config = ForumBotConfigLoader.fromEnvironment();
        } catch (ConfigurationException e) {
            log.error("Configuration error ({}): {}", e.getKey(), e.getMessage());
            System.exit(1);
            return;
        }

        System.setProperty(LOG_LEVEL_PROPERTY, config.getLogLevel().springLevel());

        ApplicationContextInitializer<ConfigurableApplicationContext> registerConfig =
                context -> context.getBeanFactory().registerSingleton("forumBotConfig", config);
        new SpringApplicationBuilder(ForumBotApplication.class)
                .initializers(registerConfig)
                .run(args);
    }
}
