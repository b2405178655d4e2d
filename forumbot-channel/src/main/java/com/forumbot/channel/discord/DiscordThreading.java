package com.forumbot.channel.discord;

/**
 * Discord thread channel type ids.
 */
public final class DiscordThreading {

    private DiscordThreading() {
    }

    public static final int ANNOUNCEMENT_THREAD = 10;
    public static final int PUBLIC_THREAD = 11;
    public static final int PRIVATE_THREAD = 12;

    public static boolean isThreadType(Integer type) {
        if (type == null)
            return false;
        return type == PUBLIC_THREAD || type == PRIVATE_THREAD || type == ANNOUNCEMENT_THREAD;
    }
}
