package com.forumbot.channel.forum;

/**
 * A forum channel resolved in a guild.
 */
public record ForumRef(long id, long guildId, String name) {
}
