package com.forumbot.channel.forum;

/**
 * Minimal view of a channel fetched by id.
 */
public record ChannelInfo(long id, String name, boolean thread) {
}
