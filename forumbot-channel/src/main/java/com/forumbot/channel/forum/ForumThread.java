package com.forumbot.channel.forum;

/**
 * A thread (forum post) as seen by the handlers.
 */
public record ForumThread(long id, String name, long forumId, boolean archived) {
}
