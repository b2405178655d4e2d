package com.forumbot.channel.forum;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Set;

/**
 * An inbound message that may trigger thread creation, detached from the
 * platform's own message object.
 */
@Getter
@Builder
@ToString
public class TriggerMessage {
    private final long messageId;
    private final long channelId;
    private final String channelName;
    /** Null for direct messages. */
    private final Long guildId;
    private final long authorId;
    private final String authorDisplayName;
    /** Account name used in audit-log reasons. */
    private final String authorTag;
    @Builder.Default
    private final Set<Long> authorRoleIds = Set.of();
    private final boolean authorBot;
    /** Null when the platform did not provide one. */
    private final Instant createdAt;
    /** Link back to the message; becomes the thread's starter content. */
    private final String permalink;

    public boolean isFromGuild() {
        return guildId != null;
    }
}
