package com.forumbot.channel.forum;

import com.forumbot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Finds the thread a user already owns in a forum, by the naming convention in
 * {@link ForumThreadNames}. Active threads are checked before archived ones.
 */
@Slf4j
public class ThreadOwnershipResolver {

    public static final int ARCHIVED_SCAN_LIMIT = 200;

    private final ForumPlatform platform;

    public ThreadOwnershipResolver(ForumPlatform platform) {
        this.platform = platform;
    }

    /**
     * First active, then archived thread whose name belongs to
     * {@code displayName}. A failure while paging archived threads counts as
     * "no match".
     */
    public Optional<ForumThread> findExisting(ForumRef forum, String displayName) {
        for (ForumThread thread : platform.listActiveThreads(forum)) {
            if (ForumThreadNames.belongsTo(thread.name(), displayName)) {
                return Optional.of(thread);
            }
        }

        try {
            for (ForumThread thread : platform.listArchivedThreads(forum, ARCHIVED_SCAN_LIMIT)) {
                if (ForumThreadNames.belongsTo(thread.name(), displayName)) {
                    return Optional.of(thread);
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to list archived threads of forum '{}' ({}): {}",
                    forum.name(), forum.id(), ErrorUtils.formatErrorMessage(e), e);
        }
        return Optional.empty();
    }
}
