package com.forumbot.channel.forum;

import com.forumbot.common.config.RoutingTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * Role-based forum routing. Pure functions over the routing table.
 */
@Slf4j
public final class ForumRouter {

    private ForumRouter() {
    }

    /**
     * Forums an author with {@code authorRoles} posts into, in route order,
     * without duplicates. Each candidate id is passed to {@code resolveForum}
     * exactly once; ids it cannot resolve are dropped.
     */
    public static <T> List<T> route(Set<Long> authorRoles, RoutingTable table, LongFunction<Optional<T>> resolveForum) {
        List<T> routed = new ArrayList<>();
        for (long forumId : candidates(authorRoles, table)) {
            Optional<T> forum = resolveForum.apply(forumId);
            if (forum.isPresent()) {
                routed.add(forum.get());
            } else {
                log.debug("Forum {} is not a forum channel in this guild, skipping", forumId);
            }
        }
        return routed;
    }

    /**
     * Configured forum ids for the author's roles before checking that they
     * exist. Falls back to the default list when no route matches.
     */
    public static List<Long> candidates(Set<Long> authorRoles, RoutingTable table) {
        LinkedHashSet<Long> ids = new LinkedHashSet<>();
        boolean matched = false;
        for (RoutingTable.RoleRoute route : table.routes()) {
            if (authorRoles.contains(route.roleId())) {
                matched = true;
                ids.addAll(route.forumIds());
            }
        }
        if (!matched) {
            ids.addAll(table.defaultForumIds());
        }
        return new ArrayList<>(ids);
    }
}
