package com.forumbot.common.config;

import java.util.List;

/**
 * Role label → forum routing, loaded once at startup and never mutated.
 * Routes are tested in list order; {@code defaultForumIds} apply only when no
 * route matched.
 */
public record RoutingTable(List<RoleRoute> routes, List<Long> defaultForumIds) {

    public RoutingTable {
        routes = routes != null ? List.copyOf(routes) : List.of();
        defaultForumIds = defaultForumIds != null ? List.copyOf(defaultForumIds) : List.of();
    }

    /**
     * One labelled role and the forums its holders post into.
     */
    public record RoleRoute(String label, long roleId, List<Long> forumIds) {

        public RoleRoute {
            forumIds = forumIds != null ? List.copyOf(forumIds) : List.of();
        }
    }

    public static RoutingTable empty() {
        return new RoutingTable(List.of(), List.of());
    }
}
