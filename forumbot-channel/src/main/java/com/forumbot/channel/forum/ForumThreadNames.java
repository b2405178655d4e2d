package com.forumbot.channel.forum;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Thread naming convention: {@code <displayName>/<M>/<d>}, the date being the
 * message time plus ten days in Japan time. The leading display name is the
 * only link between a user and their threads once created.
 */
public final class ForumThreadNames {

    private ForumThreadNames() {
    }

    public static final String SEPARATOR = "/";
    public static final int MAX_NAME_LENGTH = 95;
    public static final Duration DUE_OFFSET = Duration.ofDays(10);
    public static final ZoneId REFERENCE_ZONE = ZoneId.of("Asia/Tokyo");

    /**
     * Build the thread name for a message posted at {@code createdAt}.
     */
    public static String threadName(String displayName, Instant createdAt) {
        ZonedDateTime due = createdAt.plus(DUE_OFFSET).atZone(REFERENCE_ZONE);
        String name = displayName + SEPARATOR + due.getMonthValue() + SEPARATOR + due.getDayOfMonth();
        return truncate(name, MAX_NAME_LENGTH);
    }

    /**
     * Whether {@code threadName} belongs to {@code displayName}, i.e. its first
     * segment before the separator is exactly the display name.
     */
    public static boolean belongsTo(String threadName, String displayName) {
        if (threadName == null || displayName == null)
            return false;
        return threadName.startsWith(displayName + SEPARATOR);
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength)
            return value;
        String cut = value.substring(0, maxLength);
        // never leave half of a surrogate pair at the end
        if (Character.isHighSurrogate(cut.charAt(cut.length() - 1)))
            cut = cut.substring(0, cut.length() - 1);
        return cut;
    }
}
