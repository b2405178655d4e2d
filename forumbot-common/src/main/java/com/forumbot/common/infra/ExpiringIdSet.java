package com.forumbot.common.infra;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set of snowflake ids that forget their members after a TTL, bounded by a
 * maximum size (oldest marks evicted first).
 * <p>
 * Thread-safe via synchronization.
 */
public class ExpiringIdSet {

    private final long ttlMs;
    private final int maxSize;
    private final LinkedHashMap<Long, Long> marks = new LinkedHashMap<>(64, 0.75f, false);

    public ExpiringIdSet(long ttlMs, int maxSize) {
        this.ttlMs = Math.max(0, ttlMs);
        this.maxSize = Math.max(1, maxSize);
    }

    public synchronized void mark(long id) {
        mark(id, System.currentTimeMillis());
    }

    /**
     * Mark with an explicit timestamp (useful for testing).
     */
    public synchronized void mark(long id, long nowMs) {
        marks.remove(id);
        marks.put(id, nowMs);
        prune(nowMs);
    }

    public synchronized boolean contains(long id) {
        return contains(id, System.currentTimeMillis());
    }

    public synchronized boolean contains(long id, long nowMs) {
        Long markedAt = marks.get(id);
        if (markedAt == null)
            return false;
        if (ttlMs > 0 && nowMs - markedAt >= ttlMs) {
            marks.remove(id);
            return false;
        }
        return true;
    }

    public synchronized int size() {
        return marks.size();
    }

    private void prune(long nowMs) {
        if (ttlMs > 0) {
            long cutoff = nowMs - ttlMs;
            marks.entrySet().removeIf(e -> e.getValue() <= cutoff);
        }
        Iterator<Map.Entry<Long, Long>> it = marks.entrySet().iterator();
        while (marks.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
