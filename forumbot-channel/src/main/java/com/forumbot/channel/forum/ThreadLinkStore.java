package com.forumbot.channel.forum;

import com.fasterxml.jackson.core.type.TypeReference;
import com.forumbot.common.infra.ErrorUtils;
import com.forumbot.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable mapping from a triggering message to the threads created for it.
 * <p>
 * File format: {@code {"<messageId>": [threadId, ...]}}, rewritten in full on
 * every mutation. One operation (including its flush) runs at a time. The
 * in-memory map stays authoritative when a flush fails.
 */
@Slf4j
public class ThreadLinkStore {

    private static final TypeReference<LinkedHashMap<String, List<Long>>> FILE_FORMAT = new TypeReference<>() {
    };

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, LinkedHashSet<Long>> linksByMessage = new LinkedHashMap<>();
    private final Map<Long, String> messageByThread = new HashMap<>();

    public ThreadLinkStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    // --- Public API ---

    /**
     * Replace the in-memory state with the file's contents. A missing file means
     * no links; an unreadable or corrupt file is logged and treated the same.
     */
    public void load() {
        lock.lock();
        try {
            linksByMessage.clear();
            messageByThread.clear();
            Map<String, List<Long>> stored;
            try {
                stored = JsonFile.read(file, FILE_FORMAT);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to read thread link file {}, starting empty: {}",
                        file, ErrorUtils.formatErrorMessage(e), e);
                return;
            }
            if (stored == null) {
                log.info("No thread link file at {}, starting empty", file);
                return;
            }
            stored.forEach((messageId, threadIds) -> {
                if (threadIds == null)
                    return;
                if (!isMessageKey(messageId)) {
                    log.warn("Ignoring thread links under invalid message id '{}'", messageId);
                    return;
                }
                String key = String.valueOf(Long.parseLong(messageId));
                for (Long threadId : threadIds) {
                    if (threadId != null)
                        insert(key, threadId);
                }
            });
            log.info("Loaded {} thread link(s) from {}", linksByMessage.size(), file);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Link {@code threadId} to {@code messageId} and flush.
     *
     * @return false if the link already existed, or the thread is already linked
     *         to a different message
     */
    public boolean add(long messageId, long threadId) {
        lock.lock();
        try {
            if (!insert(String.valueOf(messageId), threadId))
                return false;
            flush();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every thread linked to {@code messageId}.
     *
     * @return the thread ids in link order, empty if there were none
     */
    public List<Long> popAll(long messageId) {
        lock.lock();
        try {
            LinkedHashSet<Long> removed = linksByMessage.remove(String.valueOf(messageId));
            if (removed == null || removed.isEmpty())
                return Collections.emptyList();
            removed.forEach(messageByThread::remove);
            flush();
            return List.copyOf(removed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the current mapping.
     */
    public Map<Long, List<Long>> snapshot() {
        lock.lock();
        try {
            Map<Long, List<Long>> copy = new LinkedHashMap<>();
            linksByMessage.forEach((k, v) -> copy.put(Long.parseLong(k), List.copyOf(v)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /** Number of messages with at least one linked thread. */
    public int size() {
        lock.lock();
        try {
            return linksByMessage.size();
        } finally {
            lock.unlock();
        }
    }

    // --- Internals (caller holds the lock) ---

    private boolean insert(String messageKey, long threadId) {
        String owner = messageByThread.get(threadId);
        if (owner != null) {
            if (!owner.equals(messageKey)) {
                log.warn("Thread {} is already linked to message {}, not linking to {}",
                        threadId, owner, messageKey);
            }
            return false;
        }
        linksByMessage.computeIfAbsent(messageKey, k -> new LinkedHashSet<>()).add(threadId);
        messageByThread.put(threadId, messageKey);
        return true;
    }

    private static boolean isMessageKey(String key) {
        try {
            return Long.parseLong(key) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private void flush() {
        Map<String, List<Long>> data = new LinkedHashMap<>();
        linksByMessage.forEach((k, v) -> data.put(k, new ArrayList<>(v)));
        try {
            JsonFile.write(file, data);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save thread link file {}: {}", file, ErrorUtils.formatErrorMessage(e), e);
        }
    }
}
