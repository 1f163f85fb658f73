package com.phillippitts.livefacts.service.tracking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded, insertion-ordered record of content already delivered in a session.
 *
 * <p>The oldest entry is evicted once the limit is reached. Only the session's delivery
 * loop appends; other threads read copies.
 */
public final class ContentHistory {

    private final int limit;
    private final Deque<String> entries = new ArrayDeque<>();

    public ContentHistory(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive, got: " + limit);
        }
        this.limit = limit;
    }

    public synchronized void append(String entry) {
        entries.addLast(entry);
        while (entries.size() > limit) {
            entries.removeFirst();
        }
    }

    /**
     * Returns up to {@code n} most recent entries, oldest first.
     */
    public synchronized List<String> recent(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<String> out = new ArrayList<>(Math.min(n, entries.size()));
        Iterator<String> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(0, it.next());
        }
        return List.copyOf(out);
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int limit() {
        return limit;
    }
}
