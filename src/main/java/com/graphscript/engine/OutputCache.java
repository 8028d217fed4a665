package com.graphscript.engine;

import com.graphscript.api.OutputId;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-compile memo of output -> expression text. Each key is written once;
 * rewriting it with different text is a compiler bug.
 */
final class OutputCache {
    private final Map<OutputId, String> entries = new HashMap<>();

    String get(OutputId id) {
        return entries.get(id);
    }

    boolean contains(OutputId id) {
        return entries.containsKey(id);
    }

    void put(OutputId id, String text) {
        String previous = entries.putIfAbsent(id, text);
        if (previous != null && !previous.equals(text))
            throw new IllegalStateException("Output " + id + " already compiled to " + previous + ", not " + text);
    }

    /** The keys present now, to be passed to {@link #restore(Set)}. */
    Set<OutputId> mark() {
        return new HashSet<>(entries.keySet());
    }

    /** Drops every entry added since {@code mark} was taken. */
    void restore(Set<OutputId> mark) {
        entries.keySet().retainAll(mark);
    }

    int size() {
        return entries.size();
    }
}
