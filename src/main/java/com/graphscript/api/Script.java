package com.graphscript.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, ordered sequence of compiled statement fragments.
 *
 * <p>
 * Empty fragments are dropped on construction, so an unconnected branch or a
 * node whose statement is empty (Enter) leaves no trace in the rendered text.
 */
public final class Script {
    public static final Script EMPTY = new Script(Collections.emptyList());

    private static final String DEFAULT_SEPARATOR = " ";

    private final List<String> fragments;

    private Script(List<String> fragments) {
        this.fragments = fragments;
    }

    public static Script of(String... fragments) {
        return of(List.of(fragments));
    }

    public static Script of(List<String> fragments) {
        List<String> kept = new ArrayList<>(fragments.size());
        for (String f : fragments)
            if (f != null && !f.isEmpty())
                kept.add(f);
        return kept.isEmpty() ? EMPTY : new Script(Collections.unmodifiableList(kept));
    }

    /** Returns a script holding this script's fragments followed by {@code next}'s. */
    public Script then(Script next) {
        if (next.isEmpty())
            return this;
        if (isEmpty())
            return next;
        List<String> joined = new ArrayList<>(fragments.size() + next.fragments.size());
        joined.addAll(fragments);
        joined.addAll(next.fragments);
        return new Script(Collections.unmodifiableList(joined));
    }

    public List<String> fragments() {
        return fragments;
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public String render() {
        return render(DEFAULT_SEPARATOR);
    }

    public String render(String separator) {
        return String.join(separator, fragments);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Script s && fragments.equals(s.fragments);
    }

    @Override
    public int hashCode() {
        return fragments.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
