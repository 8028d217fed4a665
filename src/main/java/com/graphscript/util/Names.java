package com.graphscript.util;

import java.util.Collection;

/**
 * Name helpers shared by functions, signature entries and variables.
 */
public final class Names {
    private Names() {
        // Utility class
    }

    /**
     * Makes {@code requested} unique among {@code taken}.
     *
     * <p>
     * Spaces become underscores. If the result is taken, the first free
     * {@code _1}, {@code _2}, ... suffix is appended.
     */
    public static String uniquify(String requested, Collection<String> taken) {
        String name = requested.replace(' ', '_');
        if (!taken.contains(name))
            return name;
        int suffix = 1;
        while (taken.contains(name + "_" + suffix))
            suffix++;
        return name + "_" + suffix;
    }
}
