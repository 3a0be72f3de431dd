package com.dcruver.clippets.domain;

import java.util.HashMap;
import java.util.Map;

/**
 * Allocates element IDs of the form {@code <base>-<n>}, one counter per base name.
 * Counters only ever increase, so an allocator never hands out the same ID twice.
 * Each {@link Root} owns one allocator.
 */
public class ElementIds {

    private final Map<String, Integer> counters = new HashMap<>();

    public String next(String base) {
        int n = counters.getOrDefault(base, 0);
        counters.put(base, n + 1);
        return base + "-" + n;
    }

    /**
     * Restart every counter. Only meant for test harnesses.
     */
    public void reset() {
        counters.clear();
    }
}
