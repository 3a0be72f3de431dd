package com.dcruver.clippets.domain;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns highlight colour codes to keywords.
 *
 * Words are numbered in registration order and the number picks a slot in a
 * fixed palette, so a word keeps its code for as long as the palette lives.
 * The palette is a singleton bean and survives tree reloads.
 */
@Component
public class KeywordPalette {

    private static final List<String> COLOURS = List.of(
        "magenta",
        "chartreuse3",
        "blue_violet",
        "dark_goldenrod",
        "deep_sky_blue1",
        "orange3",
        "spring_green3",
        "hot_pink",
        "steel_blue",
        "gold3"
    );

    private final Map<String, Integer> keywordIndex = new HashMap<>();

    public void register(String keyword) {
        keywordIndex.putIfAbsent(keyword, keywordIndex.size());
    }

    public void registerAll(Collection<String> keywords) {
        keywords.forEach(this::register);
    }

    public boolean isRegistered(String keyword) {
        return keywordIndex.containsKey(keyword);
    }

    /**
     * The single letter code for a keyword. Unknown words are registered first.
     */
    public char code(String keyword) {
        register(keyword);
        int n = keywordIndex.get(keyword) % COLOURS.size();
        return (char) ('a' + n);
    }

    /**
     * The colour name for a code letter produced by {@link #code(String)}.
     */
    public String colour(char code) {
        int n = code - 'a';
        if (n < 0 || n >= COLOURS.size()) {
            throw new IllegalArgumentException("Unknown keyword colour code: " + code);
        }
        return COLOURS.get(n);
    }

    public void reset() {
        keywordIndex.clear();
    }
}
