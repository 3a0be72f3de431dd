package com.dcruver.clippets.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordPaletteTest {

    private KeywordPalette palette;

    @BeforeEach
    void setUp() {
        palette = new KeywordPalette();
    }

    @Test
    void testCodesFollowRegistrationOrder() {
        palette.registerAll(List.of("one", "two", "three"));
        palette.register("one");

        assertEquals('a', palette.code("one"));
        assertEquals('b', palette.code("two"));
        assertEquals('c', palette.code("three"));
        assertEquals("magenta", palette.colour(palette.code("one")));
        assertEquals("chartreuse3", palette.colour(palette.code("two")));
    }

    @Test
    void testCodesWrapAround() {
        for (int i = 0; i < 11; i++) {
            palette.register("w" + i);
        }
        assertEquals('j', palette.code("w9"));
        assertEquals('a', palette.code("w10"));
    }

    @Test
    void testUnknownWords() {
        palette.register("first");
        assertFalse(palette.isRegistered("missing"));

        assertEquals('b', palette.code("missing"));
        assertTrue(palette.isRegistered("missing"));
        assertEquals('b', palette.code("missing"));
        assertThrows(IllegalArgumentException.class, () -> palette.colour('z'));
    }

    @Test
    void testReset() {
        palette.register("one");
        palette.register("two");
        palette.reset();
        palette.register("two");

        assertEquals('a', palette.code("two"));
    }
}
