package com.dcruver.clippets.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class TreeWalkerTest {

    private Root root;
    private Group main;
    private Group sub;
    private Group second;
    private Group empty;
    private Snippet s1;
    private Snippet s2;
    private Snippet s3;
    private Snippet s4;

    @BeforeEach
    void setUp() {
        root = new Root();
        main = root.addGroup("Main");
        s1 = snippet(main, "1");
        PreservedText comment = new PreservedText(main);
        comment.add("# comment");
        main.add(comment);
        s2 = snippet(main, "2");
        sub = main.addGroup("Sub");
        s3 = snippet(sub, "3");
        second = root.addGroup("Second");
        s4 = snippet(second, "4");
        empty = root.addGroup("Empty");
        root.clean();
    }

    private Snippet snippet(Group group, String text) {
        Snippet snippet = new Snippet(group);
        snippet.setText(text);
        group.add(snippet);
        return snippet;
    }

    private static List<Element> collect(Iterable<Element> elements) {
        List<Element> result = new ArrayList<>();
        elements.forEach(result::add);
        return result;
    }

    @Test
    void testForwardDocumentOrder() {
        List<Element> groups = collect(TreeWalker.walk(root, Elements::isGroup, "", false));
        assertEquals(List.of(main, sub, second, empty), groups);

        List<Element> snippets = collect(TreeWalker.walk(root, Elements::isSnippet, "", false));
        assertEquals(List.of(s1, s2, s3, s4), snippets);
    }

    @Test
    void testKeywordSetsAreNotVisited() {
        for (Element el : root.walk(Elements::isAny)) {
            assertNotEquals(ElementKind.KEYWORD_SET, el.getKind());
            assertNotSame(root, el);
        }
    }

    @Test
    void testBackwardWalkIsExactReverse() {
        List<Predicate<Element>> predicates = List.of(
            Elements::isAny, Elements::isGroup, Elements::isSnippet, Elements::isSnippetLike);
        for (Predicate<Element> predicate : predicates) {
            List<Element> forward = collect(TreeWalker.walk(root, predicate, "", false));
            List<Element> backward = collect(TreeWalker.walk(root, predicate, "", true));
            Collections.reverse(forward);
            assertEquals(forward, backward);
        }
    }

    @Test
    void testWalkIsRestartable() {
        Iterable<Element> walk = TreeWalker.walk(root, Elements::isSnippet, "", false);
        assertEquals(collect(walk), collect(walk));
    }

    @Test
    void testFirstIdSkipsUpToAndIncluding() {
        List<Element> rest = collect(TreeWalker.walk(root, Elements::isSnippet, s2.getUid(), false));
        assertEquals(List.of(s3, s4), rest);

        List<Element> before = collect(TreeWalker.walk(root, Elements::isSnippet, s2.getUid(), true));
        assertEquals(List.of(s1), before);
    }

    @Test
    void testUnknownFirstIdYieldsNothing() {
        assertTrue(collect(TreeWalker.walk(root, Elements::isAny, "snippet-999", false)).isEmpty());
    }

    @Test
    void testWalkAfterElement() {
        List<Element> rest = collect(TreeWalker.walk(root, Elements::isGroup, sub, false));
        assertEquals(List.of(second, empty), rest);
    }

    @Test
    void testNeighbour() {
        assertSame(s3, TreeWalker.neighbour(s2, false, false, Elements::isSnippet).orElseThrow());
        assertTrue(TreeWalker.neighbour(s2, false, true, Elements::isSnippet).isEmpty());
        assertSame(s1, TreeWalker.neighbour(s2, true, true, Elements::isSnippet).orElseThrow());
        assertTrue(TreeWalker.neighbour(s1, true, false, Elements::isSnippet).isEmpty());

        Element placeHolder = TreeWalker.neighbour(s4, false, false, Elements::isSnippetLike).orElseThrow();
        assertEquals(ElementKind.PLACEHOLDER, placeHolder.getKind());
        assertSame(empty, placeHolder.getParent());
    }

    @Test
    void testStepGroup() {
        assertSame(sub, main.stepGroup(false).orElseThrow());
        assertSame(sub, second.stepGroup(true).orElseThrow());
        assertTrue(main.stepGroup(true).isEmpty());
    }
}
