package com.dcruver.clippets.pointer;

import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.KeywordPalette;
import com.dcruver.clippets.domain.Root;
import com.dcruver.clippets.io.SnippetFileReader;
import com.dcruver.clippets.io.SnippetFileWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for moving whole groups.
 */
class GroupInsertionPointerTest {

    private static final String GROUP_OF_ONE_TEXT = """
        Main
          @text@
            Snippet 1
          @text@
            Snippet 2
        Second
          @text@
            Snippet 3
        Third
          @text@
            Snippet 4
          @text@
            Snippet 5
        """;

    private static final String NESTED_TEXT = """
        Main
          @text@
            A
        Other
          @text@
            B
        Other : Inner
          @text@
            C
        """;

    private SnippetFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new SnippetFileReader(new KeywordPalette());
    }

    private Root load(String text) throws Exception {
        return reader.parse(text.lines().toList(), "test");
    }

    @Test
    void testMoveGroupUp() throws Exception {
        Root root = load(GROUP_OF_ONE_TEXT);
        Group third = root.getGroup("Third");

        GroupInsertionPointer pointer = new GroupInsertionPointer(third);
        assertTrue(pointer.move(true));
        assertSame(root.getGroup("Second"), pointer.getReference());
        assertFalse(pointer.isAfter());
        assertTrue(pointer.moveSource());

        assertEquals("<ROOT>\nMain\nThird\nSecond\n", root.outlineRepr());
        assertEquals(List.of("Snippet 4", "Snippet 5"),
            third.snippets().stream().map(s -> s.getBody()).toList());
    }

    @Test
    void testMoveGroupDown() throws Exception {
        Root root = load(GROUP_OF_ONE_TEXT);
        Group main = root.getGroup("Main");

        GroupInsertionPointer pointer = new GroupInsertionPointer(main);
        assertTrue(pointer.move(false));
        assertEquals(new InsertionAddress(root.getGroup("Third").getUid(), false), pointer.getAddr());
        pointer.moveSource();

        assertEquals("<ROOT>\nSecond\nMain\nThird\n", root.outlineRepr());
    }

    @Test
    void testMoveGroupToEnd() throws Exception {
        Root root = load(GROUP_OF_ONE_TEXT);
        Group main = root.getGroup("Main");

        GroupInsertionPointer pointer = new GroupInsertionPointer(main);
        assertTrue(pointer.move(false));
        assertTrue(pointer.move(false));
        assertFalse(pointer.move(false));
        pointer.moveSource();

        assertEquals("<ROOT>\nSecond\nThird\nMain\n", root.outlineRepr());
    }

    @Test
    void testFirstGroupCannotMoveUp() throws Exception {
        Root root = load(GROUP_OF_ONE_TEXT);
        GroupInsertionPointer pointer = new GroupInsertionPointer(root.getGroup("Main"));

        assertFalse(pointer.move(true));
        assertTrue(pointer.isNextTo());
        assertFalse(pointer.moveSource());
    }

    @Test
    void testOnlyGroupCannotMove() throws Exception {
        Root root = load("""
            Main
              @text@
                Snippet 1
              @text@
                Snippet 2
            """);

        assertThrows(CannotMoveException.class, () -> new GroupInsertionPointer(root.getGroup("Main")));
    }

    @Test
    void testMoveIntoAnotherGroup() throws Exception {
        Root root = load(NESTED_TEXT);
        Group main = root.getGroup("Main");

        GroupInsertionPointer pointer = new GroupInsertionPointer(main);
        assertTrue(pointer.move(false));
        assertTrue(pointer.move(false));
        assertSame(root.getGroup("Other").getGroup("Inner"), pointer.getReference());
        pointer.moveSource();

        assertEquals("<ROOT>\nOther\nMain\nInner\n", root.outlineRepr());
        assertEquals("Other : Main", main.fullName());

        String expected = """
            Other
              @text@
                B
            Other : Main
              @text@
                A
            Other : Inner
              @text@
                C
            """;
        assertEquals(expected, new SnippetFileWriter().render(root));
    }

    @Test
    void testGroupCannotMoveIntoItself() throws Exception {
        Root root = load(NESTED_TEXT);
        GroupInsertionPointer pointer = new GroupInsertionPointer(root.getGroup("Other"));

        assertFalse(pointer.move(false));
        assertTrue(pointer.move(true));
        assertSame(root.getGroup("Main"), pointer.getReference());
    }

    @Test
    void testNameClashIsSkipped() throws Exception {
        Root root = load("""
            A
              @text@
                1
            B
              @text@
                2
            B : A
              @text@
                3
            """);
        Group topA = root.getGroup("A");

        GroupInsertionPointer pointer = new GroupInsertionPointer(topA);
        assertTrue(pointer.move(false));
        assertFalse(pointer.move(false));
        pointer.moveSource();

        assertEquals("<ROOT>\nB\nA\nA\n", root.outlineRepr());
        assertSame(root, topA.getParent());
    }
}
