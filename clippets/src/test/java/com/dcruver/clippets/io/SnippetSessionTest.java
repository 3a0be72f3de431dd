package com.dcruver.clippets.io;

import com.dcruver.clippets.config.ClippetsProperties;
import com.dcruver.clippets.domain.KeywordPalette;
import com.dcruver.clippets.domain.Root;
import com.dcruver.clippets.domain.Snippet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SnippetSessionTest {

    private static final String CONTENT = """
        Main
          @text@
            Original
        """;

    private ClippetsProperties properties;
    private SnippetSession session;

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ClippetsProperties();
        session = new SnippetSession(
            new SnippetFileReader(new KeywordPalette()),
            new SnippetFileWriter(),
            new BackupRotator(properties),
            new SnippetDiff(properties),
            properties);
        file = tempDir.resolve("snippets.txt");
        Files.writeString(file, CONTENT);
    }

    @Test
    void testNothingLoaded() {
        assertFalse(session.isLoaded());
        assertThrows(IllegalStateException.class, () -> session.getRoot());
        assertThrows(IllegalStateException.class, () -> session.save());
    }

    @Test
    void testDiffShowsEdits() throws Exception {
        Root root = session.load(file);
        assertEquals("", session.diff());

        root.firstSnippet().orElseThrow().setText("Edited");

        String diff = session.diff();
        assertTrue(diff.contains("-    Original"), diff);
        assertTrue(diff.contains("+    Edited"), diff);
    }

    @Test
    void testSaveKeepsBackup() throws Exception {
        Root root = session.load(file);
        Snippet snippet = root.firstSnippet().orElseThrow();
        snippet.setText("Edited");

        session.save();

        assertEquals(CONTENT, Files.readString(BackupRotator.backupPath(file, 1)));
        assertEquals(CONTENT.replace("Original", "Edited"), Files.readString(file));
        assertEquals("", session.diff());
    }

    @Test
    void testSaveWithoutBackup() throws Exception {
        properties.setBackupOnSave(false);
        session.load(file);

        session.save();

        assertFalse(Files.exists(BackupRotator.backupPath(file, 1)));
    }

    @Test
    void testBackupFailureDoesNotBlockSave() throws Exception {
        properties.setBackupCount(1);
        Path blocked = BackupRotator.backupPath(file, 1);
        Files.createDirectory(blocked);
        Files.writeString(blocked.resolve("keep.txt"), "x");
        session.load(file).firstSnippet().orElseThrow().setText("Edited");

        session.save();

        assertEquals(CONTENT.replace("Original", "Edited"), Files.readString(file));
        assertTrue(Files.isDirectory(blocked));
    }

    @Test
    void testSaveFailurePropagates() throws Exception {
        properties.setBackupOnSave(false);
        session.load(file);
        Files.delete(file);
        Files.createDirectory(file);
        Files.writeString(file.resolve("keep.txt"), "x");

        assertThrows(IOException.class, () -> session.save());
    }

    @Test
    void testFailedLoadKeepsCurrentTree() throws Exception {
        Root root = session.load(file);

        assertThrows(SnippetFileException.class, () -> session.load(tempDir.resolve("missing.txt")));
        assertSame(root, session.getRoot());
        assertEquals(file, session.getPath());
    }

    @Test
    void testReloadDiscardsEdits() throws Exception {
        session.load(file).firstSnippet().orElseThrow().setText("Edited");

        Root reloaded = session.reload();

        assertEquals("Original", reloaded.firstSnippet().orElseThrow().getBody());
    }
}
