package com.dcruver.clippets.io;

import com.dcruver.clippets.config.ClippetsProperties;
import com.dcruver.clippets.domain.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The snippet file currently being edited and its tree.
 *
 * All access is from the single shell thread, so there is no locking.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnippetSession {

    private final SnippetFileReader reader;
    private final SnippetFileWriter writer;
    private final BackupRotator backups;
    private final SnippetDiff differ;
    private final ClippetsProperties properties;

    private Path path;
    private Root root;

    /**
     * Load a file, replacing the current tree. The current tree is kept if
     * loading fails.
     */
    public Root load(Path newPath) throws IOException {
        Root loaded = reader.read(newPath);
        this.path = newPath;
        this.root = loaded;
        return loaded;
    }

    /**
     * Load the file again, discarding unsaved edits.
     */
    public Root reload() throws IOException {
        return load(requirePath());
    }

    public boolean isLoaded() {
        return root != null;
    }

    public Root getRoot() {
        if (root == null) {
            throw new IllegalStateException("No snippet file loaded");
        }
        return root;
    }

    public Path getPath() {
        return requirePath();
    }

    /**
     * Save the tree to the file it was loaded from, after rotating backups
     * when enabled.
     */
    public void save() throws IOException {
        Root current = getRoot();
        Path target = requirePath();
        if (properties.isBackupOnSave()) {
            backups.backupFile(target);
        }
        writer.write(current, target);
        log.info("Saved snippets to {}", target);
    }

    /**
     * A unified diff between the file on disk and the edited tree.
     */
    public String diff() throws IOException {
        Path target = requirePath();
        String saved = Files.exists(target) ? Files.readString(target, StandardCharsets.UTF_8) : "";
        return differ.generateDiff(saved, writer.render(getRoot()), target.getFileName().toString());
    }

    private Path requirePath() {
        if (path == null) {
            throw new IllegalStateException("No snippet file loaded");
        }
        return path;
    }
}
