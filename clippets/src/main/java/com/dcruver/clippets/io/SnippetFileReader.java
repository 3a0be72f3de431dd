package com.dcruver.clippets.io;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.Elements;
import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.KeywordPalette;
import com.dcruver.clippets.domain.KeywordSet;
import com.dcruver.clippets.domain.MarkdownSnippet;
import com.dcruver.clippets.domain.PreservedText;
import com.dcruver.clippets.domain.Root;
import com.dcruver.clippets.domain.Snippet;
import com.dcruver.clippets.domain.TextualElement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads snippet files into a tree of groups and snippets.
 *
 * Parsing is lenient. Comments, blank lines and unrecognised text are kept as
 * {@link PreservedText} so that a load followed by a save does not lose
 * anything.
 */
@Component
@Slf4j
public class SnippetFileReader {

    private static final String TITLE_PREFIX = "@title:";
    private static final Pattern GROUP_HEADER = Pattern.compile("([^ ].*)");
    private static final Pattern MARKER = Pattern.compile("^ +?@(.*)@ *$");

    private final KeywordPalette palette;

    public SnippetFileReader(KeywordPalette palette) {
        this.palette = palette;
    }

    /**
     * Read and parse a snippet file
     */
    public Root read(Path path) throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnippetFileException("Could not open " + path + ": " + reason(e), e);
        }
        Root root = parse(lines, path.toString());
        log.info("Loaded {} groups from {}", root.totalGroupCount(), path);
        return root;
    }

    /**
     * Parse snippet file lines.
     *
     * @param sourceName used in error messages
     */
    public Root parse(List<String> lines, String sourceName) throws SnippetFileException {
        ParseState state = new ParseState(new Root(palette));
        for (String rawLine : lines) {
            state.accept(rawLine.stripTrailing());
        }
        state.store();

        Root root = state.root;
        root.clean();
        root.updateKeywords();
        if (root.getOrderedGroups().isEmpty()) {
            throw new SnippetFileException("File " + sourceName + " contains no groups");
        }
        for (Element el : root.walk(Elements::isSnippet)) {
            ((Snippet) el).reset();
        }
        log.debug("Parsed {} lines from {}", lines.size(), sourceName);
        return root;
    }

    private static String reason(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "No such file or directory";
        }
        if (e instanceof AccessDeniedException) {
            return "Permission denied";
        }
        return e.getMessage();
    }

    /**
     * The state of a single parse. Each line is handled by the first of the
     * comment, title, group and marker handlers that accepts it, otherwise it
     * is added to the element being built.
     */
    private static final class ParseState {

        private final Root root;
        private Group group;
        private TextualElement el;

        ParseState(Root root) {
            this.root = root;
            this.group = root;
            this.el = new PreservedText(root);
        }

        void accept(String line) {
            if (!(handleComment(line) || handleTitle(line) || handleGroup(line) || handleMarker(line))) {
                el.add(line);
            }
        }

        /**
         * Store the element being built, if not empty, and start collecting
         * preserved text.
         */
        void store() {
            TextualElement current = el;
            Optional<PreservedText> trailing = current.clean();
            if (!current.isEmpty()) {
                group.add(current);
            }
            trailing.ifPresent(group::add);
            el = new PreservedText(group);
        }

        private boolean handleComment(String line) {
            if (!line.startsWith("#")) {
                return false;
            }
            if (!(el instanceof PreservedText)) {
                store();
            }
            el.add(line);
            return true;
        }

        private boolean handleTitle(String line) {
            if (!line.startsWith(TITLE_PREFIX)) {
                return false;
            }
            store();
            root.setTitle(line.substring(TITLE_PREFIX.length()));
            return true;
        }

        private boolean handleGroup(String line) {
            if (!GROUP_HEADER.matcher(line).matches()) {
                return false;
            }
            store();
            Group g = root;
            for (String name : line.split(":")) {
                if (!Group.nameOf(name).isEmpty()) {
                    g = g.addGroup(name.strip());
                }
            }
            group = g;
            el = new PreservedText(group);
            return true;
        }

        private boolean handleMarker(String line) {
            Matcher m = MARKER.matcher(line);
            if (!m.matches()) {
                return false;
            }
            store();
            el = switch (m.group(1)) {
                case "keywords" -> new KeywordSet(group);
                case "md" -> new MarkdownSnippet(group);
                default -> new Snippet(group);
            };
            return true;
        }
    }
}
