package com.dcruver.clippets.io;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.Elements;
import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.KeywordSet;
import com.dcruver.clippets.domain.Root;
import com.dcruver.clippets.domain.TextualElement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a snippet tree back to the file format read by {@link SnippetFileReader}.
 */
@Component
@Slf4j
public class SnippetFileWriter {

    private static final String INDENT = "    ";

    /**
     * Write a tree to file
     */
    public void write(Root root, Path outputPath) throws IOException {
        Files.writeString(outputPath, render(root), StandardCharsets.UTF_8);
        log.debug("Wrote snippets to: {}", outputPath);
    }

    /**
     * Build file content from a tree
     */
    public String render(Root root) {
        StringBuilder sb = new StringBuilder();
        if (!root.getTitle().isEmpty()) {
            sb.append("@title: ").append(root.getTitle()).append("\n");
        }
        for (Element el : root.walk(Elements::isAny)) {
            append(sb, el);
        }
        return sb.toString();
    }

    private void append(StringBuilder sb, Element el) {
        switch (el.getKind()) {
            case GROUP -> {
                Group group = (Group) el;
                sb.append(group.fullName());
                if (!group.getTags().isEmpty()) {
                    sb.append(" [").append(String.join(" ", group.getTags())).append("]");
                }
                sb.append("\n");
                KeywordSet keywords = group.getKeywordSet();
                if (!keywords.isEmpty()) {
                    appendTextual(sb, keywords);
                }
            }
            case SNIPPET, MARKDOWN_SNIPPET, KEYWORD_SET -> appendTextual(sb, (TextualElement) el);
            case PRESERVED_TEXT -> el.getSourceLines().forEach(line -> sb.append(line).append("\n"));
            case PLACEHOLDER, TITLE -> {
                // Nothing in the file
            }
        }
    }

    private void appendTextual(StringBuilder sb, TextualElement el) {
        sb.append("  ").append(el.getMarker()).append("\n");
        el.getText().lines().forEach(line -> sb.append((INDENT + line).stripTrailing()).append("\n"));
    }
}
