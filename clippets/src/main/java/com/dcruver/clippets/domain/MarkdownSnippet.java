package com.dcruver.clippets.domain;

import java.util.List;

/**
 * A snippet that is interpreted as Markdown text.
 */
public class MarkdownSnippet extends Snippet {

    public MarkdownSnippet(Group parent) {
        super(parent);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.MARKDOWN_SNIPPET;
    }

    /**
     * The marked lines as text. The body is dedented before marking, so the
     * markers never take part in indentation.
     */
    @Override
    public String getMarkedText() {
        return String.join("\n", getMarkedLines());
    }

    /**
     * The body lines, unmodified; they are already Markdown.
     */
    @Override
    public List<String> mdLines() {
        return getBody().lines().toList();
    }

    @Override
    protected Snippet newSibling() {
        return new MarkdownSnippet(getParent());
    }
}
