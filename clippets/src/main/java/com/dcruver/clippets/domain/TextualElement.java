package com.dcruver.clippets.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An element that holds lines of text introduced by a marker line.
 */
public abstract class TextualElement extends Element {

    protected TextualElement(Group parent) {
        super(parent);
    }

    public String getMarker() {
        return getKind().getMarker();
    }

    public void add(String line) {
        lines().add(line);
        setDirty(true);
    }

    public String getText() {
        return String.join("\n", getSourceLines());
    }

    /**
     * The source lines with their common indentation removed.
     */
    public String getBody() {
        return String.join("\n", TextBlocks.dedent(getSourceLines()));
    }

    @Override
    protected String bodyRepr() {
        return quote(getBody());
    }

    /**
     * Pop trailing blank lines off the source and hand them back as a new
     * {@link PreservedText}, in their original order.
     */
    protected Optional<PreservedText> detachTrailingBlankLines() {
        List<String> lines = lines();
        List<String> removed = new ArrayList<>();
        while (!lines.isEmpty() && TextBlocks.isBlank(lines.get(lines.size() - 1))) {
            removed.add(0, lines.remove(lines.size() - 1));
        }
        if (removed.isEmpty()) {
            return Optional.empty();
        }
        setDirty(true);
        PreservedText preserved = new PreservedText(getParent());
        removed.forEach(preserved::add);
        return Optional.of(preserved);
    }

    static String quote(String text) {
        String escaped = text
            .replace("\\", "\\\\")
            .replace("\n", "\\n")
            .replace("'", "\\'");
        return "'" + escaped + "'";
    }
}
