package com.dcruver.clippets.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A single, multi-line snippet of plain text.
 *
 * Also the base class for {@link MarkdownSnippet}.
 */
public class Snippet extends TextualElement {

    /** Opens a highlighted keyword; the next character is its colour code. */
    public static final char KEYWORD_START = '\u2e24';

    /** Closes a highlighted keyword. */
    public static final char KEYWORD_END = '\u2e25';

    private static final Pattern MARKDOWN_SYNTAX = Pattern.compile("([\\\\`*_{}\\[\\]()#+\\-.!])");

    // null until first requested after a reset
    private List<String> markedLines;

    public Snippet(Group parent) {
        super(parent);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SNIPPET;
    }

    /**
     * The body lines with every keyword of the owning group wrapped as
     * {@code KEYWORD_START code word KEYWORD_END}.
     *
     * The result is cached until {@link #reset()} or {@link #setText(String)}.
     */
    public List<String> getMarkedLines() {
        if (markedLines == null) {
            markedLines = markKeywords(getBody().lines().toList());
            setDirty(false);
        }
        return markedLines;
    }

    /**
     * The marked lines joined as text, with common indentation removed.
     */
    public String getMarkedText() {
        return String.join("\n", TextBlocks.dedent(getMarkedLines()));
    }

    protected List<String> markKeywords(List<String> lines) {
        Set<String> keywords = getParent().keywords();
        if (keywords.isEmpty()) {
            return List.copyOf(lines);
        }

        // Longest first so that overlapping keywords prefer the longer match
        String alternatives = keywords.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        Pattern words = Pattern.compile("\\b(" + alternatives + ")\\b");
        KeywordPalette palette = getRoot().getPalette();

        List<String> marked = new ArrayList<>(lines.size());
        for (String line : lines) {
            Matcher m = words.matcher(line);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String word = m.group(1);
                m.appendReplacement(sb, Matcher.quoteReplacement(
                    "" + KEYWORD_START + palette.code(word) + word + KEYWORD_END));
            }
            m.appendTail(sb);
            marked.add(sb.toString());
        }
        return List.copyOf(marked);
    }

    /**
     * Clear any cached state.
     */
    public void reset() {
        markedLines = null;
        setDirty(true);
    }

    /**
     * The snippet lines in Markdown form, with Markdown syntax escaped.
     */
    public List<String> mdLines() {
        return MARKDOWN_SYNTAX.matcher(getBody()).replaceAll("\\\\$1").lines().toList();
    }

    /**
     * Add a new, empty snippet of the same kind after this one.
     */
    public Snippet addNew() {
        Snippet inst = newSibling();
        getParent().add(inst, this, null);
        return inst;
    }

    /**
     * Create a copy of this snippet, inserted after it.
     */
    public Snippet duplicate() {
        Snippet inst = newSibling();
        inst.setSourceLines(getSourceLines());
        getParent().add(inst, this, null);
        return inst;
    }

    public void setText(String text) {
        markedLines = null;
        setSourceLines(text.lines().toList());
    }

    protected Snippet newSibling() {
        return new Snippet(getParent());
    }

    /**
     * Expand tabs, trim line ends, detach trailing blank lines and remove
     * common leading whitespace.
     *
     * @return the detached blank lines, if there were any
     */
    @Override
    public Optional<PreservedText> clean() {
        super.clean();
        Optional<PreservedText> trailing = detachTrailingBlankLines();
        List<String> dedented = TextBlocks.dedent(getSourceLines());
        if (!dedented.equals(getSourceLines())) {
            setSourceLines(dedented);
        }
        return trailing;
    }
}
