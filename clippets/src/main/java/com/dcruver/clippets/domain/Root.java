package com.dcruver.clippets.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * The top of a snippet tree.
 *
 * A root owns the ID allocator, keyword palette and tag registry shared by
 * every element below it, so separate trees never interfere.
 */
public class Root extends Group {

    private final ElementIds ids;
    private final KeywordPalette palette;
    private final Set<String> allTags = new TreeSet<>();
    private Title title;

    public Root() {
        this(new ElementIds(), new KeywordPalette());
    }

    public Root(KeywordPalette palette) {
        this(new ElementIds(), palette);
    }

    public Root(ElementIds ids, KeywordPalette palette) {
        super(ROOT_NAME, ids);
        this.ids = ids;
        this.palette = palette;
        initKeywordSet();
    }

    @Override
    public Root getRoot() {
        return this;
    }

    public ElementIds getIds() {
        return ids;
    }

    public KeywordPalette getPalette() {
        return palette;
    }

    /**
     * Every tag used by any group in this tree.
     */
    public Set<String> getAllTags() {
        return Collections.unmodifiableSet(allTags);
    }

    void registerTags(Collection<String> tags) {
        allTags.addAll(tags);
    }

    /**
     * The title text, or an empty string when the file has no title.
     */
    public String getTitle() {
        return title == null ? "" : title.getText();
    }

    public void setTitle(String text) {
        title = text == null || text.isBlank() ? null : new Title(this, text);
    }

    public Iterable<Element> walk(Predicate<? super Element> predicate) {
        return TreeWalker.walk(this, predicate, (Element) null, false);
    }

    public Optional<Element> findById(String uid) {
        for (Element el : walk(Elements::isAny)) {
            if (el.getUid().equals(uid)) {
                return Optional.of(el);
            }
        }
        return Optional.empty();
    }

    public Optional<Snippet> firstSnippet() {
        for (Element el : walk(Elements::isSnippet)) {
            return Optional.of((Snippet) el);
        }
        return Optional.empty();
    }

    /**
     * The first top level group. A loaded tree always has one.
     */
    public Optional<Group> firstGroup() {
        return getOrderedGroups().stream().findFirst();
    }

    public int totalGroupCount() {
        int count = 0;
        for (Element ignored : walk(Elements::isGroup)) {
            count++;
        }
        return count;
    }

    /**
     * Register every keyword used in the tree with the palette, so that
     * colour codes stay stable after edits.
     */
    public void updateKeywords() {
        Set<String> words = new TreeSet<>(keywords());
        for (Element el : walk(Elements::isGroup)) {
            words.addAll(((Group) el).keywords());
        }
        palette.registerAll(words);
    }
}
