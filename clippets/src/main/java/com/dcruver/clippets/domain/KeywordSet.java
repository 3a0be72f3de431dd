package com.dcruver.clippets.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A group's set of highlighting keywords.
 *
 * Each added line is split at white space. Words are kept sorted, so the
 * original keyword order is not preserved when saving.
 */
public class KeywordSet extends TextualElement {

    private final Set<String> words = new TreeSet<>();

    public KeywordSet(Group parent) {
        super(parent);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.KEYWORD_SET;
    }

    @Override
    public void add(String line) {
        super.add(line);
        for (String word : line.strip().split("\\s+")) {
            if (!word.isEmpty()) {
                addWord(word);
            }
        }
    }

    public void addWords(Collection<String> newWords) {
        newWords.forEach(this::addWord);
    }

    private void addWord(String word) {
        words.add(word);
        getRoot().getPalette().register(word);
        setDirty(true);
    }

    public Set<String> getWords() {
        return Collections.unmodifiableSet(words);
    }

    /**
     * The keywords, sorted, one per line.
     */
    @Override
    public String getText() {
        return String.join("\n", words);
    }

    @Override
    public boolean isEmpty() {
        return words.isEmpty();
    }

    @Override
    public Optional<PreservedText> clean() {
        super.clean();
        return detachTrailingBlankLines();
    }

    @Override
    protected String bodyRepr() {
        return String.join(" ", words);
    }
}
