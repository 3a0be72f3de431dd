package com.dcruver.clippets.pointer;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.Elements;
import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.Snippet;
import com.dcruver.clippets.domain.TreeWalker;

import java.util.Optional;

/**
 * Where to insert a snippet within the tree. Positions are relative to
 * snippets or to the placeholder of an empty group, in any group.
 */
public class SnippetInsertionPointer extends InsertionPointer<Snippet> {

    public SnippetInsertionPointer(Snippet snippet) {
        super(snippet);
    }

    /**
     * Move a snippet to this position; it must be the snippet this pointer
     * was created for.
     */
    public boolean moveSnippet(Snippet snippet) {
        if (snippet != source) {
            throw new IllegalArgumentException("Pointer was created for " + source.getUid() + ", not " + snippet.getUid());
        }
        return moveSource();
    }

    @Override
    protected Optional<Element> neighbour(Element element, boolean backwards) {
        return TreeWalker.neighbour(element, backwards, false, Elements::isSnippetLike);
    }

    @Override
    protected void commit() {
        Group from = source.getParent();
        from.remove(source);
        from.clean();

        Group to = reference.getParent();
        if (after) {
            to.add(source, reference, null);
        } else {
            to.add(source, null, reference);
        }
        to.clean();
    }
}
