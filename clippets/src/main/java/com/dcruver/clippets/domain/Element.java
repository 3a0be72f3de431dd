package com.dcruver.clippets.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An element in a tree of groups and snippets.
 *
 * The parent is a back reference used for depth and root lookups only; the
 * parent's child lists own the element.
 */
public abstract class Element {

    private Group parent;
    private final String uid;
    private final List<String> sourceLines = new ArrayList<>();
    private boolean dirty = true;

    protected Element(Group parent) {
        this(parent, parent.getRoot().getIds());
    }

    protected Element(Group parent, ElementIds ids) {
        this.parent = parent;
        this.uid = getKind().hasUid() ? ids.next(getKind().getIdBase()) : "";
    }

    public abstract ElementKind getKind();

    public Group getParent() {
        return parent;
    }

    void setParent(Group parent) {
        this.parent = parent;
    }

    public Root getRoot() {
        if (parent == null) {
            throw new IllegalStateException(getKind().getDisplayName() + " is not attached to a tree");
        }
        return parent.getRoot();
    }

    /**
     * The element's unique ID, or an empty string for kinds that have none.
     */
    public String getUid() {
        return uid;
    }

    public int depth() {
        return parent == null ? 0 : parent.depth() + 1;
    }

    public List<String> getSourceLines() {
        return Collections.unmodifiableList(sourceLines);
    }

    public void setSourceLines(List<String> lines) {
        sourceLines.clear();
        sourceLines.addAll(lines);
        dirty = true;
    }

    protected List<String> lines() {
        return sourceLines;
    }

    /**
     * True when the text changed since a renderer last recomputed its cached
     * form. Renderers clear it after recomputing.
     */
    public boolean isDirty() {
        return dirty;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isEmpty() {
        return sourceLines.isEmpty();
    }

    /**
     * Expand tabs and strip trailing whitespace from every source line.
     *
     * @return trailing text detached by the clean, to be kept as a sibling
     */
    public Optional<PreservedText> clean() {
        List<String> cleaned = sourceLines.stream()
            .map(line -> TextBlocks.expandTabs(line).stripTrailing())
            .toList();
        if (!cleaned.equals(sourceLines)) {
            setSourceLines(cleaned);
        }
        return Optional.empty();
    }

    public boolean isFirstInGroup() {
        return parent != null && parent.prevChild(this) == null;
    }

    public boolean isLastInGroup() {
        return parent != null && parent.nextChild(this) == null;
    }

    public Element nextInGroup() {
        return parent == null ? null : parent.nextChild(this);
    }

    public Element prevInGroup() {
        return parent == null ? null : parent.prevChild(this);
    }

    /**
     * A one line representation used by tests and debugging output.
     */
    public String fullRepr(boolean details) {
        String body = bodyRepr();
        String idPart = details && !uid.isEmpty() ? " " + uid : "";
        return getKind().getDisplayName() + idPart + ":" + (body.isEmpty() ? "" : " " + body);
    }

    protected String bodyRepr() {
        return "";
    }

    @Override
    public String toString() {
        return fullRepr(true);
    }
}
