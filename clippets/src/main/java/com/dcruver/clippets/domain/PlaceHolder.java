package com.dcruver.clippets.domain;

/**
 * Marks a group that currently has no snippets.
 *
 * It has no file representation, but it gives an insertion pointer something
 * to reference inside an empty group.
 */
public class PlaceHolder extends Element {

    public PlaceHolder(Group parent) {
        super(parent);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.PLACEHOLDER;
    }

    /**
     * A placeholder is never considered to be first or last within a group.
     */
    @Override
    public boolean isFirstInGroup() {
        return false;
    }

    @Override
    public boolean isLastInGroup() {
        return false;
    }
}
