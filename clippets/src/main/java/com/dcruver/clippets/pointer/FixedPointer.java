package com.dcruver.clippets.pointer;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.ElementKind;

/**
 * A position before or after an element of a snippet tree.
 *
 * Within a group, the position after one element is the same as the position
 * before the following element of the same kind. Both positions around a
 * placeholder are the same position.
 */
public class FixedPointer {

    protected Element reference;
    protected boolean after;

    public FixedPointer(Element reference, boolean after) {
        this.reference = reference;
        this.after = after;
    }

    public Element getReference() {
        return reference;
    }

    public boolean isAfter() {
        return after;
    }

    public InsertionAddress getAddr() {
        return new InsertionAddress(reference.getUid(), after);
    }

    /**
     * Whether this and another pointer identify the same insertion position.
     */
    public boolean isSamePosition(FixedPointer other) {
        if (reference == other.reference) {
            return reference.getKind() == ElementKind.PLACEHOLDER || after == other.after;
        }
        if (after && !other.after) {
            return reference.nextInGroup() == other.reference;
        }
        if (!after && other.after) {
            return other.reference.nextInGroup() == reference;
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + reference.getUid() + ", " + after + ")";
    }
}
