package com.dcruver.clippets.pointer;

import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.ElementKind;

import java.util.Optional;

/**
 * A movable insertion position for relocating one element of a tree.
 *
 * The pointer starts at the element being moved, which is not a real
 * destination. Each {@link #move(boolean)} goes to the next position that
 * would actually change the tree. Once the wanted position is reached,
 * {@link #moveSource()} performs the move.
 *
 * A pointer is only valid until the tree is otherwise changed.
 *
 * @param <E> the type of element being moved
 */
public abstract class InsertionPointer<E extends Element> extends FixedPointer {

    protected final E source;
    private final FixedPointer beforeSource;
    private final FixedPointer afterSource;

    /**
     * @throws CannotMoveException if the element has nowhere to go
     */
    protected InsertionPointer(E source) {
        super(source, false);
        this.source = source;
        this.beforeSource = new FixedPointer(source, false);
        this.afterSource = new FixedPointer(source, true);
        if (!(canMove(true) || canMove(false))) {
            throw new CannotMoveException(
                source.getKind().getDisplayName() + " " + source.getUid() + " has nowhere to move to");
        }
    }

    public E getSource() {
        return source;
    }

    /**
     * Step to the next useful insertion position.
     *
     * @return false, leaving the pointer unchanged, if there is no such
     *         position in the given direction
     */
    public boolean move(boolean backwards) {
        Element startReference = reference;
        boolean startAfter = after;
        FixedPointer start = new FixedPointer(startReference, startAfter);
        while (step(backwards)) {
            if (!isSamePosition(start) && !isNextTo() && isAllowed(reference)) {
                normalise();
                return true;
            }
        }
        reference = startReference;
        after = startAfter;
        return false;
    }

    /**
     * Whether the pointer is at one of the positions the source already
     * occupies, where committing would change nothing.
     */
    public boolean isNextTo() {
        return isSamePosition(beforeSource) || isSamePosition(afterSource);
    }

    /**
     * Move the source element to this position.
     *
     * @return false if the pointer is next to the source, so nothing moved
     */
    public boolean moveSource() {
        if (isNextTo()) {
            return false;
        }
        commit();
        return true;
    }

    /**
     * The neighbouring possible reference element, searching the whole tree.
     */
    protected abstract Optional<Element> neighbour(Element element, boolean backwards);

    /**
     * Whether a reference element may be used as a destination.
     */
    protected boolean isAllowed(Element candidate) {
        return true;
    }

    /**
     * Detach the source and insert it at this position.
     */
    protected abstract void commit();

    private boolean canMove(boolean backwards) {
        Element startReference = reference;
        boolean startAfter = after;
        boolean moved = move(backwards);
        reference = startReference;
        after = startAfter;
        return moved;
    }

    /**
     * The smallest possible step, which may give an equivalent position.
     */
    private boolean step(boolean backwards) {
        if (backwards && after) {
            after = false;
            return true;
        }
        if (!backwards && !after) {
            after = true;
            return true;
        }
        Optional<Element> next = neighbour(reference, backwards);
        if (next.isEmpty()) {
            return false;
        }
        reference = next.get();
        after = backwards;
        return true;
    }

    /**
     * Prefer "before" positions: after X becomes before the element following X.
     */
    private void normalise() {
        if (reference.getKind() == ElementKind.PLACEHOLDER) {
            after = false;
        } else if (after) {
            Element next = reference.nextInGroup();
            if (next != null) {
                reference = next;
                after = false;
            }
        }
    }
}
