package com.dcruver.clippets.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Document order traversal of a group tree.
 *
 * Within a group the non-group children come first, then each sub-group
 * followed by its own expansion. Keyword sets are never visited and the
 * starting group itself is not yielded. A backward walk is the exact reverse
 * of a forward one.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * Walk the tree below {@code top}.
     *
     * @param firstId if not empty, skip everything up to and including the
     *                element with this ID
     */
    public static Iterable<Element> walk(Group top, Predicate<? super Element> predicate,
                                         String firstId, boolean backwards) {
        if (firstId == null || firstId.isEmpty()) {
            return walk(top, predicate, (Element) null, backwards);
        }
        return () -> {
            Iterator<Element> it = new Walk(top, backwards);
            while (it.hasNext()) {
                if (it.next().getUid().equals(firstId)) {
                    return filtered(it, predicate);
                }
            }
            return it;
        };
    }

    /**
     * Walk the tree below {@code top}, skipping everything up to and including
     * {@code after} when it is given.
     */
    public static Iterable<Element> walk(Group top, Predicate<? super Element> predicate,
                                         Element after, boolean backwards) {
        return () -> {
            Iterator<Element> it = new Walk(top, backwards);
            if (after != null) {
                while (it.hasNext()) {
                    if (it.next() == after) {
                        break;
                    }
                }
            }
            return filtered(it, predicate);
        };
    }

    /**
     * The first element after {@code element}, in walk order, that matches
     * the predicate.
     *
     * @param withinGroup if set, a match in a different group counts as no match
     */
    public static Optional<Element> neighbour(Element element, boolean backwards, boolean withinGroup,
                                              Predicate<? super Element> predicate) {
        Iterator<Element> it = walk(element.getRoot(), predicate, element, backwards).iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        Element found = it.next();
        if (withinGroup && found.getParent() != element.getParent()) {
            return Optional.empty();
        }
        return Optional.of(found);
    }

    private static Iterator<Element> filtered(Iterator<Element> source, Predicate<? super Element> predicate) {
        return new Iterator<>() {
            private Element pending;

            @Override
            public boolean hasNext() {
                while (pending == null && source.hasNext()) {
                    Element el = source.next();
                    if (predicate.test(el)) {
                        pending = el;
                    }
                }
                return pending != null;
            }

            @Override
            public Element next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Element el = pending;
                pending = null;
                return el;
            }
        };
    }

    /**
     * Unfiltered walk using an explicit stack, so deep trees do not recurse.
     */
    private static final class Walk implements Iterator<Element> {

        private final boolean backwards;
        private final Deque<Iterator<Element>> stack = new ArrayDeque<>();

        Walk(Group top, boolean backwards) {
            this.backwards = backwards;
            stack.push(expansion(top));
        }

        private Iterator<Element> expansion(Group group) {
            List<Element> children = group.getChildren().stream()
                .filter(c -> c.getKind() != ElementKind.KEYWORD_SET)
                .toList();
            List<Group> groups = group.getOrderedGroups();
            if (!backwards) {
                return new ExpandingIterator(children.iterator(), groups.iterator());
            }
            return new ExpandingIterator(
                reversed(children).iterator(), reversed(groups).iterator());
        }

        private static <T> List<T> reversed(List<T> list) {
            List<T> copy = new ArrayList<>(list);
            Collections.reverse(copy);
            return copy;
        }

        @Override
        public boolean hasNext() {
            while (!stack.isEmpty() && !stack.peek().hasNext()) {
                stack.pop();
            }
            return !stack.isEmpty();
        }

        @Override
        public Element next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return stack.peek().next();
        }

        /**
         * Yields a group's children, then each sub-group and its expansion.
         * Backwards, it yields the sub-groups (last first) each after its
         * expansion, then the children.
         */
        private final class ExpandingIterator implements Iterator<Element> {

            private final Iterator<Element> children;
            private final Iterator<Group> groups;
            private Group deferred;

            ExpandingIterator(Iterator<Element> children, Iterator<Group> groups) {
                this.children = children;
                this.groups = groups;
            }

            @Override
            public boolean hasNext() {
                if (backwards) {
                    return deferred != null || groups.hasNext() || children.hasNext();
                }
                return children.hasNext() || groups.hasNext();
            }

            @Override
            public Element next() {
                if (!backwards) {
                    if (children.hasNext()) {
                        return children.next();
                    }
                    Group group = groups.next();
                    stack.push(expansion(group));
                    return group;
                }

                if (deferred != null) {
                    Group group = deferred;
                    deferred = null;
                    return group;
                }
                if (groups.hasNext()) {
                    Group group = groups.next();
                    Iterator<Element> sub = expansion(group);
                    if (sub.hasNext()) {
                        deferred = group;
                        stack.push(sub);
                        return stack.peek().next();
                    }
                    return group;
                }
                return children.next();
            }
        }
    }
}
