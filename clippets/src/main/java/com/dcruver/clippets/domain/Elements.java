package com.dcruver.clippets.domain;

/**
 * Element predicates for use with {@link TreeWalker}.
 */
public final class Elements {

    private Elements() {
    }

    public static boolean isAny(Element element) {
        return true;
    }

    public static boolean isGroup(Element element) {
        return element.getKind() == ElementKind.GROUP;
    }

    public static boolean isSnippet(Element element) {
        return element.getKind().isSnippet();
    }

    /**
     * Snippets and placeholders; the possible insertion references for a snippet move.
     */
    public static boolean isSnippetLike(Element element) {
        return element.getKind().isSnippetLike();
    }
}
