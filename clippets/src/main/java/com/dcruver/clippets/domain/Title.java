package com.dcruver.clippets.domain;

/**
 * A simple, one line title for a tree of snippets.
 */
public class Title extends TextualElement {

    public Title(Root root, String text) {
        super(root);
        add(text.strip());
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.TITLE;
    }
}
