package com.dcruver.clippets.domain;

/**
 * Input file text that is preserved, but non-functional.
 *
 * This covers comment blocks and additional vertical space. It is written back
 * verbatim and is never addressed or moved.
 */
public class PreservedText extends TextualElement {

    public PreservedText(Group parent) {
        super(parent);
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.PRESERVED_TEXT;
    }

    @Override
    protected String bodyRepr() {
        return quote(getText());
    }
}
