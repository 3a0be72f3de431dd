package com.dcruver.clippets.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The closed set of element kinds that can appear in a snippet tree.
 * Serialization switches over this exhaustively.
 */
@Getter
@RequiredArgsConstructor
public enum ElementKind {
    GROUP("Group", "group", null),
    SNIPPET("Snippet", "snippet", "@text@"),
    MARKDOWN_SNIPPET("MarkdownSnippet", "snippet", "@md@"),
    PLACEHOLDER("PlaceHolder", "placeholder", null),
    PRESERVED_TEXT("PreservedText", null, null),
    KEYWORD_SET("KeywordSet", "keywordset", "@keywords@"),
    TITLE("Title", null, "@title:");

    private final String displayName;

    // null when the kind is never individually addressed
    private final String idBase;

    private final String marker;

    public boolean hasUid() {
        return idBase != null;
    }

    public boolean isSnippet() {
        return this == SNIPPET || this == MARKDOWN_SNIPPET;
    }

    public boolean isSnippetLike() {
        return isSnippet() || this == PLACEHOLDER;
    }
}
