package org.pragmatica.bbcode.tree;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Closed classification of tag names. Names match byte for byte: {@code [B]} is not bold.
 * A dialect that wants case folding normalizes names before classifying them.
 */
public enum ElementKind {
    BOLD,
    ITALIC,
    LINK,
    EMAIL,
    CODE,
    HORIZONTAL_RULE(Closing.VOID),
    BLOCKQUOTE,
    LIST,
    LIST_ITEM(Closing.IMPLICIT),
    UNDERLINE,
    UNRECOGNIZED;

    /**
     * How an element of this kind ends.
     */
    public enum Closing {
        /**
         * Ends at its matching close tag (or at the end of the document).
         */
        EXPLICIT,
        /**
         * Has no close tag of its own; ends at the next sibling of the same kind or when an
         * enclosing element closes.
         */
        IMPLICIT,
        /**
         * Never has content.
         */
        VOID
    }

    private static final Map<String, ElementKind> TABLE = Map.ofEntries(
        entry("b", BOLD),
        entry("i", ITALIC),
        entry("url", LINK),
        entry("email", EMAIL),
        entry("code", CODE),
        entry("line", HORIZONTAL_RULE),
        entry("hr", HORIZONTAL_RULE),
        entry("quote", BLOCKQUOTE),
        entry("list", LIST),
        entry("*", LIST_ITEM),
        entry("u", UNDERLINE)
    );

    private final Closing closing;

    ElementKind() {
        this(Closing.EXPLICIT);
    }

    ElementKind(Closing closing) {
        this.closing = closing;
    }

    public static ElementKind classify(String tagName) {
        return TABLE.getOrDefault(tagName, UNRECOGNIZED);
    }

    public Closing closing() {
        return closing;
    }
}
