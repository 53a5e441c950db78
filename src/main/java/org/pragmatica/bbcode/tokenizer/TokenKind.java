package org.pragmatica.bbcode.tokenizer;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 */
public enum TokenKind {
    TEXT,
    ELEMENT_OPEN,
    ELEMENT_CLOSE
}
