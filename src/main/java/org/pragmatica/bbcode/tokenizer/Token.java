package org.pragmatica.bbcode.tokenizer;

import org.pragmatica.bbcode.tree.SourceSpan;

import java.util.Optional;

/**
 * Token location in the raw buffer. Nothing is copied: the name, the optional parameter value
 * and the original bytes are all spans into the buffer owned by the {@link TokenResult}.
 *
 * @param kind  token kind
 * @param raw   exact original text, brackets included
 * @param name  tag name, or the whole content for {@link TokenKind#TEXT}
 * @param value parameter value, present only for {@link TokenKind#ELEMENT_OPEN} with a parameter
 */
public record Token(TokenKind kind, SourceSpan raw, SourceSpan name, Optional<SourceSpan> value) {

    public static Token text(SourceSpan raw) {
        return new Token(TokenKind.TEXT, raw, raw, Optional.empty());
    }

    /**
     * Opening tag spanning {@code raw}; when a parameter is present the name ends right before
     * the separator that introduced it.
     */
    public static Token open(SourceSpan raw, Optional<SourceSpan> parameter) {
        var nameEnd = parameter.map(p -> p.start() - 1)
                               .orElse(raw.end() - 1);
        return new Token(TokenKind.ELEMENT_OPEN, raw, SourceSpan.of(raw.start() + 1, nameEnd), parameter);
    }

    public static Token close(SourceSpan raw) {
        return new Token(TokenKind.ELEMENT_CLOSE, raw, SourceSpan.of(raw.start() + 2, raw.end() - 1), Optional.empty());
    }

    public boolean isText() {
        return kind == TokenKind.TEXT;
    }

    /**
     * Extend a text token up to the end of {@code next}.
     */
    public Token extendTo(Token next) {
        if (!isText() || !next.isText()) {
            throw new IllegalStateException("Only text tokens can be merged");
        }
        return text(raw.merge(next.raw));
    }
}
