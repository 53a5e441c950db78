package org.pragmatica.bbcode.tree;

import org.pragmatica.bbcode.tokenizer.Token;
import org.pragmatica.bbcode.tokenizer.TokenResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds the document tree from a token sequence using a stack of open elements.
 *
 * <p>Markup shape never fails the build:
 * <ul>
 *   <li>a close token matching no open element is dropped;</li>
 *   <li>elements still open at the end of input end with the document;</li>
 *   <li>{@code [*]} items end at the next item of the same list or when an enclosing element
 *       closes, so the items of a list are siblings each owning its trailing text;</li>
 *   <li>void elements ({@code [hr]}) never receive children.</li>
 * </ul>
 */
public final class TreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private final TokenResult tokens;
    private final RawBuffer buffer;
    private final Node.Document document;
    private final Deque<Node.Element> open;

    private TreeBuilder(TokenResult tokens) {
        this.tokens = tokens;
        this.buffer = tokens.buffer();
        this.document = new Node.Document(buffer);
        this.open = new ArrayDeque<>();
    }

    public static Node.Document build(TokenResult tokens) {
        return new TreeBuilder(tokens).buildAll();
    }

    private Node.Document buildAll() {
        for (var token : tokens.tokens()) {
            switch (token.kind()) {
                case TEXT -> appendText(token);
                case ELEMENT_OPEN -> openElement(token);
                case ELEMENT_CLOSE -> closeElement(token);
            }
        }
        return document;
    }

    private void appendText(Token token) {
        append(new Node.Text(current(), buffer, token.raw()));
    }

    private void openElement(Token token) {
        var kind = ElementKind.classify(buffer.slice(token.name()));

        if (kind.closing() == ElementKind.Closing.IMPLICIT && isOpen(kind)) {
            open.pop();
        }

        var element = new Node.Element(current(), buffer, token.raw(), token.name(), token.value());
        append(element);

        if (kind.closing() != ElementKind.Closing.VOID) {
            open.push(element);
        }
    }

    private void closeElement(Token token) {
        var name = buffer.slice(token.name());
        int depth = 0;

        for (var element : open) {
            depth++;
            if (element.name().equals(name)) {
                for (int i = 1; i < depth; i++) {
                    open.pop();
                }
                open.pop().close(token.raw());
                return;
            }
            if (element.kind().closing() != ElementKind.Closing.IMPLICIT) {
                break;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Ignoring unmatched close tag {} at {}", buffer.slice(token.raw()), buffer.locate(token.raw().start()));
        }
    }

    private boolean isOpen(ElementKind kind) {
        return !open.isEmpty() && open.peek().kind() == kind;
    }

    private Node current() {
        return open.isEmpty() ? document : open.peek();
    }

    private void append(Node child) {
        var parent = current();
        if (parent instanceof Node.Element element) {
            element.append(child);
        } else {
            document.append(child);
        }
    }
}
