package org.pragmatica.bbcode.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Document tree node. A tree has exactly one {@link Document} root; every other node has one
 * parent, and children are kept in source order.
 *
 * <p>Nodes do not copy text. They hold spans into the {@link RawBuffer} shared by the whole tree.
 */
public sealed interface Node {

    NodeType type();

    /**
     * Owning parent, empty only for the document root.
     */
    Optional<Node> parent();

    /**
     * Children in source order (read-only view).
     */
    List<Node> children();

    /**
     * Source span covered by this node.
     */
    SourceSpan span();

    /**
     * Buffer every span of this tree refers to.
     */
    RawBuffer buffer();

    /**
     * Direct children of the given variant.
     */
    default List<Node> children(NodeType type) {
        var result = new ArrayList<Node>();
        for (var child : children()) {
            if (child.type() == type) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Depth-first, pre-order traversal starting with this node.
     */
    default Iterable<Node> walk() {
        return () -> NodeWalker.preOrder(this);
    }

    /**
     * Concatenation of all descendant text nodes.
     */
    default String text() {
        var sb = new StringBuilder();
        for (var node : walk()) {
            if (node instanceof Text text) {
                sb.append(text.content());
            }
        }
        return sb.toString();
    }

    /**
     * Tree root.
     */
    final class Document implements Node {
        private final RawBuffer buffer;
        private final List<Node> children = new ArrayList<>();

        Document(RawBuffer buffer) {
            this.buffer = buffer;
        }

        @Override
        public NodeType type() {
            return NodeType.DOCUMENT;
        }

        @Override
        public Optional<Node> parent() {
            return Optional.empty();
        }

        @Override
        public List<Node> children() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public SourceSpan span() {
            return SourceSpan.of(0, buffer.length());
        }

        @Override
        public RawBuffer buffer() {
            return buffer;
        }

        void append(Node child) {
            children.add(child);
        }

        @Override
        public String toString() {
            return "Document" + children;
        }
    }

    /**
     * Tag with its parameter and content.
     */
    final class Element implements Node {
        private final Node parent;
        private final RawBuffer buffer;
        private final SourceSpan tag;
        private final SourceSpan name;
        private final Optional<SourceSpan> value;
        private final ElementKind kind;
        private final List<Node> children = new ArrayList<>();
        private Optional<SourceSpan> closingTag = Optional.empty();

        Element(Node parent, RawBuffer buffer, SourceSpan tag, SourceSpan name, Optional<SourceSpan> value) {
            this.parent = parent;
            this.buffer = buffer;
            this.tag = tag;
            this.name = name;
            this.value = value;
            this.kind = ElementKind.classify(buffer.slice(name));
        }

        @Override
        public NodeType type() {
            return NodeType.ELEMENT;
        }

        @Override
        public Optional<Node> parent() {
            return Optional.of(parent);
        }

        @Override
        public List<Node> children() {
            return Collections.unmodifiableList(children);
        }

        /**
         * From the start of the opening tag to the end of the closing tag, or to the end of the
         * last child when the element was never explicitly closed.
         */
        @Override
        public SourceSpan span() {
            if (closingTag.isPresent()) {
                return tag.merge(closingTag.get());
            }
            if (children.isEmpty()) {
                return tag;
            }
            return tag.merge(children.get(children.size() - 1).span());
        }

        @Override
        public RawBuffer buffer() {
            return buffer;
        }

        public String name() {
            return buffer.slice(name);
        }

        public Optional<String> value() {
            return value.map(buffer::slice);
        }

        public ElementKind kind() {
            return kind;
        }

        /**
         * Opening tag exactly as written.
         */
        public String raw() {
            return buffer.slice(tag);
        }

        public SourceSpan tagSpan() {
            return tag;
        }

        /**
         * Closing tag exactly as written, if the element was explicitly closed.
         */
        public Optional<String> closingRaw() {
            return closingTag.map(buffer::slice);
        }

        void append(Node child) {
            children.add(child);
        }

        void close(SourceSpan closing) {
            this.closingTag = Optional.of(closing);
        }

        @Override
        public String toString() {
            return "Element[" + name() + value().map(v -> "=" + v).orElse("") + "]" + children;
        }
    }

    /**
     * Run of literal text.
     */
    final class Text implements Node {
        private final Node parent;
        private final RawBuffer buffer;
        private final SourceSpan span;

        Text(Node parent, RawBuffer buffer, SourceSpan span) {
            this.parent = parent;
            this.buffer = buffer;
            this.span = span;
        }

        @Override
        public NodeType type() {
            return NodeType.TEXT;
        }

        @Override
        public Optional<Node> parent() {
            return Optional.of(parent);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public SourceSpan span() {
            return span;
        }

        @Override
        public RawBuffer buffer() {
            return buffer;
        }

        public String content() {
            return buffer.slice(span);
        }

        @Override
        public String toString() {
            return "Text[" + content() + "]";
        }
    }
}
