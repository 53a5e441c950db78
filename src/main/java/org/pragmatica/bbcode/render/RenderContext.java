package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.error.Diagnostic;
import org.pragmatica.bbcode.tree.Node;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State of a single render: the sink, the document being rendered, the options and the
 * diagnostics reported so far. Passed to every {@link NodeOverride} call.
 */
public final class RenderContext {
    private final Renderer renderer;
    private final Node.Document document;
    private final Writer writer;
    private final RenderOptions options;
    private final List<Diagnostic> diagnostics;

    private RenderContext(Renderer renderer, Node.Document document, Writer writer, RenderOptions options) {
        this.renderer = renderer;
        this.document = document;
        this.writer = writer;
        this.options = options;
        this.diagnostics = new ArrayList<>();
    }

    public static RenderContext create(Renderer renderer, Node.Document document, Writer writer, RenderOptions options) {
        return new RenderContext(renderer, document, writer, options);
    }

    public Writer writer() {
        return writer;
    }

    public Node.Document document() {
        return document;
    }

    public RenderOptions options() {
        return options;
    }

    public Optional<Object> userData() {
        return options.userData();
    }

    /**
     * User data cast to {@code type}, empty when absent or of another type.
     */
    public <T> Optional<T> userData(Class<T> type) {
        return options.userData()
                      .filter(type::isInstance)
                      .map(type::cast);
    }

    /**
     * Render the children of {@code node} with the current renderer, running the override for each.
     */
    public void renderChildren(Node node) throws IOException {
        renderer.renderChildren(node, this);
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
