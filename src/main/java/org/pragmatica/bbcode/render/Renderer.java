package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.error.Diagnostic;
import org.pragmatica.bbcode.tree.Node;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Output backend. An implementation walks the tree in document order, gives the
 * {@link RenderOptions#override() override} the first chance at every node and otherwise applies
 * its own conversion per node variant and element kind.
 */
public interface Renderer {

    /**
     * Render a whole document to {@code writer}.
     *
     * @return non-fatal diagnostics reported while rendering
     * @throws IOException when the writer (or an override) fails
     */
    List<Diagnostic> render(Node.Document document, Writer writer, RenderOptions options) throws IOException;

    /**
     * Render the children of {@code node} within an ongoing render.
     */
    void renderChildren(Node node, RenderContext context) throws IOException;

    /**
     * Render a whole document into memory.
     */
    default RenderResult renderToString(Node.Document document, RenderOptions options) {
        var writer = new StringWriter();
        try {
            var diagnostics = render(document, writer, options);
            return new RenderResult(writer.toString(), diagnostics, document.buffer());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
