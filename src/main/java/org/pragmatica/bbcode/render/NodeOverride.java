package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.tree.Node;

import java.io.IOException;

/**
 * Caller-supplied hook invoked for every node before the built-in conversion.
 *
 * <p>Runs inline with the traversal and may write to {@link RenderContext#writer()}. When it
 * returns {@link OverrideResult#HANDLED} the renderer does not visit the node's children;
 * {@link RenderContext#renderChildren(Node)} is available for that.
 */
@FunctionalInterface
public interface NodeOverride {
    OverrideResult render(Node node, RenderContext context) throws IOException;
}
