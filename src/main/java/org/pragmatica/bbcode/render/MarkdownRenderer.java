package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.error.Diagnostic;
import org.pragmatica.bbcode.tree.ElementKind;
import org.pragmatica.bbcode.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Markdown backend.
 *
 * <p>Supported conversions:
 * <ul>
 *   <li>{@code [b]text[/b]} - {@code **text**}</li>
 *   <li>{@code [i]text[/i]} - {@code *text*}</li>
 *   <li>{@code [u]text[/u]} - {@code text} (Markdown has no underline)</li>
 *   <li>{@code [url=link]text[/url]} - {@code [text](link)}</li>
 *   <li>{@code [email=addr]text[/email]} - {@code [text](mailto:addr)}</li>
 *   <li>{@code [code]text[/code]} - {@code `text`}</li>
 *   <li>{@code [quote]text[/quote]} - {@code > text}</li>
 *   <li>{@code [hr]} or {@code [line]} - {@code ---}</li>
 *   <li>{@code [list][*]one[*]two[/list]} - numbered items</li>
 * </ul>
 * Any other tag is written back as it appeared in the source, around its rendered content,
 * and reported as a warning.
 *
 * <p>Every line break in text is doubled so that each source line becomes its own paragraph.
 */
public final class MarkdownRenderer implements Renderer {
    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final MarkdownRenderer INSTANCE = new MarkdownRenderer();

    @FunctionalInterface
    private interface ElementWriter {
        void write(Node.Element element, RenderContext context) throws IOException;
    }

    private MarkdownRenderer() {}

    public static MarkdownRenderer create() {
        return INSTANCE;
    }

    @Override
    public List<Diagnostic> render(Node.Document document, Writer writer, RenderOptions options) throws IOException {
        var context = RenderContext.create(this, document, writer, options);
        renderChildren(document, context);
        writer.flush();
        return context.diagnostics();
    }

    @Override
    public void renderChildren(Node node, RenderContext context) throws IOException {
        var override = context.options()
                              .override();
        for (var child : node.children()) {
            if (override.isPresent() && override.get().render(child, context) == OverrideResult.HANDLED) {
                continue;
            }
            if (child instanceof Node.Text text) {
                writeText(text, context);
            } else if (child instanceof Node.Element element) {
                writerFor(element.kind()).write(element, context);
            }
        }
    }

    private ElementWriter writerFor(ElementKind kind) {
        return switch (kind) {
            case BOLD -> (element, context) -> wrap("**", element, context);
            case ITALIC -> (element, context) -> wrap("*", element, context);
            case CODE -> (element, context) -> wrap("`", element, context);
            case UNDERLINE, LIST_ITEM -> (element, context) -> context.renderChildren(element);
            case BLOCKQUOTE -> this::writeBlockquote;
            case HORIZONTAL_RULE -> this::writeHorizontalRule;
            case LINK -> (element, context) -> writeLink(element, "", context);
            case EMAIL -> (element, context) -> writeLink(element, "mailto:", context);
            case LIST -> this::writeList;
            case UNRECOGNIZED -> this::writeUnrecognized;
        };
    }

    private void wrap(String marker, Node.Element element, RenderContext context) throws IOException {
        context.writer().write(marker);
        context.renderChildren(element);
        context.writer().write(marker);
    }

    private void writeBlockquote(Node.Element element, RenderContext context) throws IOException {
        context.writer().write("> ");
        context.renderChildren(element);
    }

    private void writeHorizontalRule(Node.Element element, RenderContext context) throws IOException {
        context.writer().write("\n---\n");
    }

    private void writeLink(Node.Element element, String scheme, RenderContext context) throws IOException {
        var writer = context.writer();
        var target = element.value();

        if (target.isPresent()) {
            writer.write("[");
            for (var node : element.walk()) {
                if (node instanceof Node.Text text) {
                    writer.write(expandTabs(text.content(), context));
                }
            }
            writer.write("](" + scheme + target.get() + ")");
        } else {
            var text = element.text();
            writer.write("[" + text + "](" + scheme + text + ")");
        }
    }

    /**
     * Items carry no closing tag, so the list is walked as a flat sequence: each item is numbered
     * in encounter order, nested lists included, and every text ends on its own line.
     */
    private void writeList(Node.Element element, RenderContext context) throws IOException {
        var writer = context.writer();
        int item = 0;

        for (var node : element.walk()) {
            if (node instanceof Node.Element child && child.kind() == ElementKind.LIST_ITEM) {
                item++;
                writer.write(item + ". ");
            } else if (node instanceof Node.Text text) {
                writeText(text, context);
                if (!text.content().endsWith("\n")) {
                    writer.write('\n');
                }
            }
        }
    }

    private void writeUnrecognized(Node.Element element, RenderContext context) throws IOException {
        var writer = context.writer();
        writer.write(element.raw());
        context.renderChildren(element);
        var closing = element.closingRaw();
        if (closing.isPresent()) {
            writer.write(closing.get());
        }

        log.warn("Unsupported bbcode tag: {}", element.raw());
        context.report(Diagnostic.unsupportedTag(element.raw(), element.tagSpan()));
    }

    private void writeText(Node.Text text, RenderContext context) throws IOException {
        var doubled = text.content()
                          .replace("\n", "\n\n");
        context.writer().write(expandTabs(doubled, context));
        context.writer().flush();
    }

    private static String expandTabs(String text, RenderContext context) {
        var tabWidth = context.options()
                              .tabWidth();
        if (tabWidth.isEmpty()) {
            return text;
        }
        return text.replace("\t", " ".repeat(tabWidth.getAsInt()));
    }
}
