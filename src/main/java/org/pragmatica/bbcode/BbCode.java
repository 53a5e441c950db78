package org.pragmatica.bbcode;

import org.pragmatica.bbcode.error.Diagnostic;
import org.pragmatica.bbcode.render.MarkdownRenderer;
import org.pragmatica.bbcode.render.RenderOptions;
import org.pragmatica.bbcode.render.RenderResult;
import org.pragmatica.bbcode.tokenizer.TokenResult;
import org.pragmatica.bbcode.tokenizer.Tokenizer;
import org.pragmatica.bbcode.tokenizer.TokenizerConfig;
import org.pragmatica.bbcode.tree.Node;
import org.pragmatica.bbcode.tree.TreeBuilder;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Entry point for converting BBCode.
 *
 * <p>Example usage:
 * <pre>{@code
 * var markdown = BbCode.toMarkdown("[b]Hello, World![/b]");   // **Hello, World!**
 *
 * var document = BbCode.load(reader, TokenizerConfig.DEFAULT.withEqualsRequired(false));
 * MarkdownRenderer.create().render(document, writer, RenderOptions.builder()
 *                                                                 .tabWidth(4)
 *                                                                 .build());
 * }</pre>
 */
public final class BbCode {
    private BbCode() {}

    /**
     * Tokenize text with the default configuration.
     */
    public static TokenResult tokenize(String input) {
        return Tokenizer.tokenize(input, TokenizerConfig.DEFAULT);
    }

    /**
     * Tokenize text with custom configuration.
     */
    public static TokenResult tokenize(String input, TokenizerConfig config) {
        return Tokenizer.tokenize(input, config);
    }

    /**
     * Build a document from text with the default configuration.
     */
    public static Node.Document load(String input) {
        return load(input, TokenizerConfig.DEFAULT);
    }

    /**
     * Build a document from text with custom configuration.
     */
    public static Node.Document load(String input, TokenizerConfig config) {
        return TreeBuilder.build(Tokenizer.tokenize(input, config));
    }

    /**
     * Build a document from everything {@code reader} provides. The reader is not closed.
     */
    public static Node.Document load(Reader reader, TokenizerConfig config) throws IOException {
        return TreeBuilder.build(Tokenizer.tokenize(reader, config));
    }

    /**
     * Convert text to Markdown with default options.
     */
    public static String toMarkdown(String input) {
        return toMarkdown(input, RenderOptions.DEFAULT).output();
    }

    /**
     * Convert text to Markdown, returning the output with any diagnostics.
     */
    public static RenderResult toMarkdown(String input, RenderOptions options) {
        return MarkdownRenderer.create()
                               .renderToString(load(input), options);
    }

    /**
     * Stream conversion: read BBCode from {@code reader}, write Markdown to {@code writer}.
     */
    public static List<Diagnostic> convert(Reader reader,
                                          Writer writer,
                                          TokenizerConfig config,
                                          RenderOptions options) throws IOException {
        return MarkdownRenderer.create()
                               .render(load(reader, config), writer, options);
    }
}
