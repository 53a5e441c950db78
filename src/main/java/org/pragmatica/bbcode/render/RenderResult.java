package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.error.Diagnostic;
import org.pragmatica.bbcode.tree.RawBuffer;

import java.util.List;

/**
 * Rendered output together with the diagnostics reported while producing it.
 *
 * @param output      rendered text
 * @param diagnostics non-fatal diagnostics, empty when every tag was supported
 * @param source      raw buffer of the rendered document (for formatting diagnostics)
 */
public record RenderResult(
    String output,
    List<Diagnostic> diagnostics,
    RawBuffer source
) {
    public RenderResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                .count();
    }

    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}
