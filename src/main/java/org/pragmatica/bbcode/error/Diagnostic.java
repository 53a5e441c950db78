package org.pragmatica.bbcode.error;

import org.pragmatica.bbcode.tree.RawBuffer;
import org.pragmatica.bbcode.tree.SourceLocation;
import org.pragmatica.bbcode.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-fatal finding reported while rendering, formatted Rust-style against the source.
 *
 * <p>Example output:
 * <pre>
 * warning[W001]: unsupported tag [s]
 *   --> input:2:7
 *   |
 * 2 | Plain [s]strike[/s]
 *   |       ^^^ passed through unchanged
 *   |
 * </pre>
 *
 * @param severity severity level
 * @param code     optional diagnostic code (e.g., "W001")
 * @param message  primary message
 * @param span     span in the raw buffer the diagnostic points at
 * @param label    text printed next to the underline, may be empty
 * @param notes    additional notes
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    public static final String UNSUPPORTED_TAG = "W001";

    public enum Severity {
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, code, message, span, "", List.of());
    }

    public static Diagnostic unsupportedTag(String rawTag, SourceSpan span) {
        return warning(UNSUPPORTED_TAG, "unsupported tag " + rawTag, span)
            .withLabel("passed through unchanged");
    }

    public Diagnostic withLabel(String text) {
        return new Diagnostic(severity, code, message, span, text, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, label, List.copyOf(newNotes));
    }

    /**
     * Format this diagnostic with the offending line and an underline.
     *
     * @param source   buffer the span refers to
     * @param filename optional filename for display
     */
    public String format(RawBuffer source, String filename) {
        var sb = new StringBuilder();
        var start = source.locate(span.start());
        var lines = source.toString()
                          .split("\n", -1);

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start).append("\n");

        var lineNumber = String.valueOf(start.line());
        var gutter = " ".repeat(lineNumber.length() + 1);
        sb.append(gutter).append("|\n");

        if (start.line() <= lines.length) {
            var lineContent = lines[start.line() - 1];
            sb.append(lineNumber).append(" | ").append(lineContent).append("\n");
            sb.append(gutter).append("| ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(underlineLength(start, lineContent)));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line format for log output.
     */
    public String formatSimple(RawBuffer source) {
        return String.format("%s: %s: %s", source.locate(span.start()), severity.display(), message);
    }

    private int underlineLength(SourceLocation start, String lineContent) {
        int available = lineContent.length() - (start.column() - 1);
        return Math.max(1, Math.min(span.length(), available));
    }
}
