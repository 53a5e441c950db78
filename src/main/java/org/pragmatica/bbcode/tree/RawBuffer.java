package org.pragmatica.bbcode.tree;

/**
 * Immutable text accumulated while tokenizing. Tokens and nodes refer to it only through
 * {@link SourceSpan}s, so every span handed out is valid for as long as the buffer is reachable.
 */
public final class RawBuffer implements CharSequence {

    public static final RawBuffer EMPTY = new RawBuffer("");

    private final String content;

    private RawBuffer(String content) {
        this.content = content;
    }

    public static RawBuffer of(CharSequence content) {
        return new RawBuffer(content.toString());
    }

    public String slice(SourceSpan span) {
        return span.extract(content);
    }

    public SourceLocation locate(int offset) {
        return SourceLocation.locate(content, offset);
    }

    @Override
    public int length() {
        return content.length();
    }

    @Override
    public char charAt(int index) {
        return content.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return content.subSequence(start, end);
    }

    @Override
    public String toString() {
        return content;
    }
}
