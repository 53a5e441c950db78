package org.pragmatica.bbcode.tokenizer;

import org.pragmatica.bbcode.tree.RawBuffer;
import org.pragmatica.bbcode.tree.SourceSpan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BBCode tokenizer - a single pass state machine over the input characters.
 *
 * <p>Malformed markup never fails tokenization: a bracketed slice that does not pass the
 * validity check simply stays part of the surrounding text. Only the underlying reader can fail.
 *
 * <p>A backslash in front of one of {@code [ ] = } or a space makes that character literal; the
 * backslash itself is dropped. In front of any other character the backslash is kept as is.
 */
public final class Tokenizer {
    private static final char ESCAPE = '\\';
    private static final String ESCAPABLE = "[]= ";
    private static final int MIN_TAG_LENGTH = 3;

    private enum State {
        TEXT,
        ELEMENT,
        CLOSING_ELEMENT,
        ELEMENT_WITH_PARAMETER
    }

    private final Reader reader;
    private final TokenizerConfig config;
    private final StringBuilder buffer;
    private final List<Token> tokens;

    private State state;
    private int start;
    private int parameterStart;
    private char lastChar;
    private Optional<String> verbatimTag;

    private Tokenizer(Reader reader, TokenizerConfig config) {
        this.reader = reader;
        this.config = config;
        this.buffer = new StringBuilder();
        this.tokens = new ArrayList<>();
        this.state = State.TEXT;
        this.start = 0;
        this.parameterStart = -1;
        this.lastChar = 0;
        this.verbatimTag = Optional.empty();
    }

    public static TokenResult tokenize(String input) {
        return tokenize(input, TokenizerConfig.DEFAULT);
    }

    public static TokenResult tokenize(String input, TokenizerConfig config) {
        try {
            return new Tokenizer(new StringReader(input), config).tokenizeAll();
        } catch (IOException e) {
            // StringReader only fails once closed
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Tokenize everything {@code reader} provides. The reader is not closed.
     */
    public static TokenResult tokenize(Reader reader, TokenizerConfig config) throws IOException {
        var source = reader instanceof BufferedReader || reader instanceof StringReader
                     ? reader
                     : new BufferedReader(reader);
        return new Tokenizer(source, config).tokenizeAll();
    }

    private TokenResult tokenizeAll() throws IOException {
        int read;
        while ((read = reader.read()) != -1) {
            char c = (char) read;
            boolean escaped = false;

            if (c == ESCAPE) {
                int next = reader.read();
                if (next == -1) {
                    buffer.append(c);
                    break;
                }
                if (canBeEscaped((char) next)) {
                    escaped = true;
                } else {
                    buffer.append(c);
                }
                c = (char) next;
            }

            int current = buffer.length();
            buffer.append(c);

            if (!escaped) {
                advance(c, current);
            }
            lastChar = c;
        }

        if (buffer.length() > start) {
            tokens.add(Token.text(SourceSpan.of(start, buffer.length())));
        }
        return new TokenResult(RawBuffer.of(buffer), coalesceText(tokens));
    }

    private void advance(char c, int current) {
        switch (c) {
            case '[' -> openBracket(current);
            case ' ' -> {
                if (lastChar != ' ' && state == State.ELEMENT) {
                    beginParameter(current);
                }
            }
            case '=' -> {
                if (state == State.ELEMENT) {
                    beginParameter(current);
                }
            }
            case '/' -> {
                if (state == State.ELEMENT && lastChar == '[') {
                    state = State.CLOSING_ELEMENT;
                }
            }
            case ']' -> closeBracket(current);
            default -> {}
        }
    }

    private void openBracket(int current) {
        if (state != State.TEXT) {
            return;
        }
        if (current > start) {
            tokens.add(Token.text(SourceSpan.of(start, current)));
        }
        state = State.ELEMENT;
        start = current;
    }

    private void beginParameter(int current) {
        parameterStart = current + 1;
        state = State.ELEMENT_WITH_PARAMETER;
    }

    private void closeBracket(int current) {
        if (state == State.TEXT) {
            return;
        }
        var slice = buffer.subSequence(start, current + 1);
        var tagName = tagName(slice);

        // An invalid slice is left in place: it becomes part of the text that follows.
        if (isElementValid(slice, tagName)) {
            if (config.isVerbatim(tagName)) {
                verbatimTag = state == State.CLOSING_ELEMENT
                              ? Optional.empty()
                              : Optional.of(tagName);
            }
            var raw = SourceSpan.of(start, current + 1);
            tokens.add(state == State.CLOSING_ELEMENT
                       ? Token.close(raw)
                       : Token.open(raw, parameterSpan(current)));
            start = current + 1;
        }
        state = State.TEXT;
        parameterStart = -1;
    }

    private Optional<SourceSpan> parameterSpan(int current) {
        return parameterStart < 0
               ? Optional.empty()
               : Optional.of(SourceSpan.of(parameterStart, current));
    }

    private boolean isElementValid(CharSequence slice, String tagName) {
        if (verbatimTag.isPresent() && !verbatimTag.get().equals(tagName)) {
            return false;
        }
        if (config.equalsRequiredInParameters() && contains(slice, ' ') && !contains(slice, '=')) {
            return false;
        }
        return slice.length() >= MIN_TAG_LENGTH;
    }

    /**
     * Tag name of a bracketed slice: a leading {@code /} is skipped and the name ends at the
     * first space or {@code =} after its first character.
     */
    static String tagName(CharSequence slice) {
        if (slice.length() == 2) {
            return "";
        }
        int nameStart = slice.charAt(1) == '/' ? 2 : 1;
        int nameEnd = slice.length() - 1;
        for (int i = nameStart + 1; i < slice.length(); i++) {
            char c = slice.charAt(i);
            if (c == ' ' || c == '=') {
                nameEnd = i;
                break;
            }
        }
        return slice.subSequence(nameStart, Math.max(nameStart, nameEnd))
                    .toString();
    }

    private static boolean canBeEscaped(char c) {
        return ESCAPABLE.indexOf(c) >= 0;
    }

    private static boolean contains(CharSequence slice, char c) {
        for (int i = 0; i < slice.length(); i++) {
            if (slice.charAt(i) == c) {
                return true;
            }
        }
        return false;
    }

    private static List<Token> coalesceText(List<Token> tokens) {
        var result = new ArrayList<Token>(tokens.size());
        for (var token : tokens) {
            int last = result.size() - 1;
            if (token.isText() && last >= 0 && result.get(last).isText()) {
                result.set(last, result.get(last).extendTo(token));
            } else {
                result.add(token);
            }
        }
        return result;
    }
}
