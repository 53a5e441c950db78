package org.pragmatica.bbcode.tokenizer;

import org.pragmatica.bbcode.tree.RawBuffer;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Output of the {@link Tokenizer}: the raw buffer and the tokens pointing into it.
 * Iterating yields {@link ResolvedToken}s with their text materialized.
 */
public record TokenResult(RawBuffer buffer, List<Token> tokens) implements Iterable<TokenResult.ResolvedToken> {

    public static final TokenResult EMPTY = new TokenResult(RawBuffer.EMPTY, List.of());

    public TokenResult {
        tokens = List.copyOf(tokens);
    }

    /**
     * Token with its spans resolved against the buffer.
     */
    public record ResolvedToken(TokenKind kind, String name, Optional<String> value, String raw) {}

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public ResolvedToken resolve(Token token) {
        return new ResolvedToken(token.kind(),
                                 buffer.slice(token.name()),
                                 token.value()
                                      .map(buffer::slice),
                                 buffer.slice(token.raw()));
    }

    public ResolvedToken get(int index) {
        return resolve(tokens.get(index));
    }

    @Override
    public Iterator<ResolvedToken> iterator() {
        var source = tokens.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public ResolvedToken next() {
                return resolve(source.next());
            }
        };
    }

    /**
     * Debug dump: the buffer, every token location, then every resolved token.
     */
    public String describe() {
        var sb = new StringBuilder();
        sb.append("TokenResult:\n");
        sb.append("  Buffer:\n");
        sb.append(buffer).append("\n\n");

        sb.append("  Locations:\n");
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            sb.append(String.format("    [%d]: start=%d end=%d type=%s",
                                    i, token.raw().start(), token.raw().end(), token.kind()));
            token.value()
                 .ifPresent(p -> sb.append(String.format(" p_start=%d p_end=%d", p.start(), p.end())));
            sb.append("\n");
        }
        sb.append("\n");

        sb.append("  Tokens:\n");
        int index = 0;
        for (var token : this) {
            sb.append(String.format("    [%d]: %s \"%s\" %s\n",
                                    index++, token.kind(), token.name(), token.value().orElse("")));
        }
        return sb.toString();
    }
}
