package org.pragmatica.bbcode.tokenizer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TokenResultTest {

    @Test
    void resolve_openTokenWithParameter_materializesAllParts() {
        var result = Tokenizer.tokenize("[url=https://example.com]Link[/url]");

        var token = result.get(0);

        assertEquals(TokenKind.ELEMENT_OPEN, token.kind());
        assertEquals("url", token.name());
        assertEquals(Optional.of("https://example.com"), token.value());
        assertEquals("[url=https://example.com]", token.raw());
    }

    @Test
    void resolve_closeToken_hasNameWithoutSlash() {
        var result = Tokenizer.tokenize("[b]x[/b]");

        var token = result.get(2);

        assertEquals(TokenKind.ELEMENT_CLOSE, token.kind());
        assertEquals("b", token.name());
        assertEquals("[/b]", token.raw());
        assertTrue(token.value().isEmpty());
    }

    @Test
    void iterator_yieldsEveryTokenOnce() {
        var result = Tokenizer.tokenize("a[b]c[/b]d");
        var names = new ArrayList<String>();

        for (var token : result) {
            names.add(token.name());
        }

        assertThat(names).containsExactly("a", "b", "c", "b", "d");
        assertEquals(5, result.size());
    }

    @Test
    void describe_listsBufferLocationsAndTokens() {
        var dump = Tokenizer.tokenize("[url=x]y[/url]").describe();

        assertThat(dump)
            .startsWith("TokenResult:\n  Buffer:\n[url=x]y[/url]\n")
            .contains("[0]: start=0 end=7 type=ELEMENT_OPEN p_start=5 p_end=6\n")
            .contains("[1]: start=7 end=8 type=TEXT\n")
            .contains("[2]: start=8 end=14 type=ELEMENT_CLOSE\n")
            .contains("[0]: ELEMENT_OPEN \"url\" x\n")
            .contains("[1]: TEXT \"y\" \n");
    }

    @Test
    void empty_hasNoTokensAndEmptyBuffer() {
        assertTrue(TokenResult.EMPTY.isEmpty());
        assertEquals("", TokenResult.EMPTY.buffer().toString());
        assertFalse(TokenResult.EMPTY.iterator().hasNext());
    }
}
