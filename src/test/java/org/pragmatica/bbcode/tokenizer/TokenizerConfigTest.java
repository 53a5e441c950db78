package org.pragmatica.bbcode.tokenizer;

import org.junit.jupiter.api.Test;
import org.pragmatica.bbcode.error.ConfigurationException;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TokenizerConfigTest {

    @Test
    void defaults_codeIsVerbatimAndEqualsRequired() {
        assertTrue(TokenizerConfig.DEFAULT.isVerbatim("code"));
        assertFalse(TokenizerConfig.DEFAULT.isVerbatim("CODE"));
        assertTrue(TokenizerConfig.DEFAULT.equalsRequiredInParameters());
    }

    @Test
    void withVerbatimTags_replacesTagsAndKeepsEqualsFlag() {
        var config = TokenizerConfig.DEFAULT.withEqualsRequired(false)
                                            .withVerbatimTags("pre", "noparse", "pre");

        assertEquals(Set.of("pre", "noparse"), config.verbatimTags());
        assertFalse(config.equalsRequiredInParameters());
    }

    @Test
    void constructor_copiesMutableSet() {
        var tags = new HashSet<>(Set.of("code"));
        var config = new TokenizerConfig(tags, true);

        tags.add("pre");

        assertFalse(config.isVerbatim("pre"));
    }

    @Test
    void nullTagName_isRejected() {
        assertThatThrownBy(() -> TokenizerConfig.DEFAULT.withVerbatimTags("code", null))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new TokenizerConfig(null, true))
            .isInstanceOf(ConfigurationException.class);
    }
}
