package org.pragmatica.bbcode.tokenizer;

import org.pragmatica.bbcode.error.ConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Tokenizer configuration options.
 *
 * @param verbatimTags               tags whose content is never split into nested tags
 * @param equalsRequiredInParameters when true, {@code [name param]} is not a tag, only {@code [name=param]} is
 */
public record TokenizerConfig(
    Set<String> verbatimTags,
    boolean equalsRequiredInParameters
) {
    public static final TokenizerConfig DEFAULT = new TokenizerConfig(
        Set.of("code"),
        true
    );

    public TokenizerConfig {
        verbatimTags = checkedCopy(verbatimTags);
    }

    public TokenizerConfig withVerbatimTags(String... tags) {
        return new TokenizerConfig(checkedCopy(Arrays.asList(tags)), equalsRequiredInParameters);
    }

    public TokenizerConfig withEqualsRequired(boolean required) {
        return new TokenizerConfig(verbatimTags, required);
    }

    public boolean isVerbatim(String tagName) {
        return verbatimTags.contains(tagName);
    }

    private static Set<String> checkedCopy(Collection<String> tags) {
        if (tags == null) {
            throw ConfigurationException.invalid("verbatim tags must not be null");
        }
        for (var tag : tags) {
            if (tag == null) {
                throw ConfigurationException.invalid("verbatim tag names must not be null");
            }
        }
        return Set.copyOf(tags);
    }
}
