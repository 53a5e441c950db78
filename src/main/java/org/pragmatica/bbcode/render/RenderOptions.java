package org.pragmatica.bbcode.render;

import org.pragmatica.bbcode.error.ConfigurationException;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Rendering configuration options.
 *
 * @param override per-node hook run before the built-in conversion
 * @param userData payload for the hook, never inspected by the renderer
 * @param tabWidth number of spaces each tab expands to, in {@code [0, 255]}; tabs are kept when absent
 */
public record RenderOptions(
    Optional<NodeOverride> override,
    Optional<Object> userData,
    OptionalInt tabWidth
) {
    public static final int MAX_TAB_WIDTH = 255;

    public static final RenderOptions DEFAULT = new RenderOptions(
        Optional.empty(),
        Optional.empty(),
        OptionalInt.empty()
    );

    public RenderOptions {
        if (tabWidth.isPresent()) {
            checkTabWidth(tabWidth.getAsInt());
        }
    }

    /**
     * Parse a tab width given as text, e.g. on the command line.
     *
     * @throws ConfigurationException when the text is not an integer in {@code [0, 255]}
     */
    public static int parseTabWidth(String text) {
        int width;
        try {
            width = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw ConfigurationException.invalidTabWidth(text, e);
        }
        return checkTabWidth(width);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int checkTabWidth(int width) {
        if (width < 0 || width > MAX_TAB_WIDTH) {
            throw ConfigurationException.invalidTabWidth(width);
        }
        return width;
    }

    public static final class Builder {
        private NodeOverride override;
        private Object userData;
        private Integer tabWidth;

        private Builder() {}

        public Builder override(NodeOverride override) {
            this.override = override;
            return this;
        }

        public Builder userData(Object userData) {
            this.userData = userData;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            this.tabWidth = checkTabWidth(tabWidth);
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(Optional.ofNullable(override),
                                     Optional.ofNullable(userData),
                                     tabWidth == null ? OptionalInt.empty() : OptionalInt.of(tabWidth));
        }
    }
}
