package org.pragmatica.bbcode.render;

import org.junit.jupiter.api.Test;
import org.pragmatica.bbcode.error.ConfigurationException;

import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class RenderOptionsTest {

    @Test
    void default_hasNoOverrideAndKeepsTabs() {
        assertTrue(RenderOptions.DEFAULT.override().isEmpty());
        assertTrue(RenderOptions.DEFAULT.userData().isEmpty());
        assertTrue(RenderOptions.DEFAULT.tabWidth().isEmpty());
    }

    @Test
    void builder_setsEveryField() {
        NodeOverride override = (node, context) -> OverrideResult.USE_DEFAULT;

        var options = RenderOptions.builder()
                                   .override(override)
                                   .userData(42)
                                   .tabWidth(8)
                                   .build();

        assertSame(override, options.override().orElseThrow());
        assertEquals(Optional.of(42), options.userData());
        assertEquals(OptionalInt.of(8), options.tabWidth());
    }

    @Test
    void tabWidth_boundsAreAccepted() {
        assertEquals(0, RenderOptions.builder().tabWidth(0).build().tabWidth().getAsInt());
        assertEquals(255, RenderOptions.builder().tabWidth(255).build().tabWidth().getAsInt());
    }

    @Test
    void tabWidth_outOfRange_isRejected() {
        assertThatThrownBy(() -> RenderOptions.builder().tabWidth(256))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("[0, 255]");
        assertThatThrownBy(() -> RenderOptions.builder().tabWidth(-1))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new RenderOptions(Optional.empty(), Optional.empty(), OptionalInt.of(1000)))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void parseTabWidth_acceptsIntegers() {
        assertEquals(4, RenderOptions.parseTabWidth("4"));
    }

    @Test
    void parseTabWidth_rejectsText() {
        assertThatThrownBy(() -> RenderOptions.parseTabWidth("four"))
            .isInstanceOf(ConfigurationException.class)
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void parseTabWidth_rejectsOutOfRange() {
        assertThatThrownBy(() -> RenderOptions.parseTabWidth("999"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageEndingWith("got 999");
    }
}
