package org.pragmatica.bbcode.render;

/**
 * Outcome of a {@link NodeOverride} call.
 */
public enum OverrideResult {
    /**
     * The override wrote the node, children included; default handling is skipped.
     */
    HANDLED,
    /**
     * Fall through to the renderer's built-in conversion.
     */
    USE_DEFAULT
}
