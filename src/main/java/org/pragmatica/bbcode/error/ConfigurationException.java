package org.pragmatica.bbcode.error;

/**
 * Invalid configuration, rejected before any tokenizing or rendering starts.
 */
public final class ConfigurationException extends RuntimeException {

    public static final String TAB_WIDTH_RANGE = "convert_tab_size must be an integer in range of [0, 255]";

    private ConfigurationException(String message) {
        super(message);
    }

    private ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException invalid(String message) {
        return new ConfigurationException(message);
    }

    public static ConfigurationException invalidTabWidth(int width) {
        return new ConfigurationException(TAB_WIDTH_RANGE + ", got " + width);
    }

    public static ConfigurationException invalidTabWidth(String text, Throwable cause) {
        return new ConfigurationException(TAB_WIDTH_RANGE + ", got '" + text + "'", cause);
    }
}
