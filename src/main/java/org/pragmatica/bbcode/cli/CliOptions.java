package org.pragmatica.bbcode.cli;

import org.pragmatica.bbcode.error.ConfigurationException;
import org.pragmatica.bbcode.render.RenderOptions;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Command line arguments of {@link BbCodeCli}.
 *
 * @param input    file to read, standard input when absent
 * @param output   file to write, standard output when absent
 * @param tabWidth spaces per tab, tabs are kept when absent
 * @param help     print usage and exit
 */
public record CliOptions(
    Optional<Path> input,
    Optional<Path> output,
    OptionalInt tabWidth,
    boolean help
) {
    public static final String USAGE = String.join("\n",
        "Usage: bbcode [--input <file>] [--output <file>] [--convert-tab-size <n>]",
        "  --input <file>            BBCode file to convert (default: standard input)",
        "  --output <file>           Markdown file to write (default: standard output)",
        "  --convert-tab-size <n>    Convert tabs to the given number of spaces within [0, 255]",
        "  --help                    Print this message");

    /**
     * Parse arguments; each option takes its value either as the next argument or after {@code =}.
     *
     * @throws ConfigurationException on unknown options, missing values or an invalid tab size
     */
    public static CliOptions parse(String... args) {
        Optional<Path> input = Optional.empty();
        Optional<Path> output = Optional.empty();
        OptionalInt tabWidth = OptionalInt.empty();
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            var name = arg;
            String inlineValue = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                name = arg.substring(0, equals);
                inlineValue = arg.substring(equals + 1);
            }

            switch (name) {
                case "--help", "-h" -> help = true;
                case "--input" -> {
                    var value = inlineValue != null ? inlineValue : valueAfter(args, i++, name);
                    input = Optional.of(Path.of(value));
                }
                case "--output" -> {
                    var value = inlineValue != null ? inlineValue : valueAfter(args, i++, name);
                    output = Optional.of(Path.of(value));
                }
                case "--convert-tab-size", "--convert_tab_size" -> {
                    var value = inlineValue != null ? inlineValue : valueAfter(args, i++, name);
                    tabWidth = OptionalInt.of(RenderOptions.parseTabWidth(value));
                }
                default -> throw ConfigurationException.invalid("Unknown option: " + arg);
            }
        }
        return new CliOptions(input, output, tabWidth, help);
    }

    public RenderOptions renderOptions() {
        var builder = RenderOptions.builder();
        tabWidth.ifPresent(builder::tabWidth);
        return builder.build();
    }

    private static String valueAfter(String[] args, int index, String name) {
        if (index + 1 >= args.length) {
            throw ConfigurationException.invalid("Missing value for " + name);
        }
        return args[index + 1];
    }
}
