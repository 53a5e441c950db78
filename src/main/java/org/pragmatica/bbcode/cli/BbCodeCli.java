package org.pragmatica.bbcode.cli;

import org.pragmatica.bbcode.BbCode;
import org.pragmatica.bbcode.error.ConfigurationException;
import org.pragmatica.bbcode.tokenizer.TokenizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Command line converter from BBCode to Markdown.
 */
public final class BbCodeCli {
    private static final Logger log = LoggerFactory.getLogger(BbCodeCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private BbCodeCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Run a conversion; standard streams are used where no file is given and are left open.
     *
     * @return process exit code
     */
    public static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (ConfigurationException e) {
            log.debug("Rejected arguments", e);
            stderr.println("Error: " + e.getMessage());
            stderr.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        if (options.help()) {
            stderr.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        try {
            convert(options, stdin, stdout);
            return EXIT_OK;
        } catch (IOException e) {
            log.debug("Conversion failed", e);
            stderr.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    private static void convert(CliOptions options, InputStream stdin, OutputStream stdout) throws IOException {
        var reader = openInput(options, stdin);
        try {
            var writer = openOutput(options, stdout);
            try {
                var diagnostics = BbCode.convert(reader, writer, TokenizerConfig.DEFAULT, options.renderOptions());
                log.debug("Converted with {} diagnostic(s)", diagnostics.size());
            } finally {
                if (options.output().isPresent()) {
                    writer.close();
                } else {
                    writer.flush();
                }
            }
        } finally {
            if (options.input().isPresent()) {
                reader.close();
            }
        }
    }

    private static Reader openInput(CliOptions options, InputStream stdin) throws IOException {
        if (options.input().isPresent()) {
            return Files.newBufferedReader(options.input().get(), StandardCharsets.UTF_8);
        }
        return new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    }

    private static Writer openOutput(CliOptions options, OutputStream stdout) throws IOException {
        if (options.output().isPresent()) {
            return Files.newBufferedWriter(options.output().get(), StandardCharsets.UTF_8);
        }
        return new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
    }
}
