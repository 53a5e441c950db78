package org.pragmatica.bbcode.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BbCodeCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderrBytes = new ByteArrayOutputStream();
    private final PrintStream stderr = new PrintStream(stderrBytes, true, StandardCharsets.UTF_8);
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(BbCodeCli.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void run_standardStreams_convertsInput() {
        int exit = run("[b]Hi[/b] [i]there[/i]");

        assertEquals(BbCodeCli.EXIT_OK, exit);
        assertEquals("**Hi** *there*", stdout());
    }

    @Test
    void run_files_convertsInputToOutput() throws IOException {
        var input = tempDir.resolve("post.bb");
        var output = tempDir.resolve("post.md");
        Files.writeString(input, "[b]Hi[/b]\n", StandardCharsets.UTF_8);

        int exit = run("", "--input", input.toString(), "--output", output.toString());

        assertEquals(BbCodeCli.EXIT_OK, exit);
        assertEquals("**Hi**\n\n", Files.readString(output, StandardCharsets.UTF_8));
        assertEquals("", stdout());
    }

    @Test
    void run_tabSize_expandsTabs() {
        int exit = run("a\tb", "--convert-tab-size", "2");

        assertEquals(BbCodeCli.EXIT_OK, exit);
        assertEquals("a  b", stdout());
    }

    @Test
    void run_unicode_isPreserved() {
        run("[i]héllo wörld ✓[/i]");

        assertEquals("*héllo wörld ✓*", stdout());
    }

    @Test
    void run_missingInputFile_failsWithIoError() {
        var missing = tempDir.resolve("missing.bb");

        int exit = run("", "--input", missing.toString());

        assertEquals(BbCodeCli.EXIT_IO_ERROR, exit);
        assertThat(stderr()).startsWith("Error: ");
    }

    @Test
    void run_failure_isReportedOnceOnStderr() {
        int exit = run("", "--input", tempDir.resolve("missing.bb").toString());

        assertEquals(BbCodeCli.EXIT_IO_ERROR, exit);
        assertEquals(1, stderr().split("Error: ", -1).length - 1);
        assertThat(appender.list).allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.DEBUG));
        assertThat(appender.list).isNotEmpty();
    }

    @Test
    void run_invalidArguments_areNotLoggedAboveDebug() {
        assertEquals(BbCodeCli.EXIT_USAGE, run("x", "--nope"));

        assertEquals(1, stderr().split("Error: ", -1).length - 1);
        assertThat(appender.list).noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.INFO));
    }

    @Test
    void run_invalidTabSize_failsWithUsage() {
        int exit = run("x", "--convert-tab-size", "300");

        assertEquals(BbCodeCli.EXIT_USAGE, exit);
        assertThat(stderr()).contains("convert_tab_size must be an integer in range of [0, 255]")
                            .contains("Usage: bbcode");
        assertEquals("", stdout());
    }

    @Test
    void run_unknownOption_failsWithUsage() {
        assertEquals(BbCodeCli.EXIT_USAGE, run("x", "--nope"));
        assertThat(stderr()).contains("Unknown option: --nope");
    }

    @Test
    void run_help_printsUsage() {
        assertEquals(BbCodeCli.EXIT_OK, run("", "--help"));
        assertThat(stderr()).contains("--convert-tab-size");
        assertEquals("", stdout());
    }

    private int run(String stdin, String... args) {
        var in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return BbCodeCli.run(args, in, stdout, stderr);
    }

    private String stdout() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return stderrBytes.toString(StandardCharsets.UTF_8);
    }
}
