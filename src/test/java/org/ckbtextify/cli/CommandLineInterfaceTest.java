package org.ckbtextify.cli;

import org.ckbtextify.api.EmojiMode;
import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the command-line front end through picocli, with standard output and error captured.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLineInterface cli;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cli = new CommandLineInterface();
        cmd = new CommandLine(cli);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void testCliInitialization() {
        assertThat(cmd.getCommandName()).isEqualTo("ckb-textify");
    }

    @Test
    void normalizesTextArgument() {
        // Act
        int exitCode = cmd.execute("2025");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().strip()).isEqualTo("دوو ھەزار و بیست و پێنج");
    }

    @Test
    void disablesModulesFromFlags() {
        // Act
        int exitCode = cmd.execute("--no-numbers", "5");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().strip()).isEqualTo("5");
    }

    @Test
    void readsInputFileAndWritesOutputFile() throws IOException {
        // Arrange
        Path input = tempDir.resolve("in.txt");
        Path output = tempDir.resolve("out.txt");
        Files.writeString(input, "100 $", StandardCharsets.UTF_8);

        // Act
        int exitCode = cmd.execute("-o", output.toString(), input.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(Files.readString(output, StandardCharsets.UTF_8).strip()).isEqualTo("سەد دۆلار");
        assertThat(out.toString()).isEmpty();
    }

    /**
     * A bad mode name is a configuration error, reported on stderr with exit code 2.
     */
    @Test
    void rejectsUnknownModeWithConfigExitCode() {
        // Act
        int exitCode = cmd.execute("--emoji", "sparkle", "x");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID_CONFIG);
        assertThat(err.toString()).contains("Unknown EmojiMode 'sparkle'");
    }

    @Test
    void rejectsMalformedConfigFile() throws IOException {
        // Arrange
        Path config = tempDir.resolve("broken.conf");
        Files.writeString(config, "ckb-textify { normalization { numbers = ", StandardCharsets.UTF_8);

        // Act
        int exitCode = cmd.execute("-c", config.toString(), "5");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID_CONFIG);
        assertThat(err.toString()).startsWith("Invalid configuration");
    }

    @Test
    void reportsUnwritableOutputAsIoError() {
        // Act
        int exitCode = cmd.execute("-o", tempDir.toString(), "5");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).startsWith("I/O error");
    }

    /**
     * Command-line switches are layered over the configured values; a module disabled in the file stays off.
     */
    @Test
    void appliesOptionsOnTopOfConfiguredValues() {
        // Arrange
        cmd.parseArgs("--pause", "--emoji", "convert", "--no-math");
        NormalizationConfig base = NormalizationConfig.builder().numbers(false).build();

        // Act
        NormalizationConfig config = cli.applyOptions(base);

        // Assert
        assertThat(config.numbers()).isFalse();
        assertThat(config.math()).isFalse();
        assertThat(config.web()).isTrue();
        assertThat(config.pauseMarkers()).isTrue();
        assertThat(config.emojiMode()).isEqualTo(EmojiMode.CONVERT);
    }
}
