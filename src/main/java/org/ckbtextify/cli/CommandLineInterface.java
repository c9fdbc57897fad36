package org.ckbtextify.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ckbtextify.api.DiacriticsMode;
import org.ckbtextify.api.EmojiMode;
import org.ckbtextify.api.InvalidConfigurationException;
import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.api.ShaddaMode;
import org.ckbtextify.config.ConfigLoader;
import org.ckbtextify.config.LoggingConfigurator;
import org.ckbtextify.pipeline.NormalizationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Command-line front end: reads text from an argument, a file or standard input and prints its
 * normalized form.
 */
@Command(
    name = "ckb-textify",
    mixinStandardHelpOptions = true,
    version = "ckb-textify 2.0.0",
    description = "Normalizes Central Kurdish (Sorani) text for text-to-speech."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT",
        description = "A file to normalize, or the text itself. Standard input is read when omitted.")
    private String input;

    @Option(names = {"-o", "--output"}, description = "Write the result to this file instead of standard output.")
    private File output;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: ckb-textify.conf).")
    private File configFile;

    @Option(names = "--no-numbers", description = "Leave numerals as they are.")
    private boolean noNumbers;
    @Option(names = "--no-web", description = "Leave URLs and e-mail addresses as they are.")
    private boolean noWeb;
    @Option(names = "--no-phone", description = "Leave phone numbers as they are.")
    private boolean noPhone;
    @Option(names = "--no-date-time", description = "Leave dates and times as they are.")
    private boolean noDateTime;
    @Option(names = "--no-units", description = "Leave measurement units as they are.")
    private boolean noUnits;
    @Option(names = "--no-currency", description = "Leave currency amounts as they are.")
    private boolean noCurrency;
    @Option(names = "--no-tech", description = "Leave hashtags, mentions and codes as they are.")
    private boolean noTech;
    @Option(names = "--no-math", description = "Leave math notation as it is.")
    private boolean noMath;
    @Option(names = "--no-diacritics", description = "Leave vowel marks as they are.")
    private boolean noDiacritics;
    @Option(names = "--no-symbols", description = "Leave symbols as they are.")
    private boolean noSymbols;
    @Option(names = "--no-linguistics", description = "Skip abbreviations, names and character normalization.")
    private boolean noLinguistics;
    @Option(names = "--no-transliteration", description = "Leave foreign-script words as they are.")
    private boolean noTransliteration;

    @Option(names = "--pause", description = "Turn clause punctuation into the pause marker '|'.")
    private boolean pause;

    @Option(names = "--emoji", paramLabel = "MODE", description = "remove, convert or ignore.")
    private String emojiMode;

    @Option(names = "--diacritics-mode", paramLabel = "MODE", description = "convert, remove or keep.")
    private String diacriticsMode;

    @Option(names = "--shadda", paramLabel = "MODE", description = "double or remove.")
    private String shaddaMode;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        System.exit(commandLine.execute(args));
    }

    @Override
    public Integer call() {
        final NormalizationConfig config;
        try {
            final Config root = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(root);
            config = applyOptions(NormalizationConfig.fromConfig(root));
        } catch (InvalidConfigurationException | ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return EXIT_INVALID_CONFIG;
        }

        try {
            final String text = readInput();
            final String normalized = new NormalizationPipeline(config).normalize(text);
            writeOutput(normalized);
            return EXIT_OK;
        } catch (IOException e) {
            LOG.error("I/O error: {}", e.getMessage());
            spec.commandLine().getErr().println("I/O error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    NormalizationConfig applyOptions(final NormalizationConfig base) {
        final NormalizationConfig.Builder b = NormalizationConfig.builder()
            .numbers(base.numbers() && !noNumbers)
            .web(base.web() && !noWeb)
            .phone(base.phone() && !noPhone)
            .dateTime(base.dateTime() && !noDateTime)
            .units(base.units() && !noUnits)
            .currency(base.currency() && !noCurrency)
            .technical(base.technical() && !noTech)
            .math(base.math() && !noMath)
            .diacritics(base.diacritics() && !noDiacritics)
            .symbols(base.symbols() && !noSymbols)
            .linguistics(base.linguistics() && !noLinguistics)
            .transliteration(base.transliteration() && !noTransliteration)
            .pauseMarkers(base.pauseMarkers() || pause)
            .emojiMode(emojiMode == null ? base.emojiMode() : NormalizationConfig.parseMode(EmojiMode.class, emojiMode))
            .diacriticsMode(diacriticsMode == null ? base.diacriticsMode() : NormalizationConfig.parseMode(DiacriticsMode.class, diacriticsMode))
            .shaddaMode(shaddaMode == null ? base.shaddaMode() : NormalizationConfig.parseMode(ShaddaMode.class, shaddaMode))
            .scientificLowerBound(base.scientificLowerBound())
            .scientificUpperBound(base.scientificUpperBound());
        return b.build();
    }

    private String readInput() throws IOException {
        if (input == null) {
            final InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        final File file = new File(input);
        if (file.isFile()) {
            LOG.debug("Reading input from file: {}", file.getAbsolutePath());
            return Files.readString(file.toPath(), StandardCharsets.UTF_8);
        }
        return input;
    }

    private void writeOutput(final String normalized) throws IOException {
        if (output != null) {
            Files.writeString(output.toPath(), normalized + System.lineSeparator(), StandardCharsets.UTF_8);
            LOG.debug("Wrote output to {}", output.getAbsolutePath());
            return;
        }
        final PrintWriter out = spec.commandLine().getOut();
        out.println(normalized);
        out.flush();
    }
}
