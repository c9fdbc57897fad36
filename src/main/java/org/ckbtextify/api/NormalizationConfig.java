package org.ckbtextify.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Immutable set of toggles and modes, built once per pipeline and shared read-only by all
 * modules.
 *
 * @param numbers               Spell out numerals.
 * @param web                   Read URLs and e-mail addresses aloud.
 * @param phone                 Read phone numbers in digit groups.
 * @param dateTime              Render dates and clock times.
 * @param units                 Tag and render measurement units.
 * @param currency              Render currency amounts.
 * @param technical             Spell hashtags, mentions and alphanumeric codes.
 * @param math                  Read operators, fractions, variables and math functions.
 * @param diacritics            Process Arabic-script vowel marks according to {@code diacriticsMode}.
 * @param symbols               Replace or drop unspeakable symbols.
 * @param linguistics           Abbreviations, names and character normalization.
 * @param transliteration       Transliterate Latin, Cyrillic and Greek words.
 * @param pauseMarkers          Turn clause punctuation into the TTS pause marker.
 * @param emojiMode             Emoji handling.
 * @param diacriticsMode        Vowel mark handling.
 * @param shaddaMode            Doubling mark handling.
 * @param scientificLowerBound  Non-zero magnitudes below this are read in scientific notation.
 * @param scientificUpperBound  Magnitudes at or above this are read in scientific notation.
 */
public record NormalizationConfig(
        boolean numbers,
        boolean web,
        boolean phone,
        boolean dateTime,
        boolean units,
        boolean currency,
        boolean technical,
        boolean math,
        boolean diacritics,
        boolean symbols,
        boolean linguistics,
        boolean transliteration,
        boolean pauseMarkers,
        EmojiMode emojiMode,
        DiacriticsMode diacriticsMode,
        ShaddaMode shaddaMode,
        BigDecimal scientificLowerBound,
        BigDecimal scientificUpperBound
) {

    /** Path of the normalization block inside the application configuration. */
    public static final String CONFIG_PATH = "ckb-textify.normalization";

    public NormalizationConfig {
        if (emojiMode == null || diacriticsMode == null || shaddaMode == null) {
            throw new InvalidConfigurationException("Emoji, diacritics and shadda modes must be set.");
        }
        if (scientificLowerBound == null || scientificUpperBound == null) {
            throw new InvalidConfigurationException("Scientific notation bounds must be set.");
        }
        if (scientificLowerBound.signum() <= 0 || scientificLowerBound.compareTo(scientificUpperBound) >= 0) {
            throw new InvalidConfigurationException(String.format(
                    "Scientific bounds must satisfy 0 < lower < upper, got lower=%s upper=%s",
                    scientificLowerBound.toPlainString(), scientificUpperBound.toPlainString()));
        }
    }

    /**
     * @return The default configuration: every module on, pause markers off, emoji removed,
     *         diacritics converted, shadda doubled.
     */
    public static NormalizationConfig defaults() {
        return builder().build();
    }

    /**
     * @return A builder pre-populated with the defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from the {@value #CONFIG_PATH} block of a resolved HOCON config.
     * Missing keys fall back to the defaults.
     *
     * @param root The resolved application configuration.
     * @return The normalization configuration.
     * @throws InvalidConfigurationException if a value has the wrong type or an unknown mode name.
     */
    public static NormalizationConfig fromConfig(Config root) {
        if (!root.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        try {
            Config c = root.getConfig(CONFIG_PATH);
            Builder b = builder();
            if (c.hasPath("numbers")) b.numbers(c.getBoolean("numbers"));
            if (c.hasPath("web")) b.web(c.getBoolean("web"));
            if (c.hasPath("phone")) b.phone(c.getBoolean("phone"));
            if (c.hasPath("date-time")) b.dateTime(c.getBoolean("date-time"));
            if (c.hasPath("units")) b.units(c.getBoolean("units"));
            if (c.hasPath("currency")) b.currency(c.getBoolean("currency"));
            if (c.hasPath("technical")) b.technical(c.getBoolean("technical"));
            if (c.hasPath("math")) b.math(c.getBoolean("math"));
            if (c.hasPath("diacritics")) b.diacritics(c.getBoolean("diacritics"));
            if (c.hasPath("symbols")) b.symbols(c.getBoolean("symbols"));
            if (c.hasPath("linguistics")) b.linguistics(c.getBoolean("linguistics"));
            if (c.hasPath("transliteration")) b.transliteration(c.getBoolean("transliteration"));
            if (c.hasPath("pause-markers")) b.pauseMarkers(c.getBoolean("pause-markers"));
            if (c.hasPath("emoji-mode")) b.emojiMode(parseMode(EmojiMode.class, c.getString("emoji-mode")));
            if (c.hasPath("diacritics-mode")) b.diacriticsMode(parseMode(DiacriticsMode.class, c.getString("diacritics-mode")));
            if (c.hasPath("shadda-mode")) b.shaddaMode(parseMode(ShaddaMode.class, c.getString("shadda-mode")));
            if (c.hasPath("scientific.lower-bound")) b.scientificLowerBound(new BigDecimal(c.getString("scientific.lower-bound")));
            if (c.hasPath("scientific.upper-bound")) b.scientificUpperBound(new BigDecimal(c.getString("scientific.upper-bound")));
            return b.build();
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid normalization configuration: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Scientific bounds must be decimal numbers: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @param type The mode enum.
     * @param name The configured name, e.g. "remove".
     * @param <E> The mode type.
     * @return The matching constant.
     * @throws InvalidConfigurationException if the name is unknown.
     */
    public static <E extends Enum<E>> E parseMode(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidConfigurationException(String.format("Unknown %s '%s'", type.getSimpleName(), name), e);
        }
    }

    /**
     * Mutable builder for {@link NormalizationConfig}.
     */
    public static final class Builder {
        private boolean numbers = true;
        private boolean web = true;
        private boolean phone = true;
        private boolean dateTime = true;
        private boolean units = true;
        private boolean currency = true;
        private boolean technical = true;
        private boolean math = true;
        private boolean diacritics = true;
        private boolean symbols = true;
        private boolean linguistics = true;
        private boolean transliteration = true;
        private boolean pauseMarkers = false;
        private EmojiMode emojiMode = EmojiMode.REMOVE;
        private DiacriticsMode diacriticsMode = DiacriticsMode.CONVERT;
        private ShaddaMode shaddaMode = ShaddaMode.DOUBLE;
        private BigDecimal scientificLowerBound = new BigDecimal("1e-20");
        private BigDecimal scientificUpperBound = new BigDecimal("1e21");

        private Builder() {
        }

        public Builder numbers(boolean v) { this.numbers = v; return this; }
        public Builder web(boolean v) { this.web = v; return this; }
        public Builder phone(boolean v) { this.phone = v; return this; }
        public Builder dateTime(boolean v) { this.dateTime = v; return this; }
        public Builder units(boolean v) { this.units = v; return this; }
        public Builder currency(boolean v) { this.currency = v; return this; }
        public Builder technical(boolean v) { this.technical = v; return this; }
        public Builder math(boolean v) { this.math = v; return this; }
        public Builder diacritics(boolean v) { this.diacritics = v; return this; }
        public Builder symbols(boolean v) { this.symbols = v; return this; }
        public Builder linguistics(boolean v) { this.linguistics = v; return this; }
        public Builder transliteration(boolean v) { this.transliteration = v; return this; }
        public Builder pauseMarkers(boolean v) { this.pauseMarkers = v; return this; }
        public Builder emojiMode(EmojiMode v) { this.emojiMode = v; return this; }
        public Builder diacriticsMode(DiacriticsMode v) { this.diacriticsMode = v; return this; }
        public Builder shaddaMode(ShaddaMode v) { this.shaddaMode = v; return this; }
        public Builder scientificLowerBound(BigDecimal v) { this.scientificLowerBound = v; return this; }
        public Builder scientificUpperBound(BigDecimal v) { this.scientificUpperBound = v; return this; }

        /**
         * @return The validated configuration.
         * @throws InvalidConfigurationException if the values are inconsistent.
         */
        public NormalizationConfig build() {
            return new NormalizationConfig(numbers, web, phone, dateTime, units, currency, technical, math,
                    diacritics, symbols, linguistics, transliteration, pauseMarkers,
                    emojiMode, diacriticsMode, shaddaMode, scientificLowerBound, scientificUpperBound);
        }
    }
}
