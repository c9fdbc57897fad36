package org.ckbtextify.modules.diacritics;

import org.ckbtextify.api.DiacriticsMode;
import org.ckbtextify.api.ShaddaMode;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DiacriticsNormalizer}.
 * Marks are written as escapes: kasra 0650, fatha 064E, sukun 0652, shadda 0651, alef wasla 0671.
 */
public class DiacriticsNormalizerTest {

    private static final String KITAB = "\u06A9\u0650\u062A\u064E\u0627\u0628";
    private static final String ASH_SHAMS = "\u0671\u0644\u0634\u0651\u064E\u0645\u0652\u0633";
    private static final String BISMI_ALLAHI = "\u0628\u0650\u0633\u0652\u0645\u0650 \u0671\u0644\u0644\u0651\u064E\u0647\u0650";

    private final Tokenizer tokenizer = new Tokenizer();

    private List<Token> run(String text, DiacriticsMode mode, ShaddaMode shadda) {
        return new DiacriticsNormalizer(mode, shadda).process(tokenizer.tokenize(text));
    }

    private List<Token> convert(String text) {
        return run(text, DiacriticsMode.CONVERT, ShaddaMode.DOUBLE);
    }

    @Test
    @Tag("unit")
    void writesShortAndLongVowelsAsLetters() {
        // Act
        List<Token> tokens = convert(KITAB);

        // Assert
        assertThat(tokens.get(0).text()).isEqualTo("کیتاب");
        assertThat(tokens.get(0).isConverted()).isTrue();
    }

    @Test
    @Tag("unit")
    void assimilatesArticleIntoSunLetterAtUtteranceStart() {
        assertThat(convert(ASH_SHAMS).get(0).text()).isEqualTo("ئەششەمس");
    }

    @Test
    @Tag("unit")
    void singlesDoubledLetterWhenShaddaIsRemoved() {
        assertThat(run(ASH_SHAMS, DiacriticsMode.CONVERT, ShaddaMode.REMOVE).get(0).text()).isEqualTo("ئەشەمس");
    }

    @Test
    @Tag("unit")
    void readsDivineNameLightAfterKasra() {
        assertThat(convert(BISMI_ALLAHI)).extracting(Token::text).containsExactly("بیسمی", "للاھی");
    }

    @Test
    @Tag("unit")
    void readsRaHeavyBeforeElevatedLetter() {
        assertThat(convert("\u0645\u0650\u0631\u0652\u0635\u064E\u0627\u062F").get(0).text()).contains("\u0695");
    }

    @Test
    @Tag("unit")
    void assimilatesNoonBeforeBa() {
        // Arrange
        DiacriticsNormalizer normalizer = new DiacriticsNormalizer(DiacriticsMode.CONVERT, ShaddaMode.DOUBLE);

        // Act
        DiacriticsNormalizer.Rendered rendered =
                normalizer.render("\u0645\u0650\u0646\u0652", DiacriticsNormalizer.Vowel.NONE, false, '\u0628');

        // Assert
        assertThat(rendered.text()).isEqualTo("میم");
    }

    @Test
    @Tag("unit")
    void removeModeStripsMarksWithoutConverting() {
        // Act
        List<Token> tokens = run(KITAB, DiacriticsMode.REMOVE, ShaddaMode.DOUBLE);

        // Assert
        assertThat(tokens.get(0).text()).isEqualTo("کتاب");
        assertThat(tokens.get(0).isConverted()).isFalse();
    }

    @Test
    @Tag("unit")
    void keepModeLeavesTextUntouched() {
        assertThat(run(KITAB, DiacriticsMode.KEEP, ShaddaMode.DOUBLE).get(0).text()).isEqualTo(KITAB);
    }

    @Test
    @Tag("unit")
    void leavesUnvoweledWordsAlone() {
        // Act
        List<Token> tokens = convert("کتێب");

        // Assert
        assertThat(tokens.get(0).text()).isEqualTo("کتێب");
        assertThat(tokens.get(0).isConverted()).isFalse();
    }

    /**
     * After a fatha or damma the divine name takes the heavy lam.
     */
    @Test
    @Tag("unit")
    void readsDivineNameHeavyAfterOpenVowel() {
        // Act
        List<Token> tokens = convert("قَالَ ٱللَّهُ");

        // Assert
        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(1).text()).isEqualTo("ڵڵاھو");
    }

    @Test
    @Tag("unit")
    void mergesNoonIntoFollowingSemivowel() {
        // Arrange
        DiacriticsNormalizer normalizer = new DiacriticsNormalizer(DiacriticsMode.CONVERT, ShaddaMode.DOUBLE);

        // Act
        String beforeWaw = normalizer.render("مِنْ", DiacriticsNormalizer.Vowel.NONE, false, 'و').text();
        String beforeYeh = normalizer.render("مِنْ", DiacriticsNormalizer.Vowel.NONE, false, 'ي').text();
        String beforeOther = normalizer.render("مِنْ", DiacriticsNormalizer.Vowel.NONE, false, 'ك').text();

        // Assert
        assertThat(beforeWaw).isEqualTo("میو");
        assertThat(beforeYeh).isEqualTo("میی");
        assertThat(beforeOther).isEqualTo("مین");
    }
}
