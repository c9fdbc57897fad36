package org.ckbtextify.modules.units;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.UNIT_PROCESSED;

/**
 * Contains unit tests for the {@link UnitNormalizer}, run together with the {@link UnitTagger}
 * and the {@link PowerNormalizer} that prepare its input.
 */
public class UnitNormalizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<Token> run(String text) {
        List<Token> tokens = new UnitTagger().process(tokenizer.tokenize(text));
        tokens = new PowerNormalizer().process(tokens);
        return new UnitNormalizer().process(tokens);
    }

    @Test
    @Tag("unit")
    void readsUnitName() {
        // Act
        List<Token> tokens = run("10 km");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("10", "کیلۆمەتر");
        assertThat(tokens.get(1).hasTag(UNIT_PROCESSED)).isTrue();
    }

    @Test
    @Tag("unit")
    void readsRatioAsPerEachUnit() {
        assertThat(run("100km/h")).extracting(Token::text).containsExactly("100", "کیلۆمەتر", "بۆ ھەر کاتژمێرێک");
    }

    @Test
    @Tag("unit")
    void readsSquareAndCubicUnits() {
        assertThat(run("20m²")).extracting(Token::text).containsExactly("20", "مەتری دووجا");
        assertThat(run("5cm³")).extracting(Token::text).containsExactly("5", "سانتیمەتری سێجا");
    }

    @Test
    @Tag("unit")
    void rewritesCaretPowerAfterUnit() {
        assertThat(run("50m^2")).extracting(Token::text).containsExactly("50", "مەتری دووجا");
    }

    @Test
    @Tag("unit")
    void movesHalfOntoUnit() {
        assertThat(run("4.5kg")).extracting(Token::text).containsExactly("4", "کیلۆگرام و نیو");
    }

    @Test
    @Tag("unit")
    void readsTemperatureAndDropsDegreeSign() {
        assertThat(run("30°C")).extracting(Token::text).containsExactly("30", "پلەی سەدی");
    }

    @Test
    @Tag("unit")
    void leavesUntaggedWordsAlone() {
        assertThat(run("I am m")).extracting(Token::text).containsExactly("I", "am", "m");
    }
}
