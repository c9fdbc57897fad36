package org.ckbtextify.modules.math;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.FRACTION;
import static org.ckbtextify.lexer.Tag.MATH_FUNCTION;
import static org.ckbtextify.lexer.Tag.MATH_TERM;

/**
 * Contains unit tests for the {@link MathNormalizer}.
 * These tests verify the context rules that separate expressions from prose: operators,
 * ranges, fractions, brackets and variables.
 */
public class MathNormalizerTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final MathNormalizer normalizer = new MathNormalizer();

    private List<Token> run(String text) {
        return normalizer.process(tokenizer.tokenize(text));
    }

    @Test
    @Tag("unit")
    void readsOperatorBetweenNumbers() {
        // Act
        List<Token> tokens = run("5 + 3");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("5", "کۆ", "3");
        assertThat(tokens.get(1).hasTag(MATH_TERM)).isTrue();
    }

    @Test
    @Tag("unit")
    void mergesSimpleFractionIntoOneToken() {
        // Act
        List<Token> half = run("1/2");
        List<Token> quarter = run("1/4");
        List<Token> general = run("3/4");

        // Assert
        assertThat(half).hasSize(1);
        assertThat(half.get(0).text()).isEqualTo("نیوە");
        assertThat(half.get(0).hasTag(FRACTION)).isTrue();
        assertThat(quarter.get(0).text()).isEqualTo("چارەک");
        assertThat(general.get(0).text()).isEqualTo("سێ لەسەر چوار");
    }

    @Test
    @Tag("unit")
    void readsMixedNumber() {
        assertThat(run("2 1/2")).extracting(Token::text).containsExactly("2", "و نیو");
        assertThat(run("2½")).extracting(Token::text).containsExactly("2", "و نیو");
    }

    @Test
    @Tag("unit")
    void readsStandaloneUnicodeFraction() {
        assertThat(run("½").get(0).text()).isEqualTo("نیوە");
    }

    @Test
    @Tag("unit")
    void readsHyphenBetweenIsolatedNumbersAsRange() {
        assertThat(run("1990-2000")).extracting(Token::text).containsExactly("1990", "بۆ", "2000");
    }

    @Test
    @Tag("unit")
    void readsOperatorChainWithoutRangesOrFractions() {
        // Act
        List<Token> tokens = run("5 + 3 - 2 * 4 / 2 = 10");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly(
                "5", "کۆ", "3", "کەم", "2", "کەڕەتی", "4", "دابەش", "2", "یەکسانە بە", "10");
    }

    @Test
    @Tag("unit")
    void leavesGluedUnarySignForNumberNormalizer() {
        assertThat(run("3 * -5")).extracting(Token::text).containsExactly("3", "کەڕەتی", "-", "5");
    }

    @Test
    @Tag("unit")
    void readsFunctionWithBracketsAndVariable() {
        // Act
        List<Token> tokens = run("sin(x)");

        // Assert
        assertThat(tokens).extracting(Token::text)
                .containsExactly("ساینی", "کەوانەی کراوە", "ئێکس", "کەوانەی داخراو");
        assertThat(tokens.get(0).hasTag(MATH_FUNCTION)).isTrue();
    }

    @Test
    @Tag("unit")
    void leavesBracketsAroundPlainNumberLiteral() {
        assertThat(run("(1990)")).extracting(Token::text).containsExactly("(", "1990", ")");
    }

    @Test
    @Tag("unit")
    void readsVariableWithSuperscriptPower() {
        assertThat(run("x²")).extracting(Token::text).containsExactly("ئێکس", "توان دوو");
    }

    @Test
    @Tag("unit")
    void readsVariablesGluedToCoefficient() {
        assertThat(run("2x")).extracting(Token::text).containsExactly("2", "ئێکس");
        assertThat(run("2ab")).extracting(Token::text).containsExactly("2", "ئەی بی");
        assertThat(run("2 ab")).extracting(Token::text).containsExactly("2", "ab");
    }

    @Test
    @Tag("unit")
    void readsPlusBetweenProseWordsAsWith() {
        assertThat(run("Ahmed + Ali")).extracting(Token::text).containsExactly("Ahmed", "لەگەڵ", "Ali");
    }

    @Test
    @Tag("unit")
    void readsSubscriptAsBase() {
        assertThat(run("log₂")).extracting(Token::text).containsExactly("لۆگاریتمی", "بنچینە دوو");
    }

    @Test
    @Tag("unit")
    void formatsFractions() {
        assertThat(MathNormalizer.formatFraction(1, 2, false)).isEqualTo("نیوە");
        assertThat(MathNormalizer.formatFraction(1, 4, true)).isEqualTo("و چارەک");
        assertThat(MathNormalizer.formatFraction(2, 3, true)).isEqualTo("و دوو لەسەر سێ");
    }

    /**
     * Script runs longer than a long still read as cardinals, and the rest of the expression
     * is converted as usual.
     */
    @Test
    @Tag("unit")
    void readsVeryLongScriptRuns() {
        // Act
        List<Token> power = run("5 + 3 x²³⁴⁵⁶⁷⁸⁹⁰¹²³⁴⁵⁶⁷⁸⁹⁰¹²³");
        List<Token> base = run("H₁₂₃₄₅₆₇₈₉₀₁₂₃₄₅₆₇₈₉₀₁ + 2");

        // Assert
        assertThat(power.get(1).text()).isEqualTo("کۆ");
        assertThat(power.get(power.size() - 1).text()).startsWith("توان دوو سێکستلیۆن و ");
        assertThat(base.get(1).text()).startsWith("بنچینە سەد و بیست و سێ کوینتلیۆن و ");
        assertThat(base.get(2).text()).isEqualTo("کۆ");
    }
}
