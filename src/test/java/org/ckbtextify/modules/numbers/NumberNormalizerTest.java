package org.ckbtextify.modules.numbers;

import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link NumberNormalizer}.
 */
public class NumberNormalizerTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final NumberNormalizer normalizer = new NumberNormalizer(NormalizationConfig.defaults());

    private List<Token> run(String text) {
        return normalizer.process(tokenizer.tokenize(text));
    }

    @Test
    @Tag("unit")
    void spellsIntegers() {
        // Act
        List<Token> tokens = run("123");

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0)).extracting(Token::text, Token::type, Token::isConverted)
                .containsExactly("سەد و بیست و سێ", TokenType.WORD, true);
    }

    @Test
    @Tag("unit")
    void ignoresThousandsSeparators() {
        assertThat(run("1,000").get(0).text()).isEqualTo("ھەزار");
    }

    @Test
    @Tag("unit")
    void readsDecimalsWithPoint() {
        assertThat(run("3.14").get(0).text()).isEqualTo("سێ پۆینت چواردە");
        assertThat(run("0.5").get(0).text()).isEqualTo("سفر پۆینت پێنج");
        assertThat(run("1.05").get(0).text()).isEqualTo("یەک پۆینت سفر پێنج");
    }

    @Test
    @Tag("unit")
    void readsHalfIdiomForSingleDigit() {
        assertThat(run("2.5").get(0).text()).isEqualTo("دوو و نیو");
        assertThat(run("٣٫٥").get(0).text()).isEqualTo("سێ و نیو");
    }

    @Test
    @Tag("unit")
    void readsLeadingZeroIntegersDigitByDigit() {
        assertThat(run("007").get(0).text()).isEqualTo("سفر سفر حەوت");
    }

    @Test
    @Tag("unit")
    void mergesGluedUnarySign() {
        // Act
        List<Token> tokens = run("-5");

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).text()).isEqualTo("سالب پێنج");
    }

    @Test
    @Tag("unit")
    void mergesUnarySignAfterSpacedProseWord() {
        // Act
        List<Token> tokens = run("lost -5");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("lost", "سالب پێنج");
    }

    @Test
    @Tag("unit")
    void leavesBinaryMinusAlone() {
        // Act
        List<Token> tokens = run("10 - 5");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("دە", "-", "پێنج");
    }

    @Test
    @Tag("unit")
    void readsExplicitExponentInScientificForm() {
        assertThat(run("1e5").get(0).text()).isEqualTo("یەک کەڕەتی دە توانی پێنج");
    }

    @Test
    @Tag("unit")
    void readsHugeValuesInScientificForm() {
        assertThat(run("1000000000000000000000").get(0).text()).isEqualTo("یەک کەڕەتی دە توانی بیست و یەک");
    }

    @Test
    @Tag("unit")
    void honoursConfiguredBounds() {
        // Arrange
        NumberNormalizer narrow = new NumberNormalizer(NormalizationConfig.builder()
                .scientificLowerBound(new BigDecimal("0.001"))
                .scientificUpperBound(new BigDecimal("1000"))
                .build());

        // Act & Assert
        assertThat(narrow.speak("5000")).isEqualTo("پێنج کەڕەتی دە توانی سێ");
        assertThat(narrow.speak("999")).isEqualTo("نۆ سەد و نەوەد و نۆ");
    }

    @Test
    @Tag("unit")
    void returnsNullForUnparseableLiteral() {
        assertThat(normalizer.speak("1.2.3")).isNull();
    }
}
