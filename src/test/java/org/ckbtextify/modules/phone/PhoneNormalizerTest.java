package org.ckbtextify.modules.phone;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link PhoneNormalizer}.
 */
public class PhoneNormalizerTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final PhoneNormalizer normalizer = new PhoneNormalizer();

    @Test
    @Tag("unit")
    void readsLocalMobileNumberInGroups() {
        // Act
        List<Token> tokens = normalizer.process(tokenizer.tokenize("07501234567"));

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0)).extracting(Token::text, Token::type).containsExactly(
                "سفر حەوت سەد و پەنجا سەد و بیست و سێ چل و پێنج شەست و حەوت", TokenType.WORD);
    }

    @Test
    @Tag("unit")
    void readsSpacedLocalNumberAsOneToken() {
        // Act
        List<Token> tokens = normalizer.process(tokenizer.tokenize("0750 123 45 67"));

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).text()).startsWith("سفر حەوت سەد و پەنجا");
    }

    @Test
    @Tag("unit")
    void readsInternationalNumberWithCountryCode() {
        assertThat(normalizer.speak("+9647701234567"))
                .isEqualTo("کۆ نۆ سەد و شەست و چوار حەوت سەد و حەفتا سەد و بیست و سێ چل و پێنج شەست و حەوت");
    }

    @Test
    @Tag("unit")
    void readsLeadingZerosInsideGroups() {
        assertThat(normalizer.speak("07700050007")).isEqualTo("سفر حەوت سەد و حەفتا سفر سفر پێنج سفر سفر سفر حەوت");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownLayouts() {
        assertThat(normalizer.speak("0750123")).isNull();
        assertThat(normalizer.speak("+12")).isNull();
    }

    /**
     * A plus-prefixed number too short for a country code is still read, one digit at a time.
     */
    @Test
    @Tag("unit")
    void readsUnknownLayoutDigitByDigit() {
        // Act
        List<Token> tokens = normalizer.process(tokenizer.tokenize("+1234567890"));

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0)).extracting(Token::text, Token::type).containsExactly(
                "کۆ یەک دوو سێ چوار پێنج شەش حەوت ھەشت نۆ سفر", TokenType.WORD);
        assertThat(tokens.get(0).isConverted()).isTrue();
    }
}
