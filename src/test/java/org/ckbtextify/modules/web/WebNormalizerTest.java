package org.ckbtextify.modules.web;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.IS_SPELLED_OUT;

/**
 * Contains unit tests for the {@link WebNormalizer} and its {@link WebSpeller}.
 */
public class WebNormalizerTest {

    private final WebSpeller speller = new WebSpeller();
    private final WebNormalizer normalizer = new WebNormalizer(speller);

    @Test
    @Tag("unit")
    void readsUrlAndEmailPartByPart() {
        // Arrange
        Token url = new Token("www.rudaw.net", TokenType.URL);
        Token email = new Token("user@gmail.com", TokenType.EMAIL);

        // Act
        normalizer.process(new ArrayList<>(List.of(url, email)));

        // Assert
        assertThat(url.text()).isEqualTo("دەبڵیو دەبڵیو دەبڵیو دۆت ڕووداو دۆت نێت");
        assertThat(email.text()).contains("یوسەر").contains("ئەت جیمەیڵ").endsWith("دۆت کۆم");
        assertThat(url.hasTag(IS_SPELLED_OUT)).isTrue();
        assertThat(email.type()).isEqualTo(TokenType.WORD);
    }

    @Test
    @Tag("unit")
    void leavesOtherTokensAlone() {
        // Arrange
        Token word = new Token("rudaw", TokenType.WORD);

        // Act
        normalizer.process(new ArrayList<>(List.of(word)));

        // Assert
        assertThat(word.isConverted()).isFalse();
    }

    @Test
    @Tag("unit")
    void spellsAcronymsAndReadsDigitRuns() {
        assertThat(speller.speak("BBC")).isEqualTo("بی بی سی");
        assertThat(speller.speak("a1b")).isEqualTo("ئەی یەک بی");
        assertThat(speller.speak("site2024")).endsWith("دوو ھەزار و بیست و چوار");
    }

    @Test
    @Tag("unit")
    void dropsUnnamedSeparators() {
        assertThat(speller.speak("https://x.io")).isEqualTo("ئێچ تی تی پی ئێس سلاش سلاش ئێکس دۆت ئای ئۆ");
    }
}
