package org.ckbtextify.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.IS_UNIT;
import static org.ckbtextify.lexer.Tag.UNIT_PROCESSED;

public class TokenTest {

    @Test
    @Tag("unit")
    void rewriteMarksConvertedButSetTextDoesNot() {
        // Arrange
        Token cleaned = new Token("ك", TokenType.WORD);
        Token spoken = new Token("5", TokenType.NUMBER);

        // Act
        cleaned.setText("ک");
        spoken.rewrite("پێنج", TokenType.WORD);

        // Assert
        assertThat(cleaned.isConverted()).isFalse();
        assertThat(spoken.isConverted()).isTrue();
        assertThat(spoken.type()).isEqualTo(TokenType.WORD);
        assertThat(spoken.originalText()).isEqualTo("5");
    }

    @Test
    @Tag("unit")
    void absorbFoldsWhitespaceAndTombstonesConsumedToken() {
        // Arrange
        Token host = new Token("1", "1", TokenType.NUMBER, "");
        Token consumed = new Token("%", "%", TokenType.SYMBOL, "  ");

        // Act
        host.absorb(consumed);

        // Assert
        assertThat(host.whitespaceAfter()).isEqualTo("  ");
        assertThat(consumed.isTombstone()).isTrue();
    }

    @Test
    @Tag("unit")
    void copyIsIndependent() {
        // Arrange
        Token token = new Token("m", "m", TokenType.WORD, " ");
        token.addTag(IS_UNIT);

        // Act
        Token copy = token.copy();
        token.rewrite("مەتر");
        token.addTag(UNIT_PROCESSED);

        // Assert
        assertThat(copy.text()).isEqualTo("m");
        assertThat(copy.isConverted()).isFalse();
        assertThat(copy.tags()).containsExactly(IS_UNIT);
        assertThat(copy.whitespaceAfter()).isEqualTo(" ");
    }
}
