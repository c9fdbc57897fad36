package org.ckbtextify.pipeline;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TokenListsTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    @Tag("unit")
    void neighbourLookupsSkipTombstones() {
        // Arrange
        List<Token> tokens = tokenizer.tokenize("a b c");
        tokens.get(1).tombstone();

        // Act & Assert
        assertThat(TokenLists.next(tokens, 0).text()).isEqualTo("c");
        assertThat(TokenLists.previous(tokens, 2).text()).isEqualTo("a");
        assertThat(TokenLists.previous(tokens, 0)).isNull();
        assertThat(TokenLists.nextIndex(tokens, 2)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void compactDropsTombstones() {
        // Arrange
        List<Token> tokens = tokenizer.tokenize("a b c");
        tokens.get(0).tombstone();

        // Act
        List<Token> live = TokenLists.compact(tokens);

        // Assert
        assertThat(live).extracting(Token::text).containsExactly("b", "c");
    }

    @Test
    @Tag("unit")
    void signAtStartOrAfterOperatorIsUnary() {
        // Arrange
        List<Token> leading = tokenizer.tokenize("-5");
        List<Token> afterOperator = tokenizer.tokenize("3 * -5");
        List<Token> binary = tokenizer.tokenize("3-5");

        // Act & Assert
        assertThat(TokenLists.isUnaryPosition(leading, 0)).isTrue();
        assertThat(TokenLists.isStrictUnaryPosition(afterOperator, 2)).isTrue();
        assertThat(TokenLists.isUnaryPosition(binary, 1)).isFalse();
    }

    @Test
    @Tag("unit")
    void spacedSignAfterProseWordIsUnaryOnlyInLooseSense() {
        // Arrange
        List<Token> tokens = tokenizer.tokenize("lost -5");

        // Act & Assert
        assertThat(TokenLists.isUnaryPosition(tokens, 1)).isTrue();
        assertThat(TokenLists.isStrictUnaryPosition(tokens, 1)).isFalse();
    }

    @Test
    @Tag("unit")
    void ensureSpaceAfterKeepsExistingWhitespace() {
        // Arrange
        List<Token> tokens = tokenizer.tokenize("a\nb");

        // Act
        TokenLists.ensureSpaceAfter(tokens.get(0));
        TokenLists.ensureSpaceAfter(tokens.get(1));

        // Assert
        assertThat(tokens.get(0).whitespaceAfter()).isEqualTo("\n");
        assertThat(tokens.get(1).whitespaceAfter()).isEqualTo(" ");
    }
}
