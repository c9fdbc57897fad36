package org.ckbtextify.modules.emoji;

import org.ckbtextify.api.EmojiMode;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link EmojiNormalizer}.
 */
public class EmojiNormalizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<Token> run(String text, EmojiMode mode) {
        return new EmojiNormalizer(mode).process(tokenizer.tokenize(text));
    }

    @Test
    @Tag("unit")
    void removeModeDropsEmojiAndKeepsSpacing() {
        // Act
        List<Token> tokens = run("سڵاو 😂 ھاوڕێ", EmojiMode.REMOVE);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("سڵاو", "ھاوڕێ");
        assertThat(tokens.get(0).whitespaceAfter()).isNotEmpty();
    }

    @Test
    @Tag("unit")
    void removeModeDropsLeadingEmoji() {
        assertThat(run("😂 سڵاو", EmojiMode.REMOVE)).extracting(Token::text).containsExactly("سڵاو");
    }

    @Test
    @Tag("unit")
    void convertModeNamesKnownEmoji() {
        // Act
        List<Token> tokens = run("سڵاو 😂", EmojiMode.CONVERT);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("سڵاو", "پێکەنین");
        assertThat(tokens.get(1).isConverted()).isTrue();
    }

    @Test
    @Tag("unit")
    void convertModeDropsVariationSelectorAndUnknownEmoji() {
        assertThat(run("❤️", EmojiMode.CONVERT)).extracting(Token::text).containsExactly("دڵ");
        assertThat(run("سڵاو 🦄", EmojiMode.CONVERT)).extracting(Token::text).containsExactly("سڵاو");
    }

    @Test
    @Tag("unit")
    void ignoreModeLeavesEmojiUntouched() {
        assertThat(run("سڵاو 😂", EmojiMode.IGNORE)).extracting(Token::text).containsExactly("سڵاو", "😂");
    }

    @Test
    @Tag("unit")
    void recognizesEmojiRanges() {
        assertThat(EmojiCatalog.isEmoji("😂")).isTrue();
        assertThat(EmojiCatalog.isEmoji("→")).isFalse();
        assertThat(EmojiCatalog.isJoinerOrModifier(0x200D)).isTrue();
    }
}
