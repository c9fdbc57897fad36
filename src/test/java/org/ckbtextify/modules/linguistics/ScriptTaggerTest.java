package org.ckbtextify.modules.linguistics;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.SCRIPT_ARABIC;
import static org.ckbtextify.lexer.Tag.SCRIPT_CYRILLIC;
import static org.ckbtextify.lexer.Tag.SCRIPT_GREEK;
import static org.ckbtextify.lexer.Tag.SCRIPT_KURDISH;
import static org.ckbtextify.lexer.Tag.SCRIPT_LATIN;

/**
 * Contains unit tests for the {@link ScriptTagger}.
 */
public class ScriptTaggerTest {

    @Test
    @Tag("unit")
    void tagsEachWordWithItsScript() {
        // Arrange
        List<Token> tokens = new Tokenizer().tokenize("hello سڵاو Привет Γειά علي");

        // Act
        List<Token> tagged = new ScriptTagger().process(tokens);

        // Assert
        assertThat(tagged.get(0).hasTag(SCRIPT_LATIN)).isTrue();
        assertThat(tagged.get(1).hasTag(SCRIPT_KURDISH)).isTrue();
        assertThat(tagged.get(2).hasTag(SCRIPT_CYRILLIC)).isTrue();
        assertThat(tagged.get(3).hasTag(SCRIPT_GREEK)).isTrue();
        assertThat(tagged.get(4).hasTag(SCRIPT_ARABIC)).isTrue();
    }

    @Test
    @Tag("unit")
    void treatsSharedArabicLettersAsKurdish() {
        assertThat(ScriptTagger.scriptOf("کوردستان")).isEqualTo(SCRIPT_KURDISH);
        assertThat(ScriptTagger.scriptOf("كتاب")).isEqualTo(SCRIPT_ARABIC);
    }

    @Test
    @Tag("unit")
    void doesNotChangeText() {
        // Arrange
        List<Token> tokens = new Tokenizer().tokenize("Razwan");

        // Act
        new ScriptTagger().process(tokens);

        // Assert
        assertThat(tokens.get(0).text()).isEqualTo("Razwan");
        assertThat(tokens.get(0).isConverted()).isFalse();
    }
}
