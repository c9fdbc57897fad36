package org.ckbtextify.modules.units;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ckbtextify.lexer.Tag.IS_UNIT;

public class UnitTaggerTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final UnitTagger tagger = new UnitTagger();

    private List<Token> run(String text) {
        return tagger.process(tokenizer.tokenize(text));
    }

    @Test
    @Tag("unit")
    void tagsUnitAfterNumber() {
        assertThat(run("10 m").get(1).hasTag(IS_UNIT)).isTrue();
        assertThat(run("10kg").get(1).hasTag(IS_UNIT)).isTrue();
    }

    @Test
    @Tag("unit")
    void ignoresUnitLettersInProse() {
        assertThat(run("I am m").get(2).hasTag(IS_UNIT)).isFalse();
    }

    @Test
    @Tag("unit")
    void tagsInchOnlyWhenAttached() {
        assertThat(run("5in").get(1).hasTag(IS_UNIT)).isTrue();
        assertThat(run("5 in total").get(1).hasTag(IS_UNIT)).isFalse();
    }

    @Test
    @Tag("unit")
    void tagsRatioDenominator() {
        // Act
        List<Token> tokens = run("100km/h");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("100", "km", "/", "h");
        assertThat(tokens.get(1).hasTag(IS_UNIT)).isTrue();
        assertThat(tokens.get(3).hasTag(IS_UNIT)).isTrue();
    }

    @Test
    @Tag("unit")
    void tagsTemperatureScaleAfterDegreeSign() {
        assertThat(run("30°C").get(2).hasTag(IS_UNIT)).isTrue();
    }
}
