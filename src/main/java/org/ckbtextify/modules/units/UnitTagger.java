package org.ckbtextify.modules.units;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.List;
import java.util.Locale;

/**
 * Tags unit abbreviations that stand in numeric context with {@link Tag#IS_UNIT}.
 * <p>
 * A candidate is tagged when it follows a number ("10 m", "10m"), when it is the denominator of
 * a unit ratio ("km/h"), or when it is a temperature scale after a degree sign ("30°C").
 * The bare word "in" is only a unit when glued to its number.
 */
public class UnitTagger implements INormalizationModule {

    @Override
    public String name() {
        return "UnitTagger";
    }

    @Override
    public int priority() {
        return 85;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.WORD || token.isConverted() || token.isTombstone()) {
                continue;
            }
            int p = TokenLists.previousIndex(tokens, i);
            Token prev = p < 0 ? null : tokens.get(p);
            if (prev == null) {
                continue;
            }

            if ("°".equals(prev.text()) && UnitCatalog.isTemperatureScale(token.text())
                    && prev.whitespaceAfter().isEmpty()
                    && TokenLists.isNumeric(TokenLists.previous(tokens, p))) {
                token.addTag(Tag.IS_UNIT);
                continue;
            }
            if (!UnitCatalog.isUnit(token.text())) {
                continue;
            }
            if (TokenLists.isNumeric(prev)) {
                boolean attached = prev.whitespaceAfter().isEmpty();
                if (!"in".equals(token.text().toLowerCase(Locale.ROOT)) || attached) {
                    token.addTag(Tag.IS_UNIT);
                }
            } else if ("/".equals(prev.text()) && prev.whitespaceAfter().isEmpty()) {
                Token numerator = TokenLists.previous(tokens, p);
                if (numerator != null && numerator.hasTag(Tag.IS_UNIT) && numerator.whitespaceAfter().isEmpty()) {
                    token.addTag(Tag.IS_UNIT);
                }
            }
        }
        return tokens;
    }
}
