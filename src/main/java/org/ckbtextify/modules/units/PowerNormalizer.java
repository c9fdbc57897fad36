package org.ckbtextify.modules.units;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.List;
import java.util.Map;

/**
 * Rewrites caret powers on units ("m^2", "cm^3") into the superscript form the unit normalizer
 * reads, so that the math normalizer does not speak them as a generic power.
 */
public class PowerNormalizer implements INormalizationModule {

    private static final Map<String, String> SUPERSCRIPTS = Map.of("2", "²", "3", "³");

    @Override
    public String name() {
        return "PowerNormalizer";
    }

    @Override
    public int priority() {
        return 82;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token unit = tokens.get(i);
            if (!unit.hasTag(Tag.IS_UNIT) || unit.isTombstone() || !unit.whitespaceAfter().isEmpty()) {
                continue;
            }
            int caretIndex = TokenLists.nextIndex(tokens, i);
            if (caretIndex < 0 || !"^".equals(tokens.get(caretIndex).text())) {
                continue;
            }
            Token caret = tokens.get(caretIndex);
            Token exponent = TokenLists.next(tokens, caretIndex);
            if (exponent == null || exponent.type() != TokenType.NUMBER || !caret.whitespaceAfter().isEmpty()) {
                continue;
            }
            String superscript = SUPERSCRIPTS.get(exponent.text());
            if (superscript == null) {
                continue;
            }
            exponent.setText(superscript);
            exponent.setType(TokenType.SUPERSCRIPT);
            caret.tombstone();
        }
        return TokenLists.compact(tokens);
    }
}
