package org.ckbtextify.modules.grammar;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.SuffixJoiner;

import java.util.List;

/**
 * Glues a grammatical suffix written directly after a converted token back onto its spoken
 * form: "5ی" becomes "پێنجی", "12:30ە" becomes "دوازدە و نیویە".
 */
public class GrammarNormalizer implements INormalizationModule {

    @Override
    public String name() {
        return "GrammarNormalizer";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token host = tokens.get(i);
            if (!host.isConverted() || host.isTombstone() || !host.whitespaceAfter().isEmpty()) {
                continue;
            }
            int s = TokenLists.nextIndex(tokens, i);
            if (s < 0) {
                continue;
            }
            Token suffix = tokens.get(s);
            if (suffix.type() != TokenType.WORD || suffix.isConverted()) {
                continue;
            }
            String bare = suffix.text().replace("ـ", "").replace("‌", "");
            if (SuffixJoiner.isSuffix(bare)) {
                host.rewrite(SuffixJoiner.join(host.text(), bare));
                host.absorb(suffix);
            }
        }
        return TokenLists.compact(tokens);
    }
}
