package org.ckbtextify.modules.spacing;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.List;
import java.util.Set;

/**
 * Runs last and guarantees whitespace on both sides of every converted token, so that spoken
 * forms never fuse with their neighbours ("5+3" must not become "پێنجکۆسێ"). No space is added
 * directly after an opening bracket or quote.
 */
public class SpacingNormalizer implements INormalizationModule {

    private static final Set<String> OPENERS = Set.of("(", "[", "{", "”", "“", "\"");

    @Override
    public String name() {
        return "SpacingNormalizer";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isConverted() || token.isTombstone()) {
                continue;
            }
            TokenLists.ensureSpaceAfter(token);
            Token prev = TokenLists.previous(tokens, i);
            if (prev != null && !OPENERS.contains(prev.text())) {
                TokenLists.ensureSpaceAfter(prev);
            }
        }
        return tokens;
    }
}
