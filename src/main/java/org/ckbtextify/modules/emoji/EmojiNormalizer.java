package org.ckbtextify.modules.emoji;

import org.ckbtextify.api.EmojiMode;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.List;

/**
 * Removes emoji, replaces them with Kurdish words, or leaves them as they are, depending on the
 * configured {@link EmojiMode}. Joiners and variation selectors inside emoji sequences are
 * always dropped together with their emoji.
 */
public class EmojiNormalizer implements INormalizationModule {

    private final EmojiMode mode;

    public EmojiNormalizer(EmojiMode mode) {
        this.mode = mode;
    }

    @Override
    public String name() {
        return "EmojiNormalizer";
    }

    @Override
    public int priority() {
        return 45;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        if (mode == EmojiMode.IGNORE) {
            return tokens;
        }
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTombstone() || token.isConverted() || !EmojiCatalog.isEmoji(token.text())) {
                continue;
            }
            String name = mode == EmojiMode.CONVERT && !EmojiCatalog.isJoinerOrModifier(token.text().codePointAt(0))
                    ? EmojiCatalog.nameOf(token.text()) : null;
            if (name != null) {
                token.rewrite(name);
            } else {
                drop(tokens, i);
            }
        }
        return TokenLists.compact(tokens);
    }

    /**
     * Drops the token at {@code i}, keeping its whitespace on the previous live token so that
     * the words around it are not glued together.
     */
    public static void drop(List<Token> tokens, int i) {
        Token prev = TokenLists.previous(tokens, i);
        if (prev == null) {
            tokens.get(i).tombstone();
            return;
        }
        prev.absorb(tokens.get(i));
        Token next = TokenLists.next(tokens, i);
        if (next != null && next.type() != TokenType.SYMBOL) {
            TokenLists.ensureSpaceAfter(prev);
        }
    }
}
