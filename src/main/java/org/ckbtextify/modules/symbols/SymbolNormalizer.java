package org.ckbtextify.modules.symbols;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.modules.emoji.EmojiCatalog;
import org.ckbtextify.modules.emoji.EmojiNormalizer;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces speakable symbols with words ("50%" as "لە سەدا پەنجا", "&" as "و") and drops the
 * rest of the symbol, math-symbol and modifier characters that a speech engine cannot read.
 * <p>
 * With pause markers enabled, clause punctuation becomes the pause marker {@value #PAUSE}.
 */
public class SymbolNormalizer implements INormalizationModule {

    static final String PAUSE = "|";
    static final String PERCENT = "لە سەدا";

    private static final Set<String> PERCENT_SIGNS = Set.of("%", "٪");
    private static final Map<String, String> WORDS = Map.of(
            "&", "و",
            "©", "کۆپیڕایت",
            "®", "تۆمارکراو",
            "™", "نیشانەی بازرگانی",
            "°", "پلە",
            "~", "نزیکەی",
            "№", "ژمارە",
            "§", "بڕگە");
    private static final Set<String> CLAUSE_PUNCTUATION = Set.of(",", "،", ";", "؛", ":");
    private static final Pattern NUMERIC = Pattern.compile("[\\d,.٫]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final boolean pauseMarkers;

    public SymbolNormalizer(boolean pauseMarkers) {
        this.pauseMarkers = pauseMarkers;
    }

    @Override
    public String name() {
        return "SymbolNormalizer";
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.SYMBOL || token.isConverted() || token.isTombstone()) {
                continue;
            }
            String text = token.text();
            if (PERCENT_SIGNS.contains(text)) {
                Token amount = TokenLists.previous(tokens, i);
                if (amount != null && NUMERIC.matcher(amount.originalText()).matches()) {
                    amount.rewrite(PERCENT + " " + amount.text());
                    amount.absorb(token);
                } else {
                    token.rewrite(PERCENT, TokenType.WORD);
                }
            } else if (WORDS.containsKey(text)) {
                token.rewrite(WORDS.get(text), TokenType.WORD);
            } else if (pauseMarkers && CLAUSE_PUNCTUATION.contains(text)) {
                token.rewrite(PAUSE);
            } else if (PAUSE.equals(text)) {
                // Already a pause marker.
                continue;
            } else if (isUnspeakable(text)) {
                EmojiNormalizer.drop(tokens, i);
            }
        }
        return TokenLists.compact(tokens);
    }

    private static boolean isUnspeakable(String text) {
        int cp = text.codePointAt(0);
        if (EmojiCatalog.isEmoji(cp)) {
            return false;
        }
        int type = Character.getType(cp);
        return type == Character.OTHER_SYMBOL || type == Character.MATH_SYMBOL || type == Character.MODIFIER_SYMBOL;
    }
}
