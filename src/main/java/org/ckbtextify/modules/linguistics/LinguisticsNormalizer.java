package org.ckbtextify.modules.linguistics;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.Lexicons;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands abbreviations, reads Arabic spellings of common names the Sorani way and normalizes
 * Arabic letter variants to Sorani orthography.
 * <p>
 * Single-letter abbreviations only expand when a period is glued to them ("د." for doctor); the
 * period is consumed. Character normalization is cosmetic and does not mark a token converted.
 */
public class LinguisticsNormalizer implements INormalizationModule {

    private static final String LEXICON = "lexicon/linguistics.conf";

    private final Map<String, String> abbreviations;
    private final Map<String, String> names;

    public LinguisticsNormalizer() {
        this.abbreviations = Lexicons.load(LEXICON, "abbreviations");
        Map<String, String> byNormalizedSpelling = new HashMap<>();
        Lexicons.load(LEXICON, "names").forEach((k, v) -> {
            byNormalizedSpelling.put(k, v);
            byNormalizedSpelling.put(normalizeCharacters(k), v);
        });
        this.names = Map.copyOf(byNormalizedSpelling);
    }

    @Override
    public String name() {
        return "LinguisticsNormalizer";
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.WORD || token.isConverted() || token.isTombstone()) {
                continue;
            }
            String text = token.text();
            String expansion = abbreviations.get(text);
            if (expansion != null) {
                if (text.length() > 1) {
                    token.rewrite(expansion);
                    continue;
                }
                int dot = TokenLists.nextIndex(tokens, i);
                if (dot >= 0 && ".".equals(tokens.get(dot).text()) && token.whitespaceAfter().isEmpty()) {
                    token.rewrite(expansion);
                    token.absorb(tokens.get(dot));
                    continue;
                }
            }
            String name = names.get(text);
            if (name == null) {
                name = names.get(normalizeCharacters(text));
            }
            if (name != null) {
                token.rewrite(name);
                continue;
            }
            String normalized = normalizeCharacters(text);
            if (!normalized.equals(text)) {
                token.setText(normalized);
            }
        }
        return TokenLists.compact(tokens);
    }

    /**
     * Maps Arabic letter variants to their Sorani forms: kaf and yeh variants, teh marbuta and
     * word-final heh to ae, other heh to the Sorani heh, word-initial reh to the trilled reh.
     * Tatweel is removed.
     *
     * @param word A word in Arabic script.
     * @return The word in Sorani orthography.
     */
    static String normalizeCharacters(String word) {
        String w = word.replace("\u0640", "");
        StringBuilder sb = new StringBuilder(w.length());
        for (int i = 0; i < w.length(); i++) {
            char c = w.charAt(i);
            boolean last = i == w.length() - 1;
            switch (c) {
                case 'ك' -> sb.append('ک');
                case 'ي', 'ى' -> sb.append('ی');
                case 'ة' -> sb.append('ە');
                case 'ه' -> sb.append(last && i > 0 ? 'ە' : 'ھ');
                case 'ر' -> sb.append(i == 0 ? 'ڕ' : 'ر');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
