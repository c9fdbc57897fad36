package org.ckbtextify.modules.technical;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.modules.units.UnitCatalog;
import org.ckbtextify.modules.web.WebSpeller;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Spells technical identifiers: hashtags and mentions, alphanumeric codes ("A1", "MP3"),
 * underscore identifiers and tightly hyphenated codes ("GPT-4", "COVID-19").
 * <p>
 * Hashtags and mentions are split into the spoken marker and the spoken name, so that later
 * passes see two tokens.
 */
public class TechnicalNormalizer implements INormalizationModule {

    static final String HASHTAG = "ھاشتاگ";
    static final String AT = "ئەت";
    static final String DASH = "داش";

    private static final Pattern ALPHANUMERIC = Pattern.compile("(?=.*\\d)(?=.*[A-Za-z])[A-Za-z0-9]+");
    private static final Pattern ACRONYM = Pattern.compile("[A-Z]{2,5}");
    private static final Pattern UNDERSCORED = Pattern.compile("[A-Za-z0-9]+(?:_[A-Za-z0-9]+)+");
    private static final Set<String> RESERVED = Set.of(
            "ln", "log", "sin", "cos", "tan", "lim", "mod", "exp",
            "iqd", "usd", "eur", "gbp", "jpy", "try", "irr", "sar", "aed", "kwd", "aud", "cad");

    private final WebSpeller speller;

    public TechnicalNormalizer(WebSpeller speller) {
        this.speller = speller;
    }

    @Override
    public String name() {
        return "TechnicalNormalizer";
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        markHyphenatedCodes(tokens);

        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.isTombstone() || token.isConverted()) {
                result.add(token);
                continue;
            }
            if (token.type() == TokenType.TECHNICAL) {
                String marker = token.text().startsWith("#") ? HASHTAG : AT;
                String core = token.text().substring(1);
                Token markerToken = new Token(marker, token.text().substring(0, 1), TokenType.WORD, " ");
                markerToken.rewrite(marker);
                Token coreToken = new Token(core, core, TokenType.WORD, token.whitespaceAfter());
                coreToken.rewrite(speller.speak(core));
                coreToken.addTag(Tag.IS_SPELLED_OUT);
                result.add(markerToken);
                result.add(coreToken);
                continue;
            }
            if (token.type() == TokenType.WORD && !isReserved(token.text())
                    && (ALPHANUMERIC.matcher(token.text()).matches() || UNDERSCORED.matcher(token.text()).matches())) {
                token.rewrite(speller.speak(token.text()));
                token.addTag(Tag.IS_SPELLED_OUT);
            }
            result.add(token);
        }
        return result;
    }

    /**
     * Finds "code-code" triples glued without whitespace where at least one side is a word-like
     * code, and speaks them; a number-number pair is a range and stays for the math normalizer.
     */
    private void markHyphenatedCodes(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token dash = tokens.get(i);
            if (!"-".equals(dash.text()) || dash.type() != TokenType.SYMBOL || !dash.whitespaceAfter().isEmpty()) {
                continue;
            }
            int p = TokenLists.previousIndex(tokens, i);
            int n = TokenLists.nextIndex(tokens, i);
            if (p < 0 || n < 0) continue;
            Token left = tokens.get(p);
            Token right = tokens.get(n);
            if (!left.whitespaceAfter().isEmpty() || !isCodePart(left) || !isCodePart(right)) {
                continue;
            }
            if (left.type() == TokenType.NUMBER && right.type() == TokenType.NUMBER) {
                continue;
            }
            speakCodePart(left);
            dash.rewrite(DASH, TokenType.WORD);
            speakCodePart(right);
        }
    }

    private boolean isCodePart(Token t) {
        if (t.isConverted() && !t.hasTag(Tag.IS_SPELLED_OUT)) return false;
        if (t.type() == TokenType.NUMBER) return true;
        if (t.type() != TokenType.WORD || isReserved(t.text())) return false;
        return t.hasTag(Tag.IS_SPELLED_OUT)
                || ALPHANUMERIC.matcher(t.text()).matches()
                || ACRONYM.matcher(t.text()).matches();
    }

    private void speakCodePart(Token t) {
        if (t.isConverted()) return;
        t.rewrite(speller.speak(t.text()), TokenType.WORD);
        t.addTag(Tag.IS_SPELLED_OUT);
    }

    private static boolean isReserved(String text) {
        return RESERVED.contains(text.toLowerCase(Locale.ROOT)) || UnitCatalog.isUnit(text);
    }
}
