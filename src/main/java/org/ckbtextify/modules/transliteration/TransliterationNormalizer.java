package org.ckbtextify.modules.transliteration;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.text.LatinTransliterator;
import org.ckbtextify.text.LetterNames;
import org.ckbtextify.text.Lexicons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes Latin, Cyrillic and Greek words in Sorani script: lexicon words first, acronyms by
 * letter names, everything else through the grapheme rules. CamelCase words are split at their
 * capitals and each part is read on its own.
 * <p>
 * TECHNICAL tokens and tokens that an earlier pass already converted are left alone.
 */
public class TransliterationNormalizer implements INormalizationModule {

    private static final String LEXICON = "lexicon/english.conf";
    private static final Pattern FOREIGN = Pattern.compile("[\\p{IsLatin}\\p{IsCyrillic}\\p{IsGreek}]+");
    private static final Pattern ACRONYM = Pattern.compile("[A-Z]{2,}");
    private static final Pattern CAMEL_PARTS = Pattern.compile("[A-Z]{2,}(?![a-z])|[A-Z]?[a-z]+|[A-Z]");

    private final Map<String, String> lexicon;

    public TransliterationNormalizer() {
        this.lexicon = Lexicons.load(LEXICON, "words");
    }

    @Override
    public String name() {
        return "TransliterationNormalizer";
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.type() != TokenType.WORD || token.isConverted() || token.isTombstone()) {
                continue;
            }
            if (!FOREIGN.matcher(token.text()).matches()) {
                continue;
            }
            String original = token.text();
            token.rewrite(transliterate(original));
            if (ACRONYM.matcher(original).matches()) {
                token.addTag(Tag.IS_SPELLED_OUT);
            }
        }
        return tokens;
    }

    /**
     * @param word A word in Latin, Cyrillic or Greek script.
     * @return The Sorani rendering.
     */
    String transliterate(String word) {
        String known = lexicon.get(word.toLowerCase(Locale.ROOT));
        if (known != null) {
            return known;
        }
        if (!isLatin(word)) {
            return LatinTransliterator.transliterate(word);
        }
        if (ACRONYM.matcher(word).matches()) {
            return LetterNames.spell(word);
        }
        List<String> parts = new ArrayList<>();
        Matcher m = CAMEL_PARTS.matcher(word);
        while (m.find()) {
            String part = m.group();
            String lex = lexicon.get(part.toLowerCase(Locale.ROOT));
            if (lex != null) {
                parts.add(lex);
            } else if (ACRONYM.matcher(part).matches() || part.length() == 1) {
                parts.add(LetterNames.spell(part));
            } else {
                parts.add(LatinTransliterator.transliterate(part));
            }
        }
        return String.join(" ", parts);
    }

    private static boolean isLatin(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!LetterNames.isLatin(word.charAt(i))) return false;
        }
        return true;
    }
}
