package org.ckbtextify.modules.web;

import org.ckbtextify.text.KurdishNumberSpeller;
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
 * Reads identifiers aloud part by part: known words from the web lexicon, short or all-caps
 * Latin runs letter by letter, longer Latin runs transliterated, digit runs as cardinals and
 * separators by name. Arabic-script runs are kept as written.
 */
public final class WebSpeller {

    private static final String LEXICON = "lexicon/web.conf";
    private static final Pattern PARTS = Pattern.compile("[A-Za-z]+|\\p{Nd}+|[\\p{L}\\p{M}]+|\\S",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, String> words;
    private final Map<String, String> symbols;

    public WebSpeller() {
        this.words = Lexicons.load(LEXICON, "words");
        this.symbols = Lexicons.load(LEXICON, "symbols");
    }

    /**
     * @param text An URL, e-mail address or code.
     * @return The spoken reading, parts separated by single spaces.
     */
    public String speak(String text) {
        List<String> spoken = new ArrayList<>();
        Matcher m = PARTS.matcher(text);
        while (m.find()) {
            String part = speakPart(m.group());
            if (!part.isEmpty()) spoken.add(part);
        }
        return String.join(" ", spoken);
    }

    private String speakPart(String part) {
        char first = part.charAt(0);
        if (Character.isDigit(first)) {
            return KurdishNumberSpeller.spellKeepingZeros(KurdishNumberSpeller.toAsciiDigits(part));
        }
        if (LetterNames.isLatin(first)) {
            return speakLatin(part);
        }
        if (Character.isLetter(first)) {
            return part;
        }
        return symbols.getOrDefault(part, "");
    }

    /**
     * Reads a Latin run: a lexicon word, an acronym spelled by letter names, or a transliteration.
     */
    public String speakLatin(String run) {
        String known = words.get(run.toLowerCase(Locale.ROOT));
        if (known != null) {
            return known;
        }
        boolean acronym = run.length() > 1 && run.equals(run.toUpperCase(Locale.ROOT));
        if (run.length() <= 2 || acronym || !hasVowel(run)) {
            return LetterNames.spell(run);
        }
        return LatinTransliterator.transliterate(run);
    }

    private static boolean hasVowel(String run) {
        for (char c : run.toLowerCase(Locale.ROOT).toCharArray()) {
            if ("aeiouy".indexOf(c) >= 0) return true;
        }
        return false;
    }
}
