package org.ckbtextify.modules.diacritics;

import org.ckbtextify.api.DiacriticsMode;
import org.ckbtextify.api.ShaddaMode;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.ckbtextify.modules.diacritics.ArabicMarks.*;

/**
 * Turns vowel-marked Arabic-script text (religious register) into plain Sorani spelling that
 * carries the pronunciation: short vowels become letters, shadda doubles its consonant, and the
 * tajweed assimilations are applied (sun-letter article, heavy/light lam of the divine name,
 * heavy/light ra, nasal assimilation before labials and semivowels).
 * <p>
 * The tokens are walked once from left to right. The final vowel of the previous voweled token
 * and whether the current token opens an utterance are threaded through the walk, because the
 * alef wasla and the divine name depend on them.
 */
public class DiacriticsNormalizer implements INormalizationModule {

    private static final Set<String> UTTERANCE_BREAKS = Set.of(".", "!", "?", "؟", "۔", "۝", ":", "؛");

    enum Vowel { NONE, FATHA, KASRA, DAMMA }

    private final DiacriticsMode mode;
    private final ShaddaMode shaddaMode;

    public DiacriticsNormalizer(DiacriticsMode mode, ShaddaMode shaddaMode) {
        this.mode = mode;
        this.shaddaMode = shaddaMode;
    }

    @Override
    public String name() {
        return "DiacriticsNormalizer";
    }

    @Override
    public int priority() {
        return 35;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        if (mode == DiacriticsMode.KEEP) {
            return tokens;
        }
        Vowel lastVowel = Vowel.NONE;
        boolean utteranceStart = true;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTombstone()) {
                continue;
            }
            if (token.type() == TokenType.WORD && !token.isConverted() && isVoweled(token.text())) {
                if (mode == DiacriticsMode.REMOVE) {
                    token.setText(strip(token.text()));
                } else {
                    Token next = TokenLists.next(tokens, i);
                    Rendered r = render(token.text(), lastVowel, utteranceStart, firstLetter(next));
                    token.rewrite(r.text());
                    lastVowel = r.finalVowel();
                }
            } else {
                lastVowel = Vowel.NONE;
            }
            utteranceStart = UTTERANCE_BREAKS.contains(token.text()) || token.whitespaceAfter().contains("\n");
        }
        return tokens;
    }

    /**
     * Removes every vowel and recitation mark; the alef wasla becomes a plain alef.
     */
    static String strip(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == ALEF_WASLA) {
                sb.append('ا');
            } else if (!isMark(c) && c != TATWEEL) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    record Rendered(String text, Vowel finalVowel) {
    }

    /** A base letter with the marks written on it. */
    private static final class Cluster {
        final char base;
        final StringBuilder marks = new StringBuilder();

        Cluster(char base) {
            this.base = base;
        }

        boolean has(char mark) {
            return marks.indexOf(String.valueOf(mark)) >= 0;
        }

        boolean isBare() {
            return marks.length() == 0 || (marks.length() == 1 && has(SUKUN));
        }

        Vowel vowel() {
            if (has(FATHA) || has(FATHATAN) || has(DAGGER_ALEF)) return Vowel.FATHA;
            if (has(KASRA) || has(KASRATAN)) return Vowel.KASRA;
            if (has(DAMMA) || has(DAMMATAN)) return Vowel.DAMMA;
            return Vowel.NONE;
        }

        boolean hasTanwin() {
            return has(FATHATAN) || has(KASRATAN) || has(DAMMATAN);
        }
    }

    private static List<Cluster> clusters(String text) {
        List<Cluster> clusters = new ArrayList<>();
        for (char c : text.toCharArray()) {
            if (c == TATWEEL) {
                continue;
            }
            if (isMark(c) && !clusters.isEmpty()) {
                clusters.get(clusters.size() - 1).marks.append(c);
            } else if (!isMark(c)) {
                clusters.add(new Cluster(c));
            }
        }
        return clusters;
    }

    /**
     * Renders one voweled word.
     *
     * @param text           The word with its marks.
     * @param before         The final vowel of the preceding voweled word.
     * @param utteranceStart Whether the word opens an utterance (the wasla is then pronounced).
     * @param nextLetter     The first letter of the following token, for nasal assimilation across words.
     */
    Rendered render(String text, Vowel before, boolean utteranceStart, char nextLetter) {
        List<Cluster> cs = clusters(text);
        StringBuilder out = new StringBuilder();
        Vowel prevVowel = before;
        Vowel last = Vowel.NONE;

        for (int k = 0; k < cs.size(); k++) {
            Cluster c = cs.get(k);
            if (c.has(SILENT_ROUNDED_ZERO) || c.has(SILENT_RECTANGULAR_ZERO)) {
                continue;
            }
            if (isWasla(cs, k)) {
                if (k == 0 && utteranceStart) {
                    out.append("ئە");
                    prevVowel = Vowel.FATHA;
                }
                continue;
            }
            if (c.base == 'ل' && k > 0 && isWasla(cs, k - 1) && isDivineName(cs, k)) {
                boolean light = (k - 1 == 0 && !utteranceStart) ? before == Vowel.KASRA : prevVowel == Vowel.KASRA;
                out.append(light ? "لل" : "ڵڵ").append('ا');
                prevVowel = Vowel.FATHA;
                last = Vowel.FATHA;
                k++;
                continue;
            }
            if (c.base == 'ل' && k > 0 && isWasla(cs, k - 1) && k + 1 < cs.size()
                    && SUN_LETTERS.contains(cs.get(k + 1).base) && cs.get(k + 1).has(SHADDA)) {
                // Article assimilated into the sun letter.
                continue;
            }
            if (c.base == 'ا' || c.base == 'ى') {
                out.append('ا');
                prevVowel = Vowel.FATHA;
                last = Vowel.FATHA;
                continue;
            }

            Cluster next = k + 1 < cs.size() ? cs.get(k + 1) : null;
            char following = next != null ? next.base : nextLetter;
            Vowel vowel = c.vowel();

            String letter = letterFor(c, prevVowel, following);
            if (c.base == 'ن' && vowel == Vowel.NONE) {
                letter = nasal(following, letter);
            }
            int count = c.has(SHADDA) && shaddaMode == ShaddaMode.DOUBLE ? 2 : 1;
            out.append(letter.repeat(count));

            if (vowel == Vowel.NONE) {
                prevVowel = Vowel.NONE;
                last = Vowel.NONE;
                continue;
            }
            boolean longVowel = next != null && next.isBare()
                    && ((vowel == Vowel.FATHA && (next.base == 'ا' || next.base == 'ى'))
                    || (vowel == Vowel.KASRA && next.base == 'ي')
                    || (vowel == Vowel.DAMMA && next.base == 'و'));
            if (c.hasTanwin()) {
                out.append(shortVowel(vowel)).append(nasal(following, "ن"));
                if (vowel == Vowel.FATHA && longVowel) k++;
            } else if (longVowel) {
                out.append(longVowel(vowel));
                k++;
            } else if (c.has(DAGGER_ALEF)) {
                out.append('ا');
            } else {
                out.append(shortVowel(vowel));
            }
            prevVowel = vowel;
            last = vowel;
        }
        return new Rendered(out.toString(), last);
    }

    private static boolean isWasla(List<Cluster> cs, int k) {
        Cluster c = cs.get(k);
        if (c.base == ALEF_WASLA) return true;
        return c.base == 'ا' && k == 0 && c.marks.length() == 0 && cs.size() > 1 && cs.get(1).base == 'ل';
    }

    private static boolean isDivineName(List<Cluster> cs, int k) {
        return k + 2 < cs.size()
                && cs.get(k + 1).base == 'ل' && cs.get(k + 1).has(SHADDA)
                && cs.get(k + 2).base == 'ه';
    }

    private static String letterFor(Cluster c, Vowel prevVowel, char following) {
        if (c.base == 'ر') {
            return isHeavyRa(c, prevVowel, following) ? "ڕ" : "ر";
        }
        if (c.base == 'ة') {
            return c.vowel() == Vowel.NONE ? "ە" : "ت";
        }
        String mapped = LETTERS.get(c.base);
        return mapped != null ? mapped : String.valueOf(c.base);
    }

    /**
     * Ra is heavy with fatha or damma and light with kasra. Without a vowel it follows the
     * preceding vowel, except that a light ra before an elevated letter stays heavy.
     */
    private static boolean isHeavyRa(Cluster c, Vowel prevVowel, char following) {
        Vowel own = c.vowel();
        if (own == Vowel.FATHA || own == Vowel.DAMMA) return true;
        if (own == Vowel.KASRA) return false;
        if (prevVowel == Vowel.KASRA) return ELEVATED_LETTERS.contains(following);
        return true;
    }

    /**
     * A vowelless noon (or the noon of tanwin) becomes a meem before ba, and merges into a
     * following ya or waw.
     */
    private static String nasal(char following, String noon) {
        if (following == 'ب') return "م";
        if (following == 'ي' || following == 'ی') return "ی";
        if (following == 'و') return "و";
        return noon;
    }

    private static String shortVowel(Vowel v) {
        return switch (v) {
            case FATHA -> "ە";
            case KASRA -> "ی";
            case DAMMA -> "و";
            case NONE -> "";
        };
    }

    private static String longVowel(Vowel v) {
        return switch (v) {
            case FATHA -> "ا";
            case KASRA -> "ی";
            case DAMMA -> "وو";
            case NONE -> "";
        };
    }

    private static char firstLetter(Token token) {
        if (token == null) return 0;
        for (char c : token.text().toCharArray()) {
            if (Character.isLetter(c) && c != ALEF_WASLA) return c;
        }
        return 0;
    }
}
