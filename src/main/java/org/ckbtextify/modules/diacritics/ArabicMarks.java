package org.ckbtextify.modules.diacritics;

import java.util.Map;
import java.util.Set;

/**
 * Code points of the Arabic vowel and recitation marks and the Sorani letters Arabic consonants
 * are pronounced as.
 */
final class ArabicMarks {

    static final char FATHATAN = '\u064B';
    static final char DAMMATAN = '\u064C';
    static final char KASRATAN = '\u064D';
    static final char FATHA = '\u064E';
    static final char DAMMA = '\u064F';
    static final char KASRA = '\u0650';
    static final char SHADDA = '\u0651';
    static final char SUKUN = '\u0652';
    static final char DAGGER_ALEF = '\u0670';
    static final char ALEF_WASLA = '\u0671';
    static final char TATWEEL = '\u0640';
    // Letter is written but not pronounced.
    static final char SILENT_ROUNDED_ZERO = '\u06DF';
    static final char SILENT_RECTANGULAR_ZERO = '\u06E0';

    static final Set<Character> SUN_LETTERS = Set.of(
            'ت', 'ث', 'د', 'ذ', 'ر', 'ز', 'س', 'ش', 'ص', 'ض', 'ط', 'ظ', 'ل', 'ن');

    // After a light ra with sukun these still make it heavy.
    static final Set<Character> ELEVATED_LETTERS = Set.of('ص', 'ض', 'ط', 'ظ', 'ق', 'غ', 'خ');

    static final Map<Character, String> LETTERS = Map.ofEntries(
            Map.entry('ث', "س"), Map.entry('ذ', "ز"), Map.entry('ص', "س"), Map.entry('ض', "ز"),
            Map.entry('ط', "ت"), Map.entry('ظ', "ز"), Map.entry('ه', "ھ"), Map.entry('ك', "ک"),
            Map.entry('ي', "ی"), Map.entry('ى', "ا"), Map.entry('أ', "ئ"), Map.entry('إ', "ئ"),
            Map.entry('ؤ', "ئ"), Map.entry('ئ', "ئ"), Map.entry('ء', "ئ"), Map.entry('آ', "ئا"));

    private ArabicMarks() {}

    /**
     * @return {@code true} for harakat, tanwin, shadda, sukun, the dagger alef and the Quranic
     *         annotation marks.
     */
    static boolean isMark(char c) {
        return (c >= '\u064B' && c <= '\u065F') || c == DAGGER_ALEF
                || (c >= '\u06D6' && c <= '\u06ED' && c != '\u06DE' && c != '\u06E9');
    }

    /**
     * @return {@code true} if the text carries vowel marks or an alef wasla.
     */
    static boolean isVoweled(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= FATHATAN && c <= SUKUN) || c == DAGGER_ALEF || c == ALEF_WASLA) return true;
        }
        return false;
    }
}
