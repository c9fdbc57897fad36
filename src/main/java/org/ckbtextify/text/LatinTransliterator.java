package org.ckbtextify.text;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based grapheme mapping from Latin (and romanized Cyrillic/Greek) spelling to Sorani
 * script. Used as a fallback for words that no lexicon covers.
 */
public final class LatinTransliterator {

    // Multi-letter graphemes, matched greedily before single letters.
    private static final Map<String, String> DIGRAPHS = new LinkedHashMap<>();
    private static final Map<Character, String> LETTERS = new LinkedHashMap<>();
    private static final Map<Character, String> INITIAL_VOWELS = Map.of(
            'a', "ئا", 'e', "ئە", 'i', "ئی", 'o', "ئۆ", 'u', "ئو");
    private static final Map<Character, String> CYRILLIC = new LinkedHashMap<>();
    private static final Map<Character, String> GREEK = new LinkedHashMap<>();

    static {
        DIGRAPHS.put("sch", "ش");
        DIGRAPHS.put("tch", "چ");
        DIGRAPHS.put("sh", "ش");
        DIGRAPHS.put("ch", "چ");
        DIGRAPHS.put("th", "س");
        DIGRAPHS.put("ph", "ف");
        DIGRAPHS.put("gh", "غ");
        DIGRAPHS.put("kh", "خ");
        DIGRAPHS.put("zh", "ژ");
        DIGRAPHS.put("ck", "ک");
        DIGRAPHS.put("qu", "کو");
        DIGRAPHS.put("oo", "وو");
        DIGRAPHS.put("ee", "ی");
        DIGRAPHS.put("ea", "ی");
        DIGRAPHS.put("ou", "او");
        DIGRAPHS.put("ai", "ەی");
        DIGRAPHS.put("ay", "ەی");
        DIGRAPHS.put("oa", "ۆ");

        String latin = "abcdefghijklmnopqrstuvwxyz";
        String[] kurdish = {"ا", "ب", "ک", "د", "ە", "ف", "گ", "ھ", "ی", "ج", "ک", "ل", "م", "ن", "ۆ",
                "پ", "ک", "ر", "س", "ت", "و", "ڤ", "و", "کس", "ی", "ز"};
        for (int i = 0; i < latin.length(); i++) {
            LETTERS.put(latin.charAt(i), kurdish[i]);
        }

        String cyr = "абвгдеёжзийклмнопрстуфхцчшщъыьэюя";
        String[] cyrLatin = {"a", "b", "v", "g", "d", "e", "yo", "zh", "z", "i", "y", "k", "l", "m", "n", "o",
                "p", "r", "s", "t", "u", "f", "kh", "ts", "ch", "sh", "sh", "", "i", "", "e", "yu", "ya"};
        for (int i = 0; i < cyr.length(); i++) {
            CYRILLIC.put(cyr.charAt(i), cyrLatin[i]);
        }

        String greek = "αβγδεζηθικλμνξοπρσςτυφχψω";
        String[] greekLatin = {"a", "v", "g", "d", "e", "z", "i", "th", "i", "k", "l", "m", "n", "x", "o",
                "p", "r", "s", "s", "t", "i", "f", "kh", "ps", "o"};
        for (int i = 0; i < greek.length(); i++) {
            GREEK.put(greek.charAt(i), greekLatin[i]);
        }
    }

    private LatinTransliterator() {}

    /**
     * Romanizes Cyrillic and Greek letters; Latin letters pass through lower-cased.
     * @param word The word to romanize.
     * @return The lower-case Latin spelling.
     */
    public static String romanize(String word) {
        StringBuilder sb = new StringBuilder();
        for (char c : word.toLowerCase(Locale.ROOT).toCharArray()) {
            if (CYRILLIC.containsKey(c)) {
                sb.append(CYRILLIC.get(c));
            } else if (GREEK.containsKey(c)) {
                sb.append(GREEK.get(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Transliterates a single word into Sorani script.
     * <p>
     * Initial "r" and doubled "rr" become the trilled ڕ, a word-initial vowel gets the glottal
     * carrier ئ, doubled consonants collapse and a final silent "e" after a consonant is dropped.
     *
     * @param word A Latin, Cyrillic or Greek word.
     * @return The Sorani rendering.
     */
    public static String transliterate(String word) {
        String w = romanize(word);
        if (w.length() > 3 && w.endsWith("e") && !isVowel(w.charAt(w.length() - 2))) {
            w = w.substring(0, w.length() - 1);
        }
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < w.length()) {
            char c = w.charAt(i);
            if (i == 0 && INITIAL_VOWELS.containsKey(c)) {
                sb.append(INITIAL_VOWELS.get(c));
                i++;
                continue;
            }
            if (c == 'r' && (i == 0 || (i + 1 < w.length() && w.charAt(i + 1) == 'r'))) {
                sb.append('ڕ');
                i += (i + 1 < w.length() && w.charAt(i + 1) == 'r') ? 2 : 1;
                continue;
            }
            String digraph = matchDigraph(w, i);
            if (digraph != null) {
                sb.append(DIGRAPHS.get(digraph));
                i += digraph.length();
                continue;
            }
            if (c == 'c' && i + 1 < w.length() && "eiy".indexOf(w.charAt(i + 1)) >= 0) {
                sb.append('س');
            } else if (LETTERS.containsKey(c)) {
                boolean doubled = i > 0 && w.charAt(i - 1) == c && !isVowel(c);
                if (!doubled) sb.append(LETTERS.get(c));
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            }
            i++;
        }
        return sb.toString();
    }

    private static String matchDigraph(String w, int at) {
        for (String d : DIGRAPHS.keySet()) {
            if (w.startsWith(d, at)) return d;
        }
        return null;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
