package org.ckbtextify.text;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The closed table of Sorani grammatical suffixes that may be glued to a spoken form
 * ("12:30ە", "5ی", "PMەکە"), and the rule that attaches them.
 */
public final class SuffixJoiner {

    /** Known suffixes, longest first so that matching prefers "ەکان" over "ە". */
    public static final List<String> SUFFIXES = Stream.of(
                    "ە", "یە", "ی", "یش", "ش", "ێک", "یەک", "ەکە", "ەکان", "کە", "کان", "ان", "یان",
                    "دا", "ەدا", "یدا", "ەوە", "وە", "یەوە", "م", "مان", "ت", "تان", "مین", "یەم", "ەم", "ەمین")
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.toUnmodifiableList());

    // Checked in order.
    private static final List<String> VOWELS = List.of("وو", "و", "ی", "ێ", "ا", "ە", "ۆ");
    private static final List<String> NEEDS_GLIDE = List.of("ە", "ەکە", "ەکان");

    private SuffixJoiner() {}

    /**
     * @param candidate The text following a spoken form.
     * @return {@code true} if the text is exactly one known suffix.
     */
    public static boolean isSuffix(String candidate) {
        return SUFFIXES.contains(candidate);
    }

    /**
     * Attaches a suffix to a spoken form. After a vowel, "ە" becomes "یە", and the other
     * vowel-initial suffixes get the linking "ی".
     * @param spoken The spoken form, e.g. "دوازدە و نیو".
     * @param suffix The suffix, e.g. "ە".
     * @return The joined form.
     */
    public static String join(String spoken, String suffix) {
        String text = spoken.strip();
        if (suffix == null || suffix.isEmpty()) {
            return text;
        }
        if (NEEDS_GLIDE.contains(suffix) && endsWithVowel(text)) {
            return "ە".equals(suffix) ? text + "یە" : text + "ی" + suffix;
        }
        return text + suffix;
    }

    /**
     * @return {@code true} if the text ends with a Kurdish vowel letter.
     */
    public static boolean endsWithVowel(String text) {
        for (String v : VOWELS) {
            if (text.endsWith(v)) return true;
        }
        return false;
    }
}
