package org.ckbtextify.text;

import java.util.Locale;
import java.util.Map;

/**
 * Kurdish names of the Latin letters, used when a token is read out letter by letter
 * (variables, acronyms, codes).
 */
public final class LetterNames {

    private static final Map<Character, String> NAMES = Map.ofEntries(
            Map.entry('a', "ئەی"), Map.entry('b', "بی"), Map.entry('c', "سی"), Map.entry('d', "دی"),
            Map.entry('e', "ئی"), Map.entry('f', "ئێف"), Map.entry('g', "جی"), Map.entry('h', "ئێچ"),
            Map.entry('i', "ئای"), Map.entry('j', "جەی"), Map.entry('k', "کەی"), Map.entry('l', "ئێڵ"),
            Map.entry('m', "ئێم"), Map.entry('n', "ئێن"), Map.entry('o', "ئۆ"), Map.entry('p', "پی"),
            Map.entry('q', "کیو"), Map.entry('r', "ئاڕ"), Map.entry('s', "ئێس"), Map.entry('t', "تی"),
            Map.entry('u', "یو"), Map.entry('v', "ڤی"), Map.entry('w', "دەبڵیو"), Map.entry('x', "ئێکس"),
            Map.entry('y', "وای"), Map.entry('z', "زێد")
    );

    private LetterNames() {}

    /**
     * @param letter A Latin letter, either case.
     * @return The Kurdish name of the letter, or the letter itself if it is not Latin.
     */
    public static String nameOf(char letter) {
        String name = NAMES.get(Character.toLowerCase(letter));
        return name != null ? name : String.valueOf(letter);
    }

    /**
     * Spells a Latin string letter by letter; digits are read individually and other characters
     * are skipped.
     * @param text The text to spell, e.g. "ac".
     * @return The letter names joined by spaces, e.g. "ئەی سی".
     */
    public static String spell(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            String part;
            if (NAMES.containsKey(c)) {
                part = NAMES.get(c);
            } else if (Character.isDigit(c)) {
                part = KurdishNumberSpeller.spellDigits(String.valueOf(c));
            } else {
                continue;
            }
            if (sb.length() > 0) sb.append(' ');
            sb.append(part);
        }
        return sb.toString();
    }

    /**
     * @return {@code true} if the character is an ASCII Latin letter.
     */
    public static boolean isLatin(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
