package org.ckbtextify.modules.math;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Spoken forms of operators, brackets, functions, Greek letters and Unicode fraction glyphs.
 */
final class MathVocabulary {

    static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("+", "کۆ"), Map.entry("*", "کەڕەتی"), Map.entry("×", "کەڕەتی"),
            Map.entry("/", "دابەش"), Map.entry("÷", "دابەش"), Map.entry("±", "کەم کۆ"),
            Map.entry("√", "ڕەگی دووجای"), Map.entry("-", "کەم"), Map.entry("−", "کەم"),
            Map.entry("=", "یەکسانە بە"), Map.entry("^", "توان"), Map.entry("≈", "نزیکەی"));

    static final String NEGATIVE = "سالب";
    static final String POSITIVE = "موجەب";
    static final String RANGE = "بۆ";
    static final String WITH = "لەگەڵ";

    static final Set<String> OPEN_BRACKETS = Set.of("(", "[");
    static final Set<String> CLOSE_BRACKETS = Set.of(")", "]");
    static final String OPEN_BRACKET_WORD = "کەوانەی کراوە";
    static final String CLOSE_BRACKET_WORD = "کەوانەی داخراو";

    static final Map<String, String> FUNCTIONS = Map.of(
            "ln", "لۆگاریتمی سروشتی", "log", "لۆگاریتمی", "sin", "ساینی", "cos", "کۆساینی",
            "tan", "تانجێنتی", "lim", "لیمێتی", "mod", "مۆد", "exp", "ئێکسپۆنێنشیاڵ");

    static final Map<String, String> GREEK = Map.ofEntries(
            Map.entry("π", "پای"), Map.entry("μ", "میو"), Map.entry("α", "ئەلفا"), Map.entry("β", "بیتا"),
            Map.entry("γ", "گاما"), Map.entry("δ", "دێلتا"), Map.entry("Δ", "دێلتا"), Map.entry("θ", "سیتا"),
            Map.entry("λ", "لامدا"), Map.entry("σ", "سیگما"), Map.entry("Σ", "سیگما"), Map.entry("φ", "فای"),
            Map.entry("ω", "ئۆمیگا"), Map.entry("Ω", "ئۆمیگا"));

    /** Unicode vulgar fractions as {numerator, denominator}. */
    static final Map<String, int[]> FRACTIONS = Map.ofEntries(
            Map.entry("½", new int[]{1, 2}), Map.entry("¼", new int[]{1, 4}), Map.entry("¾", new int[]{3, 4}),
            Map.entry("⅓", new int[]{1, 3}), Map.entry("⅔", new int[]{2, 3}), Map.entry("⅕", new int[]{1, 5}),
            Map.entry("⅖", new int[]{2, 5}), Map.entry("⅗", new int[]{3, 5}), Map.entry("⅘", new int[]{4, 5}),
            Map.entry("⅙", new int[]{1, 6}), Map.entry("⅚", new int[]{5, 6}), Map.entry("⅛", new int[]{1, 8}),
            Map.entry("⅜", new int[]{3, 8}), Map.entry("⅝", new int[]{5, 8}), Map.entry("⅞", new int[]{7, 8}),
            Map.entry("⅐", new int[]{1, 7}), Map.entry("⅑", new int[]{1, 9}), Map.entry("⅒", new int[]{1, 10}),
            Map.entry("↉", new int[]{0, 3}));

    private MathVocabulary() {}

    static String function(String word) {
        String name = FUNCTIONS.get(word.toLowerCase(Locale.ROOT));
        return name != null ? name : GREEK.get(word);
    }

    static boolean isOperator(String text) {
        return OPERATORS.containsKey(text);
    }

    static boolean isBracket(String text) {
        return OPEN_BRACKETS.contains(text) || CLOSE_BRACKETS.contains(text);
    }
}
