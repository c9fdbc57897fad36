package org.ckbtextify.modules.emoji;

import java.util.Map;

/**
 * Emoji code point ranges and the Kurdish names of the most common emoji.
 */
public final class EmojiCatalog {

    private static final Map<Integer, String> NAMES = Map.ofEntries(
            Map.entry(0x1F602, "پێکەنین"),
            Map.entry(0x1F603, "پێکەنین"),
            Map.entry(0x1F604, "پێکەنین"),
            Map.entry(0x2764, "دڵ"),
            Map.entry(0x1F494, "دڵشکاو"),
            Map.entry(0x1F44D, "پەسەند"),
            Map.entry(0x1F44E, "ناپەسەند"),
            Map.entry(0x1F60A, "زەردەخەنە"),
            Map.entry(0x1F642, "زەردەخەنە"),
            Map.entry(0x1F622, "گریان"),
            Map.entry(0x1F62D, "گریان"),
            Map.entry(0x1F525, "ئاگر"),
            Map.entry(0x1F389, "ئاھەنگ"),
            Map.entry(0x1F64F, "سوپاس"),
            Map.entry(0x2B50, "ئەستێرە"),
            Map.entry(0x1F339, "گوڵ"),
            Map.entry(0x1F620, "تووڕەیی"));

    private EmojiCatalog() {}

    /**
     * @param cp A code point.
     * @return {@code true} for pictographs, dingbats and the joiners and modifiers that build
     *         emoji sequences.
     */
    public static boolean isEmoji(int cp) {
        return (cp >= 0x1F000 && cp <= 0x1FAFF)
                || (cp >= 0x2600 && cp <= 0x27BF)
                || (cp >= 0x2300 && cp <= 0x23FF)
                || (cp >= 0x2B00 && cp <= 0x2BFF)
                || isJoinerOrModifier(cp);
    }

    /**
     * @return {@code true} for the variation selector, the zero width joiner and the keycap mark.
     */
    public static boolean isJoinerOrModifier(int cp) {
        return cp == 0xFE0F || cp == 0x200D || cp == 0x20E3;
    }

    /**
     * @return {@code true} if every code point of the text is part of an emoji.
     */
    public static boolean isEmoji(String text) {
        if (text.isEmpty()) return false;
        return text.codePoints().allMatch(EmojiCatalog::isEmoji);
    }

    /**
     * @return The Kurdish name of the emoji, or {@code null} if it has none.
     */
    public static String nameOf(String text) {
        return NAMES.get(text.codePointAt(0));
    }
}
