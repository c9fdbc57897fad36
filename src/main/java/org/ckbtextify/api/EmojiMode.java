package org.ckbtextify.api;

/**
 * How emoji code points are treated.
 */
public enum EmojiMode {
    /** Emoji are dropped. */
    REMOVE,
    /** Known emoji are replaced by a Kurdish word, unknown ones are dropped. */
    CONVERT,
    /** Emoji are left untouched. */
    IGNORE
}
