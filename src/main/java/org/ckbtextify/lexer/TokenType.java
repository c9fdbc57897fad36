package org.ckbtextify.lexer;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 * Modules may retype a token once they have rewritten it (usually to {@link #WORD}).
 */
public enum TokenType {
    // Generic fallbacks.
    /** A maximal run of letters (any script), optionally continued by digits. */
    WORD,
    /** A numeric literal: integer, decimal, grouped or scientific. */
    NUMBER,
    /** A single character that is neither a letter, a digit nor whitespace. */
    SYMBOL,

    // Rigid patterns.
    /** A web address, such as https://example.com or www.rudaw.net. */
    URL,
    /** An e-mail address. */
    EMAIL,
    /** A local or internationally formatted phone number. */
    PHONE,
    /** A digit/separator/digit/separator/digit date, such as 2025/12/03. */
    DATE,
    /** A clock time, such as 12:30 or 4:00pm. */
    TIME,
    /** A hashtag or a mention, such as #Kurdistan or @user. */
    TECHNICAL,

    // Script positions.
    /** A run of Unicode subscript digits. */
    SUBSCRIPT,
    /** A run of Unicode superscript digits. */
    SUPERSCRIPT,

    // Miscellaneous.
    /** A token whose content no longer has a lexical category. */
    UNKNOWN
}
