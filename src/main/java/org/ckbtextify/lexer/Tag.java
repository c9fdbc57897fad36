package org.ckbtextify.lexer;

/**
 * Semantic labels attached to tokens by taggers and modules and consumed by later modules.
 */
public enum Tag {
    /** A measurement unit in numeric context (set by the unit tagger). */
    IS_UNIT,
    /** A unit that has already been rendered into Kurdish. */
    UNIT_PROCESSED,
    /** A spoken operator, variable, bracket or power produced by the math normalizer. */
    MATH_TERM,
    /** A spoken function name or Greek letter. */
    MATH_FUNCTION,
    /** A spoken fraction. */
    FRACTION,
    /** A rendered date. */
    DATE,
    /** A rendered clock time. */
    TIME,
    /** A token that was read out letter by letter. */
    IS_SPELLED_OUT,
    /** A rendered currency amount. */
    CURRENCY,

    // Script families (set by the script tagger).
    SCRIPT_LATIN,
    SCRIPT_KURDISH,
    SCRIPT_ARABIC,
    SCRIPT_CYRILLIC,
    SCRIPT_GREEK,
    SCRIPT_OTHER
}
