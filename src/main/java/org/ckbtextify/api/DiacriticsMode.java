package org.ckbtextify.api;

/**
 * How Arabic-script vowel marks (harakat) are treated.
 */
public enum DiacriticsMode {
    /** Vowel marks are turned into Kurdish letters, applying the assimilation rules. */
    CONVERT,
    /** Vowel marks are stripped. */
    REMOVE,
    /** Vowel marks are left in place. */
    KEEP
}
