package org.ckbtextify.api;

/**
 * How the doubling mark (shadda) is rendered when diacritics are converted.
 */
public enum ShaddaMode {
    /** The marked consonant is written twice. */
    DOUBLE,
    /** The mark is dropped and the consonant written once. */
    REMOVE
}
