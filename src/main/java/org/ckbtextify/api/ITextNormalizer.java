package org.ckbtextify.api;

/**
 * Defines the public interface of the Kurdish text normalizer.
 */
public interface ITextNormalizer {

    /**
     * Rewrites mixed-script text into fully spelled-out, speakable Kurdish.
     * <p>
     * Implementations keep no state between calls; per-token failures leave the affected text
     * unchanged instead of failing the call.
     *
     * @param text The raw input text.
     * @return The normalized text, with whitespace canonicalized.
     */
    String normalize(String text);
}
