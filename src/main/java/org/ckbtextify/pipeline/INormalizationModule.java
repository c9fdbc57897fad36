package org.ckbtextify.pipeline;

import org.ckbtextify.lexer.Token;

import java.util.List;

/**
 * A normalization pass over the token sequence.
 * <p>
 * A module may rewrite tokens in place, split a token into several, or consume tokens by
 * emptying their text (tombstones). It must not reorder unrelated tokens and must not keep
 * per-call state between invocations.
 */
public interface INormalizationModule {

    /**
     * @return A short, stable name used in logs.
     */
    String name();

    /**
     * @return The execution priority; higher runs earlier, ties keep registration order.
     */
    int priority();

    /**
     * Applies this pass to the given tokens.
     *
     * @param tokens The current token sequence (mutable).
     * @return The resulting token sequence, possibly the same list.
     */
    List<Token> process(List<Token> tokens);
}
