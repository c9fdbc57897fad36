package org.ckbtextify.pipeline;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Index helpers over a token sequence that honour the tombstone convention: neighbour lookups
 * skip consumed tokens, and {@link #compact(List)} drops them.
 */
public final class TokenLists {

    private static final Pattern NUMERIC_TEXT = Pattern.compile("[\\d,]+(?:[.٫]\\d+)?", Pattern.UNICODE_CHARACTER_CLASS);

    // Tokens after which a sign is read as negation rather than subtraction.
    private static final Set<String> UNARY_CONTEXT = Set.of(
            "(", "[", "{", "=", ",", "،", ":", "+", "-", "−", "*", "×", "/", "÷", "^", "±");

    private TokenLists() {}

    /**
     * @return The index of the nearest live token before {@code i}, or -1.
     */
    public static int previousIndex(List<Token> tokens, int i) {
        for (int j = i - 1; j >= 0; j--) {
            if (!tokens.get(j).isTombstone()) return j;
        }
        return -1;
    }

    /**
     * @return The index of the nearest live token after {@code i}, or -1.
     */
    public static int nextIndex(List<Token> tokens, int i) {
        for (int j = i + 1; j < tokens.size(); j++) {
            if (!tokens.get(j).isTombstone()) return j;
        }
        return -1;
    }

    /**
     * @return The nearest live token before {@code i}, or {@code null}.
     */
    public static Token previous(List<Token> tokens, int i) {
        int j = previousIndex(tokens, i);
        return j < 0 ? null : tokens.get(j);
    }

    /**
     * @return The nearest live token after {@code i}, or {@code null}.
     */
    public static Token next(List<Token> tokens, int i) {
        int j = nextIndex(tokens, i);
        return j < 0 ? null : tokens.get(j);
    }

    /**
     * Checks whether a token is a plain number, either still typed NUMBER or lexed from a plain
     * numeral and not yet rewritten.
     */
    public static boolean isNumeric(Token token) {
        if (token == null) return false;
        if (token.type() == TokenType.NUMBER) return true;
        return !token.isConverted() && NUMERIC_TEXT.matcher(token.originalText()).matches();
    }

    /**
     * Checks whether a sign at {@code index} stands in unary position: at the start, after an
     * operator, opening bracket, comma or equals sign (spoken or not), or after a non-numeric
     * token that is separated from it by whitespace ("lost -5").
     */
    public static boolean isUnaryPosition(List<Token> tokens, int index) {
        Token before = previous(tokens, index);
        if (before == null) return true;
        if (isOperatorLike(before)) return true;
        return !before.whitespaceAfter().isEmpty() && !isNumeric(before) && !before.hasTag(Tag.MATH_TERM);
    }

    /**
     * Strict form of {@link #isUnaryPosition}: only the start, operators, opening brackets,
     * commas and equals signs count.
     */
    public static boolean isStrictUnaryPosition(List<Token> tokens, int index) {
        Token before = previous(tokens, index);
        return before == null || isOperatorLike(before);
    }

    private static boolean isOperatorLike(Token token) {
        return UNARY_CONTEXT.contains(token.originalText())
                && (token.type() == TokenType.SYMBOL || token.hasTag(Tag.MATH_TERM));
    }

    /**
     * Drops tombstoned tokens.
     * @param tokens The tokens to compact.
     * @return A new list containing only live tokens.
     */
    public static List<Token> compact(List<Token> tokens) {
        List<Token> live = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (!t.isTombstone()) live.add(t);
        }
        return live;
    }

    /**
     * Makes sure there is at least a single space between {@code token} and whatever follows it.
     */
    public static void ensureSpaceAfter(Token token) {
        if (token != null && token.whitespaceAfter().isEmpty()) {
            token.setWhitespaceAfter(" ");
        }
    }
}
