package org.ckbtextify.modules.math;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.modules.units.UnitCatalog;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.KurdishNumberSpeller;
import org.ckbtextify.text.LetterNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads mathematical notation: operators, brackets, fractions, functions, Greek letters,
 * algebraic variables and sub-/superscripts.
 * <p>
 * Symbols that double as prose punctuation are only spoken when their neighbours show an active
 * expression. The hyphen is the hardest case: between two isolated numbers it is a range
 * ("1990-2000"), inside an expression it is subtraction, and in unary position it is negation.
 * A slash between two isolated numbers is a fraction; inside an operator chain it is division.
 */
public class MathNormalizer implements INormalizationModule {

    private static final Logger LOG = LoggerFactory.getLogger(MathNormalizer.class);

    private static final Pattern VARIABLE = Pattern.compile("[A-Za-z]{1,2}");
    private static final Set<String> MINUS_SIGNS = Set.of("-", "−");
    private static final Set<String> SLASHES = Set.of("/", "÷");

    @Override
    public String name() {
        return "MathNormalizer";
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTombstone() || token.isConverted()) {
                continue;
            }
            if (MathVocabulary.FRACTIONS.containsKey(token.text())) {
                int[] f = MathVocabulary.FRACTIONS.get(token.text());
                boolean mixed = TokenLists.isNumeric(TokenLists.previous(tokens, i));
                token.rewrite(formatFraction(f[0], f[1], mixed), TokenType.WORD);
                token.addTag(Tag.FRACTION);
            } else if (token.type() == TokenType.SUBSCRIPT) {
                token.rewrite("بنچینە " + KurdishNumberSpeller.spell(new BigInteger(scriptDigits(token.text()))), TokenType.WORD);
                token.addTag(Tag.MATH_TERM);
            } else if (token.type() == TokenType.SUPERSCRIPT) {
                convertSuperscript(tokens, i);
            } else if (token.type() == TokenType.WORD) {
                convertWord(tokens, i);
            } else if (token.type() == TokenType.SYMBOL
                    && (MathVocabulary.isOperator(token.text()) || MathVocabulary.isBracket(token.text()))) {
                convertSymbol(tokens, i);
            }
        }
        return TokenLists.compact(tokens);
    }

    private void convertSuperscript(List<Token> tokens, int i) {
        Token prev = TokenLists.previous(tokens, i);
        if (prev != null && (prev.hasTag(Tag.IS_UNIT) || prev.hasTag(Tag.UNIT_PROCESSED))) {
            return;
        }
        Token token = tokens.get(i);
        token.rewrite("توان " + KurdishNumberSpeller.spell(new BigInteger(scriptDigits(token.text()))), TokenType.WORD);
        token.addTag(Tag.MATH_TERM);
    }

    private void convertWord(List<Token> tokens, int i) {
        Token token = tokens.get(i);
        String function = MathVocabulary.function(token.text());
        if (function != null) {
            token.rewrite(function);
            token.addTag(Tag.MATH_FUNCTION);
            return;
        }
        if (!VARIABLE.matcher(token.text()).matches()) {
            return;
        }
        if (token.hasTag(Tag.IS_UNIT) && UnitCatalog.isStrict(token.text())) {
            return;
        }
        if (isVariableContext(tokens, i)) {
            token.rewrite(LetterNames.spell(token.text()));
            token.addTag(Tag.MATH_TERM);
        }
    }

    /**
     * A one- or two-letter Latin word is a variable next to an operator, bracket, script or math
     * term. Next to a number a single letter always qualifies, two letters only when glued to it
     * ("2ab").
     */
    private boolean isVariableContext(List<Token> tokens, int i) {
        Token token = tokens.get(i);
        Token prev = TokenLists.previous(tokens, i);
        Token next = TokenLists.next(tokens, i);
        for (Token n : new Token[]{prev, next}) {
            if (n == null) continue;
            if (isOperatorOrBracket(n) || n.hasTag(Tag.MATH_TERM) || n.hasTag(Tag.MATH_FUNCTION)
                    || n.type() == TokenType.SUPERSCRIPT || n.type() == TokenType.SUBSCRIPT) {
                return true;
            }
        }
        boolean single = token.text().length() == 1;
        if (prev != null && prev.type() == TokenType.NUMBER && (single || prev.whitespaceAfter().isEmpty())) {
            return true;
        }
        return next != null && next.type() == TokenType.NUMBER && (single || token.whitespaceAfter().isEmpty());
    }

    private void convertSymbol(List<Token> tokens, int i) {
        Token token = tokens.get(i);
        Token prev = TokenLists.previous(tokens, i);
        Token next = TokenLists.next(tokens, i);
        String symbol = token.text();

        if (MathVocabulary.isBracket(symbol)) {
            if (isBracketContext(tokens, i)) {
                token.rewrite(MathVocabulary.OPEN_BRACKETS.contains(symbol)
                        ? MathVocabulary.OPEN_BRACKET_WORD : MathVocabulary.CLOSE_BRACKET_WORD, TokenType.WORD);
                token.addTag(Tag.MATH_TERM);
            }
            return;
        }

        if ("+".equals(symbol) && prev != null && next != null && isProseWord(prev)) {
            if (isProseWord(next)) {
                token.rewrite(MathVocabulary.WITH, TokenType.WORD);
                return;
            }
            if (next.type() == TokenType.NUMBER) {
                return;
            }
        }

        if (!isOperatorContext(prev, next)) {
            return;
        }

        if (MINUS_SIGNS.contains(symbol) || "+".equals(symbol)) {
            boolean unary = TokenLists.isStrictUnaryPosition(tokens, i)
                    || (MINUS_SIGNS.contains(symbol) && TokenLists.isUnaryPosition(tokens, i));
            if (unary && next != null && next.type() == TokenType.NUMBER && token.whitespaceAfter().isEmpty()) {
                // Glued sign, merged by the number normalizer.
                return;
            }
            if (MINUS_SIGNS.contains(symbol) && !unary && isRange(tokens, i)) {
                token.rewrite(MathVocabulary.RANGE, TokenType.WORD);
                return;
            }
            if (unary && TokenLists.isStrictUnaryPosition(tokens, i)) {
                token.rewrite(MINUS_SIGNS.contains(symbol) ? MathVocabulary.NEGATIVE : MathVocabulary.POSITIVE, TokenType.WORD);
                token.addTag(Tag.MATH_TERM);
                return;
            }
        }

        if (SLASHES.contains(symbol)) {
            if (isUnit(prev) || isUnit(next)) {
                return;
            }
            if ("/".equals(symbol) && prev != null && prev.type() == TokenType.NUMBER && next.type() == TokenType.NUMBER
                    && !isInChain(tokens, i) && mergeFraction(tokens, i)) {
                return;
            }
        }

        token.rewrite(MathVocabulary.OPERATORS.get(symbol), TokenType.WORD);
        token.addTag(Tag.MATH_TERM);
    }

    /**
     * Both neighbours are numbers and nothing on either side continues an expression.
     */
    private boolean isRange(List<Token> tokens, int i) {
        return TokenLists.isNumeric(TokenLists.previous(tokens, i))
                && TokenLists.isNumeric(TokenLists.next(tokens, i))
                && !isInChain(tokens, i);
    }

    private boolean isInChain(List<Token> tokens, int i) {
        int p = TokenLists.previousIndex(tokens, i);
        int n = TokenLists.nextIndex(tokens, i);
        Token prevPrev = p < 0 ? null : TokenLists.previous(tokens, p);
        Token nextNext = n < 0 ? null : TokenLists.next(tokens, n);
        return isActiveMath(prevPrev) || isActiveMath(nextNext);
    }

    /**
     * Rewrites "N / D" into a spoken fraction carried by the numerator token. A further number
     * before the numerator makes it a mixed number ("2 1/2").
     */
    private boolean mergeFraction(List<Token> tokens, int slashIndex) {
        int p = TokenLists.previousIndex(tokens, slashIndex);
        int n = TokenLists.nextIndex(tokens, slashIndex);
        Token numerator = tokens.get(p);
        Token slash = tokens.get(slashIndex);
        Token denominator = tokens.get(n);
        if (!numerator.whitespaceAfter().isEmpty() || !slash.whitespaceAfter().isEmpty()) {
            return false;
        }
        int num;
        int den;
        try {
            num = Integer.parseInt(KurdishNumberSpeller.toAsciiDigits(numerator.text()).replace(",", ""));
            den = Integer.parseInt(KurdishNumberSpeller.toAsciiDigits(denominator.text()).replace(",", ""));
        } catch (NumberFormatException e) {
            LOG.debug("Not a simple fraction: {}/{}", numerator.text(), denominator.text());
            return false;
        }
        boolean mixed = TokenLists.isNumeric(TokenLists.previous(tokens, p));
        numerator.rewrite(formatFraction(num, den, mixed), TokenType.WORD);
        numerator.addTag(Tag.FRACTION);
        numerator.absorb(slash);
        numerator.absorb(denominator);
        return true;
    }

    static String formatFraction(int num, int den, boolean mixed) {
        if (num == 1 && den == 2) return mixed ? "و نیو" : "نیوە";
        if (num == 1 && den == 4) return mixed ? "و چارەک" : "چارەک";
        String plain = KurdishNumberSpeller.spell(num) + " لەسەر " + KurdishNumberSpeller.spell(den);
        return mixed ? "و " + plain : plain;
    }

    private boolean isOperatorContext(Token prev, Token next) {
        boolean prevValid = prev == null
                || isOperatorOrBracket(prev)
                || isMathy(prev);
        boolean nextValid = next != null
                && (isMathy(next) || MathVocabulary.OPEN_BRACKETS.contains(next.originalText())
                || "√".equals(next.originalText()) || MINUS_SIGNS.contains(next.originalText()));
        return prevValid && nextValid;
    }

    /**
     * A bracket is spoken when an operator, function or math term sits within two tokens on its
     * inner or outer side, so that "(1990)" stays literal while "(5 + 3)" and "sin(x)" are read.
     */
    private boolean isBracketContext(List<Token> tokens, int i) {
        int p = TokenLists.previousIndex(tokens, i);
        int n = TokenLists.nextIndex(tokens, i);
        Token prev = p < 0 ? null : tokens.get(p);
        Token next = n < 0 ? null : tokens.get(n);
        Token prevPrev = p < 0 ? null : TokenLists.previous(tokens, p);
        Token nextNext = n < 0 ? null : TokenLists.next(tokens, n);
        for (Token t : new Token[]{prev, next, prevPrev, nextNext}) {
            if (t != null && (isActiveMath(t) && !MathVocabulary.isBracket(t.originalText()))) {
                return true;
            }
        }
        return false;
    }

    private boolean isMathy(Token t) {
        if (t == null) return false;
        if (TokenLists.isNumeric(t)) return true;
        if (t.hasTag(Tag.MATH_TERM) || t.hasTag(Tag.MATH_FUNCTION) || t.hasTag(Tag.FRACTION)) return true;
        if (t.type() == TokenType.SUPERSCRIPT || t.type() == TokenType.SUBSCRIPT) return true;
        if (t.type() == TokenType.WORD && !t.isConverted() && MathVocabulary.function(t.text()) != null) return true;
        return t.type() == TokenType.WORD && t.text().length() == 1 && LetterNames.isLatin(t.text().charAt(0))
                && !t.hasTag(Tag.IS_UNIT);
    }

    private boolean isActiveMath(Token t) {
        if (t == null) return false;
        if (t.hasTag(Tag.MATH_TERM) || t.hasTag(Tag.MATH_FUNCTION)) return true;
        return t.type() == TokenType.SYMBOL && (MathVocabulary.isOperator(t.text()) || MathVocabulary.isBracket(t.text()));
    }

    private boolean isOperatorOrBracket(Token t) {
        String s = t.originalText();
        boolean symbolic = t.type() == TokenType.SYMBOL || t.hasTag(Tag.MATH_TERM);
        return symbolic && (MathVocabulary.isOperator(s) || MathVocabulary.isBracket(s) || "{".equals(s) || ",".equals(s));
    }

    private boolean isProseWord(Token t) {
        return t.type() == TokenType.WORD && t.text().length() > 1
                && !t.hasTag(Tag.MATH_TERM) && !t.hasTag(Tag.MATH_FUNCTION) && !t.hasTag(Tag.IS_UNIT);
    }

    private static boolean isUnit(Token t) {
        return t != null && (t.hasTag(Tag.IS_UNIT) || t.hasTag(Tag.UNIT_PROCESSED));
    }

    private static String scriptDigits(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '¹' -> sb.append('1');
                case '²' -> sb.append('2');
                case '³' -> sb.append('3');
                default -> {
                    if (c >= '⁰' && c <= '⁹') sb.append((char) ('0' + (c - '⁰')));
                    else if (c >= '₀' && c <= '₉') sb.append((char) ('0' + (c - '₀')));
                }
            }
        }
        return sb.toString();
    }
}
