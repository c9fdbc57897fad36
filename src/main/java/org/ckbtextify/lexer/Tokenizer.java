package org.ckbtextify.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Tokenizer (also known as Lexer or Scanner) converts raw mixed-script text into an ordered
 * sequence of {@link Token}s and back.
 * <p>
 * Rigid patterns are tried first (URL, e-mail, phone, date, time, number, hashtag/mention,
 * sub-/superscript runs) so that generic rules cannot swallow structured forms; everything else
 * falls through to WORD or SYMBOL, so tokenization never fails.
 * <p>
 * Every token carries the verbatim whitespace that followed it. For input that does not start
 * with whitespace, {@code detokenize(tokenize(text))} reproduces the input exactly.
 * The tokenizer holds no per-call state and can be shared.
 */
public class Tokenizer {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern URL = Pattern.compile(
            "(?:(?:https?://|www\\.)\\S+?"
                    + "|[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.(?:com|net|org|io|krd|iq|edu|gov|info)(?:/\\S*?)?)"
                    + "(?=[.,!?;:)\\]]*(?:\\s|$))", FLAGS);
    private static final Pattern EMAIL = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile(
            "(?<![0-9+])(?:\\+[0-9]{1,3}[ -]?[0-9]{3}[ -]?[0-9]{3}[ -]?[0-9]{4}"
                    + "|\\+[0-9]{10,14}"
                    + "|07[0-9]{2}[ -]?[0-9]{3}[ -]?[0-9]{2}[ -]?[0-9]{2})(?![0-9])");
    private static final Pattern DATE = Pattern.compile("\\d{1,4}([/.\\-])\\d{1,2}\\1\\d{1,4}(?!\\d)", FLAGS);
    private static final Pattern TIME = Pattern.compile(
            "\\d{1,2}:\\d{2}(?!\\d)(?:[aApP]\\.?[mM]\\.?(?![A-Za-z]))?", FLAGS);
    private static final Pattern NUMBER = Pattern.compile(
            "\\d{1,3}(?:,\\d{3})+(?:[.\u066B]\\d+)?(?!\\d)"
                    + "|\\d+(?:[.\u066B]\\d+)?(?:[eE][+-]?\\d+)?", FLAGS);
    private static final Pattern TECHNICAL = Pattern.compile("[#@][\\p{L}\\p{Nd}_]+", FLAGS);
    private static final Pattern SUPERSCRIPT = Pattern.compile("[\u2070\u00B9\u00B2\u00B3\u2074-\u2079]+");
    private static final Pattern SUBSCRIPT = Pattern.compile("[\u2080-\u2089]+");
    private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}\\p{M}\\p{Nd}_\u200C\u200D]*", FLAGS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", FLAGS);

    private record Rule(Pattern pattern, TokenType type) {
    }

    // Order matters: rigid patterns first, generic word last.
    private static final List<Rule> RULES = List.of(
            new Rule(URL, TokenType.URL),
            new Rule(EMAIL, TokenType.EMAIL),
            new Rule(PHONE, TokenType.PHONE),
            new Rule(DATE, TokenType.DATE),
            new Rule(TIME, TokenType.TIME),
            new Rule(NUMBER, TokenType.NUMBER),
            new Rule(TECHNICAL, TokenType.TECHNICAL),
            new Rule(SUPERSCRIPT, TokenType.SUPERSCRIPT),
            new Rule(SUBSCRIPT, TokenType.SUBSCRIPT),
            new Rule(WORD, TokenType.WORD)
    );

    /**
     * Performs the tokenization of the given text.
     * @param text The raw input.
     * @return A mutable list of the recognized tokens, in source order.
     */
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int current = skipWhitespace(text, 0);
        while (current < text.length()) {
            int start = current;
            TokenType type = null;
            for (Rule rule : RULES) {
                Matcher m = rule.pattern().matcher(text);
                m.region(start, text.length());
                m.useTransparentBounds(true);
                m.useAnchoringBounds(false);
                if (m.lookingAt() && m.end() > start) {
                    type = rule.type();
                    current = m.end();
                    break;
                }
            }
            if (type == null) {
                // Fallback: a single code point, so surrogate pairs (emoji) stay whole.
                type = TokenType.SYMBOL;
                current = start + Character.charCount(text.codePointAt(start));
            }
            int wsEnd = skipWhitespace(text, current);
            String slice = text.substring(start, current);
            tokens.add(new Token(slice, slice, type, text.substring(current, wsEnd)));
            current = wsEnd;
        }
        return tokens;
    }

    /**
     * Reassembles text from tokens by concatenating every token's text and trailing whitespace.
     * @param tokens The tokens to join.
     * @return The reassembled text.
     */
    public String detokenize(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.text()).append(token.whitespaceAfter());
        }
        return sb.toString();
    }

    private int skipWhitespace(String text, int from) {
        Matcher m = WHITESPACE.matcher(text);
        m.region(from, text.length());
        return m.lookingAt() ? m.end() : from;
    }
}
