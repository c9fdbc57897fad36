package org.ckbtextify.modules.numbers;

import org.ckbtextify.api.NormalizationConfig;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.KurdishNumberSpeller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Spells NUMBER tokens as Kurdish words: cardinals, decimals with the "point" reading, the
 * "and a half" idiom, digit-by-digit identifiers and scientific notation.
 * <p>
 * A sign glued to the front of a number in unary position ("-5", "(+3") is merged into the
 * number and its token is consumed.
 */
public class NumberNormalizer implements INormalizationModule {

    private static final Logger LOG = LoggerFactory.getLogger(NumberNormalizer.class);

    static final String POINT = "پۆینت";
    static final String HALF = "و نیو";
    static final String TIMES_TEN_TO_THE = "کەڕەتی دە توانی";

    private static final Set<String> MINUS_SIGNS = Set.of("-", "−");

    private final BigDecimal lowerBound;
    private final BigDecimal upperBound;

    public NumberNormalizer(NormalizationConfig config) {
        this.lowerBound = config.scientificLowerBound();
        this.upperBound = config.scientificUpperBound();
    }

    @Override
    public String name() {
        return "NumberNormalizer";
    }

    @Override
    public int priority() {
        return 60;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.NUMBER || token.isConverted() || token.isTombstone()) {
                continue;
            }
            String spoken = speak(token.text());
            if (spoken == null) {
                LOG.debug("Leaving unparseable number '{}' unchanged", token.text());
                continue;
            }

            int signIndex = TokenLists.previousIndex(tokens, i);
            if (signIndex >= 0 && isUnarySign(tokens, signIndex)) {
                Token sign = tokens.get(signIndex);
                String word = MINUS_SIGNS.contains(sign.text()) ? KurdishNumberSpeller.MINUS : KurdishNumberSpeller.PLUS;
                spoken = word + " " + spoken;
                sign.tombstone();
            }
            token.rewrite(spoken, TokenType.WORD);
        }
        return TokenLists.compact(tokens);
    }

    private boolean isUnarySign(List<Token> tokens, int signIndex) {
        Token sign = tokens.get(signIndex);
        if (sign.type() != TokenType.SYMBOL || sign.isConverted() || !sign.whitespaceAfter().isEmpty()) {
            return false;
        }
        if (!MINUS_SIGNS.contains(sign.text()) && !"+".equals(sign.text())) {
            return false;
        }
        return TokenLists.isUnaryPosition(tokens, signIndex);
    }

    /**
     * Produces the spoken form of a numeric literal.
     *
     * @param literal The literal as lexed, e.g. "1,250.75" or "٣٫٥".
     * @return The Kurdish reading, or {@code null} if the literal cannot be parsed.
     */
    public String speak(String literal) {
        String raw = KurdishNumberSpeller.toAsciiDigits(literal).replace(",", "");
        try {
            BigDecimal value = new BigDecimal(raw);
            int e = raw.toLowerCase(Locale.ROOT).indexOf('e');
            if (e >= 0) {
                return scientific(raw.substring(0, e), new BigInteger(raw.substring(e + 1)));
            }
            BigDecimal abs = value.abs();
            if (abs.signum() != 0 && (abs.compareTo(lowerBound) < 0 || abs.compareTo(upperBound) >= 0)) {
                int exponent = abs.precision() - abs.scale() - 1;
                BigDecimal mantissa = value.movePointLeft(exponent).stripTrailingZeros();
                return scientific(mantissa.toPlainString(), BigInteger.valueOf(exponent));
            }
            return plain(raw);
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
    }

    private String scientific(String mantissa, BigInteger exponent) {
        return plain(mantissa) + " " + TIMES_TEN_TO_THE + " " + KurdishNumberSpeller.spell(exponent);
    }

    private String plain(String raw) {
        String sign = "";
        String digits = raw;
        if (digits.startsWith("-")) {
            sign = KurdishNumberSpeller.MINUS + " ";
            digits = digits.substring(1);
        } else if (digits.startsWith("+")) {
            digits = digits.substring(1);
        }
        int dot = digits.indexOf('.');
        String intPart = dot < 0 ? digits : digits.substring(0, dot);
        String fracPart = dot < 0 ? "" : digits.substring(dot + 1);
        if (intPart.isEmpty()) {
            intPart = "0";
        }

        String intWords = intPart.length() > 1 && intPart.charAt(0) == '0'
                ? KurdishNumberSpeller.spellDigits(intPart)
                : KurdishNumberSpeller.spell(new BigInteger(intPart));
        if (fracPart.isEmpty()) {
            return sign + intWords;
        }
        if (intPart.length() == 1 && intPart.charAt(0) != '0' && "5".equals(fracPart)) {
            return sign + intWords + " " + HALF;
        }
        return sign + intWords + " " + POINT + " " + KurdishNumberSpeller.spellKeepingZeros(fracPart);
    }
}
