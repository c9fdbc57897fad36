package org.ckbtextify.modules.phone;

import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.text.KurdishNumberSpeller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads PHONE tokens in digit groups, each group as a cardinal with its leading zeros spoken.
 * <p>
 * Local mobile numbers (0750 123 45 67) are grouped 4-3-2-2. International numbers read "plus",
 * the country code as one cardinal, then the ten-digit subscriber part grouped 3-3-2-2.
 */
public class PhoneNormalizer implements INormalizationModule {

    private static final Logger LOG = LoggerFactory.getLogger(PhoneNormalizer.class);

    static final String PLUS = "کۆ";
    private static final int[] LOCAL_GROUPS = {4, 3, 2, 2};
    private static final int[] SUBSCRIBER_GROUPS = {3, 3, 2, 2};
    private static final int SUBSCRIBER_LENGTH = 10;

    @Override
    public String name() {
        return "PhoneNormalizer";
    }

    @Override
    public int priority() {
        return 98;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.type() != TokenType.PHONE || token.isConverted() || token.isTombstone()) {
                continue;
            }
            String spoken = speak(token.text());
            if (spoken == null) {
                LOG.debug("Phone number '{}' fits no known layout, reading it digit by digit", token.text());
                spoken = speakDigits(token.text());
            }
            token.rewrite(spoken, TokenType.WORD);
        }
        return tokens;
    }

    /**
     * @param text A phone number as lexed, e.g. "+964 770 123 4567".
     * @return The spoken number, or {@code null} if the digit count does not fit a known layout.
     */
    String speak(String text) {
        String ascii = KurdishNumberSpeller.toAsciiDigits(text);
        boolean international = ascii.startsWith("+");
        String digits = ascii.replaceAll("[^0-9]", "");

        List<String> parts = new ArrayList<>();
        if (international) {
            int ccLength = digits.length() - SUBSCRIBER_LENGTH;
            if (ccLength < 1 || ccLength > 4) {
                return null;
            }
            parts.add(PLUS);
            parts.add(KurdishNumberSpeller.spell(Long.parseLong(digits.substring(0, ccLength))));
            parts.addAll(groups(digits.substring(ccLength), SUBSCRIBER_GROUPS));
        } else {
            if (digits.length() != 11) {
                return null;
            }
            parts.addAll(groups(digits, LOCAL_GROUPS));
        }
        return String.join(" ", parts);
    }

    /**
     * Fallback for numbers of unusual length: the plus sign, then every digit on its own.
     */
    static String speakDigits(String text) {
        String ascii = KurdishNumberSpeller.toAsciiDigits(text);
        String digits = KurdishNumberSpeller.spellDigits(ascii.replaceAll("[^0-9]", ""));
        return ascii.startsWith("+") ? PLUS + " " + digits : digits;
    }

    private static List<String> groups(String digits, int[] sizes) {
        List<String> spoken = new ArrayList<>();
        int at = 0;
        for (int size : sizes) {
            spoken.add(KurdishNumberSpeller.spellKeepingZeros(digits.substring(at, at + size)));
            at += size;
        }
        return spoken;
    }
}
