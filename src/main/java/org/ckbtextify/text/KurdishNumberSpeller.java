package org.ckbtextify.text;

import java.math.BigInteger;

/**
 * Table-driven Sorani numeral grammar: cardinals through recursive base-1000 grouping, and
 * digit-by-digit readings for identifier-like digit strings.
 */
public final class KurdishNumberSpeller {

    /** The conjunction placed between numeral parts. */
    public static final String AND = " و ";
    public static final String ZERO = "سفر";
    public static final String MINUS = "سالب";
    public static final String PLUS = "موجەب";

    private static final String[] ONES = {
            ZERO, "یەک", "دوو", "سێ", "چوار", "پێنج", "شەش", "حەوت", "ھەشت", "نۆ"
    };
    private static final String[] TEENS = {
            "دە", "یازدە", "دوازدە", "سێزدە", "چواردە", "پازدە", "شازدە", "حەڤدە", "ھەژدە", "نۆزدە"
    };
    private static final String[] TENS = {
            "", "", "بیست", "سی", "چل", "پەنجا", "شەست", "حەفتا", "ھەشتا", "نەوەد"
    };
    private static final String HUNDRED = "سەد";
    private static final String THOUSAND = "ھەزار";
    // Index i names 1000^i.
    private static final String[] SCALES = {
            "", THOUSAND, "ملیۆن", "ملیار", "ترلیۆن", "کوادرلیۆن", "کوینتلیۆن", "سێکستلیۆن", "سێپتلیۆن"
    };
    private static final BigInteger THOUSAND_BI = BigInteger.valueOf(1000);

    private KurdishNumberSpeller() {}

    /**
     * Spells an integer as a Kurdish cardinal.
     * @param n The value.
     * @return The cardinal, e.g. 123 as "سەد و بیست و سێ".
     */
    public static String spell(long n) {
        return spell(BigInteger.valueOf(n));
    }

    /**
     * Spells an arbitrarily large integer as a Kurdish cardinal. Values beyond the largest scale
     * word are read digit by digit.
     * @param n The value.
     * @return The cardinal.
     */
    public static String spell(BigInteger n) {
        if (n.signum() < 0) {
            return MINUS + " " + spell(n.negate());
        }
        if (n.signum() == 0) {
            return ZERO;
        }
        int scale = (n.toString().length() - 1) / 3;
        if (scale >= SCALES.length) {
            return spellDigits(n.toString());
        }
        return spellPositive(n, scale);
    }

    private static String spellPositive(BigInteger n, int scale) {
        if (scale == 0) {
            return belowThousand(n.intValue());
        }
        BigInteger unit = THOUSAND_BI.pow(scale);
        BigInteger[] qr = n.divideAndRemainder(unit);
        int head = qr[0].intValue();
        BigInteger rest = qr[1];

        StringBuilder sb = new StringBuilder();
        if (head > 0) {
            if (scale == 1 && head == 1) {
                sb.append(THOUSAND);
            } else {
                sb.append(belowThousand(head)).append(' ').append(SCALES[scale]);
            }
        }
        if (rest.signum() > 0) {
            if (sb.length() > 0) sb.append(AND);
            sb.append(spellPositive(rest, scale - 1));
        }
        return sb.toString();
    }

    private static String belowThousand(int n) {
        int hundreds = n / 100;
        int rest = n % 100;
        StringBuilder sb = new StringBuilder();
        if (hundreds > 0) {
            sb.append(hundreds == 1 ? HUNDRED : ONES[hundreds] + " " + HUNDRED);
        }
        if (rest > 0) {
            if (sb.length() > 0) sb.append(AND);
            sb.append(belowHundred(rest));
        }
        return sb.toString();
    }

    private static String belowHundred(int n) {
        if (n < 10) return ONES[n];
        if (n < 20) return TEENS[n - 10];
        String tens = TENS[n / 10];
        return n % 10 == 0 ? tens : tens + AND + ONES[n % 10];
    }

    /**
     * Reads each digit on its own: "0025" becomes "سفر سفر دوو پێنج".
     * @param digits ASCII digits.
     * @return The digit names joined by spaces.
     */
    public static String spellDigits(String digits) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < digits.length(); i++) {
            int d = Character.digit(digits.charAt(i), 10);
            if (d < 0) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(ONES[d]);
        }
        return sb.toString();
    }

    /**
     * Reads leading zeros one by one and the remainder as a cardinal: "0750" becomes
     * "سفر حەوت سەد و پەنجا". A string of zeros only is read digit by digit.
     * @param digits ASCII digits.
     * @return The reading.
     */
    public static String spellKeepingZeros(String digits) {
        int firstNonZero = 0;
        while (firstNonZero < digits.length() && digits.charAt(firstNonZero) == '0') firstNonZero++;
        if (firstNonZero == digits.length()) {
            return spellDigits(digits);
        }
        String cardinal = spell(new BigInteger(digits.substring(firstNonZero)));
        if (firstNonZero == 0) return cardinal;
        return spellDigits(digits.substring(0, firstNonZero)) + " " + cardinal;
    }

    /**
     * Maps every Unicode decimal digit (Arabic-Indic, Extended Arabic-Indic, ...) to ASCII and the
     * Arabic decimal separator to a dot. Other characters are kept.
     * @param text The text to convert.
     * @return The text with ASCII digits.
     */
    public static String toAsciiDigits(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '٫') {
                sb.append('.');
            } else if (Character.isDigit(c)) {
                sb.append((char) ('0' + Character.digit(c, 10)));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
