package org.ckbtextify.modules.currency;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.KurdishNumberSpeller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Merges a currency symbol or code with its amount into one spoken token, reading the
 * fractional part in the minor unit ("$ 12.50" as twelve dollars and fifty cents).
 * <p>
 * Both prefix ("$50", "$ 50") and suffix ("100 $", "250 IQD") placements are recognised. A
 * symbol with no amount next to it is read as the currency name.
 */
public class CurrencyNormalizer implements INormalizationModule {

    private static final Logger LOG = LoggerFactory.getLogger(CurrencyNormalizer.class);

    // The Iraqi dinar abbreviation, lexed as three glued tokens.
    private static final String DINAR_ABBREVIATION = "د.ع";

    private record Currency(String major, String minor) {
    }

    private static final Map<String, Currency> CURRENCIES = Map.ofEntries(
            Map.entry("$", new Currency("دۆلار", "سەنت")),
            Map.entry("USD", new Currency("دۆلار", "سەنت")),
            Map.entry("€", new Currency("یۆرۆ", "سەنت")),
            Map.entry("EUR", new Currency("یۆرۆ", "سەنت")),
            Map.entry("£", new Currency("پاوەند", "پێنس")),
            Map.entry("GBP", new Currency("پاوەند", "پێنس")),
            Map.entry("¥", new Currency("یەن", null)),
            Map.entry("JPY", new Currency("یەن", null)),
            Map.entry("IQD", new Currency("دیناری عێراقی", "فلس")),
            Map.entry(DINAR_ABBREVIATION, new Currency("دیناری عێراقی", "فلس")),
            Map.entry("₺", new Currency("لیرەی تورکی", "قوروش")),
            Map.entry("TRY", new Currency("لیرەی تورکی", "قوروش")),
            Map.entry("﷼", new Currency("ڕیاڵ", null)),
            Map.entry("IRR", new Currency("ڕیاڵی ئێرانی", null)),
            Map.entry("SAR", new Currency("ڕیاڵی سعوودی", "ھەڵەڵە")),
            Map.entry("AED", new Currency("درھەمی ئیماراتی", "فلس")),
            Map.entry("KWD", new Currency("دیناری کوەیتی", "فلس")),
            Map.entry("AUD", new Currency("دۆلاری ئوسترالی", "سەنت")),
            Map.entry("CAD", new Currency("دۆلاری کەنەدی", "سەنت")));

    @Override
    public String name() {
        return "CurrencyNormalizer";
    }

    @Override
    public int priority() {
        return 75;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        mergeDinarAbbreviation(tokens);
        for (int i = 0; i < tokens.size(); i++) {
            Token symbol = tokens.get(i);
            if (symbol.isTombstone() || symbol.isConverted()) {
                continue;
            }
            Currency currency = CURRENCIES.get(symbol.text());
            if (currency == null) {
                continue;
            }
            int n = TokenLists.nextIndex(tokens, i);
            int p = TokenLists.previousIndex(tokens, i);
            if (isAmount(tokens, n) && convert(tokens.get(n), currency)) {
                symbol.tombstone();
            } else if (isAmount(tokens, p) && convert(tokens.get(p), currency)) {
                tokens.get(p).absorb(symbol);
            } else if (symbol.type() == TokenType.SYMBOL) {
                symbol.rewrite(currency.major(), TokenType.WORD);
                symbol.addTag(Tag.CURRENCY);
            }
        }
        return TokenLists.compact(tokens);
    }

    private static boolean convert(Token amount, Currency currency) {
        try {
            amount.rewrite(speak(amount.text(), currency), TokenType.WORD);
            amount.addTag(Tag.CURRENCY);
            return true;
        } catch (NumberFormatException e) {
            LOG.debug("Cannot read currency amount '{}': {}", amount.text(), e.getMessage());
            return false;
        }
    }

    private static void mergeDinarAbbreviation(List<Token> tokens) {
        for (int i = 0; i + 2 < tokens.size(); i++) {
            Token d = tokens.get(i);
            Token dot = tokens.get(i + 1);
            Token a = tokens.get(i + 2);
            if ("د".equals(d.text()) && ".".equals(dot.text()) && "ع".equals(a.text())
                    && d.whitespaceAfter().isEmpty() && dot.whitespaceAfter().isEmpty()) {
                Token merged = new Token(DINAR_ABBREVIATION, DINAR_ABBREVIATION, TokenType.SYMBOL, a.whitespaceAfter());
                tokens.set(i, merged);
                dot.tombstone();
                a.tombstone();
            }
        }
    }

    private static boolean isAmount(List<Token> tokens, int index) {
        if (index < 0) return false;
        Token t = tokens.get(index);
        return t.type() == TokenType.NUMBER && !t.isConverted();
    }

    /**
     * @param amount   The numeric literal, e.g. "1,250.75".
     * @param currency The currency names.
     * @return The spoken amount.
     */
    private static String speak(String amount, Currency currency) {
        String raw = KurdishNumberSpeller.toAsciiDigits(amount).replace(",", "");
        int dot = raw.indexOf('.');
        String intPart = dot < 0 ? raw : raw.substring(0, dot);
        String fracPart = dot < 0 ? "" : raw.substring(dot + 1);

        String major = KurdishNumberSpeller.spell(new BigInteger(intPart.isEmpty() ? "0" : intPart)) + " " + currency.major();
        if (fracPart.isEmpty() || fracPart.chars().allMatch(c -> c == '0')) {
            return major;
        }
        if (currency.minor() == null || fracPart.length() > 2) {
            return KurdishNumberSpeller.spell(new BigInteger(intPart.isEmpty() ? "0" : intPart))
                    + " پۆینت " + KurdishNumberSpeller.spellKeepingZeros(fracPart) + " " + currency.major();
        }
        String minorDigits = fracPart.length() == 1 ? fracPart + "0" : fracPart;
        return major + " و " + KurdishNumberSpeller.spell(Integer.parseInt(minorDigits)) + " " + currency.minor();
    }
}
