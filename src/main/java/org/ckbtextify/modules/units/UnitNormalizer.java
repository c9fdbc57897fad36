package org.ckbtextify.modules.units;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.KurdishNumberSpeller;
import org.ckbtextify.text.SuffixJoiner;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders tagged units in Kurdish.
 * <ul>
 *   <li>"10 km" reads the unit name; the number is left to the number normalizer.</li>
 *   <li>"km/h" reads "per one hour": "کیلۆمەتر بۆ ھەر کاتژمێرێک".</li>
 *   <li>"m²" and "m³" read "square" and "cubic".</li>
 *   <li>"2.5 km" moves the half onto the unit: "دوو کیلۆمەتر و نیو".</li>
 *   <li>"30°C" reads the temperature scale and drops the degree sign.</li>
 * </ul>
 */
public class UnitNormalizer implements INormalizationModule {

    private static final Map<String, String> POWERS = Map.of("²", "ی دووجا", "³", "ی سێجا");
    private static final Pattern HALF = Pattern.compile("([1-9])[.٫]5");
    private static final String PER = "بۆ ھەر";

    @Override
    public String name() {
        return "UnitNormalizer";
    }

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token unit = tokens.get(i);
            if (!unit.hasTag(Tag.IS_UNIT) || unit.hasTag(Tag.UNIT_PROCESSED) || unit.isTombstone()) {
                continue;
            }
            int p = TokenLists.previousIndex(tokens, i);
            Token prev = p < 0 ? null : tokens.get(p);

            String name;
            if (prev != null && "°".equals(prev.text())) {
                name = UnitCatalog.temperatureName(unit.text());
                prev.tombstone();
                prev = TokenLists.previous(tokens, p);
            } else {
                name = UnitCatalog.kurdishName(unit.text());
            }
            if (name == null) {
                continue;
            }

            if (prev != null && "/".equals(prev.text()) && !prev.isConverted()) {
                // Denominator of a ratio.
                prev.tombstone();
                name = PER + " " + indefinite(name);
            }

            Token power = TokenLists.next(tokens, i);
            if (power != null && power.type() == TokenType.SUPERSCRIPT && POWERS.containsKey(power.text())
                    && unit.whitespaceAfter().isEmpty()) {
                name = name + POWERS.get(power.text());
                unit.absorb(power);
            }

            if (prev != null && prev.type() == TokenType.NUMBER && !prev.isConverted()) {
                Matcher half = HALF.matcher(KurdishNumberSpeller.toAsciiDigits(prev.text()));
                if (half.matches()) {
                    prev.setText(half.group(1));
                    name = name + " و نیو";
                }
            }

            unit.rewrite(name, TokenType.WORD);
            unit.addTag(Tag.UNIT_PROCESSED);
        }
        return TokenLists.compact(tokens);
    }

    private static String indefinite(String name) {
        return SuffixJoiner.endsWithVowel(name) ? name + "یەک" : name + "ێک";
    }
}
