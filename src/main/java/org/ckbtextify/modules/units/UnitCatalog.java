package org.ckbtextify.modules.units;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Measurement unit abbreviations and their Kurdish names.
 */
public final class UnitCatalog {

    private static final Map<String, String> UNITS = Map.ofEntries(
            Map.entry("m", "مەتر"), Map.entry("km", "کیلۆمەتر"), Map.entry("cm", "سانتیمەتر"),
            Map.entry("mm", "ملیمەتر"), Map.entry("g", "گرام"), Map.entry("kg", "کیلۆگرام"),
            Map.entry("mg", "ملیگرام"), Map.entry("l", "لیتر"), Map.entry("ml", "ملیلیتر"),
            Map.entry("s", "چرکە"), Map.entry("ms", "ملیچرکە"), Map.entry("min", "خولەک"),
            Map.entry("h", "کاتژمێر"), Map.entry("kb", "کیلۆبایت"), Map.entry("mb", "مێگابایت"),
            Map.entry("gb", "گیگابایت"), Map.entry("tb", "تێرابایت"), Map.entry("ft", "پێ"),
            Map.entry("yd", "یارد"), Map.entry("mi", "میل"), Map.entry("in", "ئینچ"),
            Map.entry("oz", "ئۆنس"), Map.entry("lb", "پاوەند"), Map.entry("v", "ڤۆڵت"),
            Map.entry("mv", "ملیڤۆڵت"), Map.entry("ma", "ملیئەمپێر"), Map.entry("w", "وات"),
            Map.entry("kw", "کیلۆوات"), Map.entry("mw", "مێگاوات"), Map.entry("wh", "وات کاتژمێر"),
            Map.entry("kwh", "کیلۆوات کاتژمێر"), Map.entry("hp", "ھێزی ئەسپ"), Map.entry("j", "جوڵ"),
            Map.entry("kj", "کیلۆجوڵ"), Map.entry("cal", "کالۆری"), Map.entry("kcal", "کیلۆکالۆری"),
            Map.entry("pa", "پاسکاڵ"), Map.entry("kpa", "کیلۆپاسکاڵ"), Map.entry("psi", "پی ئێس ئای"),
            Map.entry("n", "نیوتن"), Map.entry("kn", "کیلۆنیوتن"), Map.entry("gal", "گالۆن"),
            Map.entry("mph", "میل لە کاتژمێرێکدا"), Map.entry("hz", "ھێرتز"), Map.entry("khz", "کیلۆھێرتز"),
            Map.entry("mhz", "مێگاھێرتز"), Map.entry("ghz", "گیگاھێرتز"));

    private static final Map<String, String> TEMPERATURE = Map.of(
            "c", "پلەی سەدی", "f", "پلەی فەھرەنھایت", "k", "کێڵڤن");

    /** Units that are never read as algebraic variables. */
    public static final Set<String> STRICT = Set.of(
            "m", "g", "l", "s", "h", "kg", "km", "cm", "mm", "ml", "mg",
            "gb", "mb", "kb", "tb", "ft", "yd", "mi", "in", "oz", "lb",
            "v", "w", "j", "pa", "n", "wh", "kwh", "kw", "mw", "hp",
            "mv", "ma", "kn", "psi", "kpa", "cal", "kcal", "kj", "gal", "mph", "ms");

    private UnitCatalog() {}

    public static boolean isUnit(String text) {
        return UNITS.containsKey(text.toLowerCase(Locale.ROOT));
    }

    public static boolean isStrict(String text) {
        return STRICT.contains(text.toLowerCase(Locale.ROOT));
    }

    public static boolean isTemperatureScale(String text) {
        return TEMPERATURE.containsKey(text.toLowerCase(Locale.ROOT));
    }

    /**
     * @return The Kurdish name of the unit, or {@code null} if unknown.
     */
    public static String kurdishName(String text) {
        return UNITS.get(text.toLowerCase(Locale.ROOT));
    }

    /**
     * @return The Kurdish name of a temperature scale letter after a degree sign, or {@code null}.
     */
    public static String temperatureName(String text) {
        return TEMPERATURE.get(text.toLowerCase(Locale.ROOT));
    }
}
