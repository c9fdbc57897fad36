package org.ckbtextify.modules.datetime;

import org.ckbtextify.lexer.Tag;
import org.ckbtextify.lexer.Token;
import org.ckbtextify.lexer.TokenType;
import org.ckbtextify.pipeline.INormalizationModule;
import org.ckbtextify.pipeline.TokenLists;
import org.ckbtextify.text.KurdishNumberSpeller;
import org.ckbtextify.text.SuffixJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders DATE and TIME tokens as spoken Kurdish.
 * <p>
 * Dates resolve their field order from the field widths and values. Times look ahead up to three
 * tokens for an AM/PM or Kurdish day-period marker, optionally followed by a grammatical suffix;
 * the matched tokens are consumed and the suffix is re-attached to the rendered time.
 */
public class DateTimeNormalizer implements INormalizationModule {

    private static final Logger LOG = LoggerFactory.getLogger(DateTimeNormalizer.class);

    private static final Map<Integer, String> MONTHS = Map.ofEntries(
            Map.entry(1, "کانونی دووەم"), Map.entry(2, "شوبات"), Map.entry(3, "ئازار"),
            Map.entry(4, "نیسان"), Map.entry(5, "ئایار"), Map.entry(6, "حوزەیران"),
            Map.entry(7, "تەمموز"), Map.entry(8, "ئاب"), Map.entry(9, "ئەیلوول"),
            Map.entry(10, "تشرینی یەکەم"), Map.entry(11, "تشرینی دووەم"), Map.entry(12, "کانونی یەکەم"));

    private static final List<String> AM_MARKERS = List.of("AM", "A.M.", "پ.ن", "بەیانی", "پێش نیوەڕۆ", "پێشنیوەڕۆ");
    private static final List<String> PM_MARKERS = List.of(
            "PM", "P.M.", "د.ن",
            "دوای نیوەڕۆ", "دوای نیوەرۆ", "دوا نیوەڕۆ",
            "پاش نیوەڕۆ", "پاش نیوەرۆ", "پاشنیوەڕۆ",
            "ئێوارە", "عەسر", "نیوەڕۆ");
    private static final String NIGHT_MARKER = "شەو";

    private static final Pattern DATE_SEPARATOR = Pattern.compile("[/\\-.]");
    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2})\\s*([A-Za-z.]*)");

    private static final int MAX_LOOKAHEAD = 3;

    enum Period { NONE, AM, PM, NIGHT }

    private record Marker(String text, Period period) {
    }

    // Longest marker first, so "پێش نیوەڕۆ" wins over "نیوەڕۆ".
    private static final List<Marker> MARKERS = buildMarkers();

    private static List<Marker> buildMarkers() {
        List<Marker> markers = new ArrayList<>();
        AM_MARKERS.forEach(m -> markers.add(new Marker(m, Period.AM)));
        PM_MARKERS.forEach(m -> markers.add(new Marker(m, Period.PM)));
        markers.add(new Marker(NIGHT_MARKER, Period.NIGHT));
        markers.sort((a, b) -> Integer.compare(compactForm(b.text()).length(), compactForm(a.text()).length()));
        return List.copyOf(markers);
    }

    @Override
    public String name() {
        return "DateTimeNormalizer";
    }

    @Override
    public int priority() {
        return 95;
    }

    @Override
    public List<Token> process(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTombstone() || token.isConverted()) {
                continue;
            }
            if (token.type() == TokenType.DATE) {
                String spoken = convertDate(token.text());
                if (spoken != null) {
                    token.rewrite(spoken, TokenType.WORD);
                    token.addTag(Tag.DATE);
                } else {
                    LOG.debug("Leaving unrecognised date '{}' unchanged", token.text());
                }
            } else if (token.type() == TokenType.TIME) {
                convertTime(tokens, i);
            }
        }
        return TokenLists.compact(tokens);
    }

    /**
     * Renders a date literal.
     * <p>
     * A 4-digit first field is the year (year-month-day). Otherwise a 4-digit last field is the
     * year, and of the two remaining fields the one above 12 is the day; if neither is, the order
     * is day-month.
     *
     * @param text The date literal, e.g. "2025/12/03" or "03-12-2025".
     * @return The spoken date, or {@code null} if the shape or values are not a valid date.
     */
    String convertDate(String text) {
        String[] parts = DATE_SEPARATOR.split(KurdishNumberSpeller.toAsciiDigits(text));
        if (parts.length != 3) {
            return null;
        }
        int day;
        int month;
        int year;
        try {
            int a = Integer.parseInt(parts[0]);
            int b = Integer.parseInt(parts[1]);
            int c = Integer.parseInt(parts[2]);
            if (parts[0].length() == 4) {
                year = a;
                month = b;
                day = c;
            } else if (parts[2].length() == 4) {
                year = c;
                if (b > 12 && a <= 12) {
                    month = a;
                    day = b;
                } else {
                    day = a;
                    month = b;
                }
            } else {
                return null;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        if (month < 1 || month > 12 || day < 1 || day > 31) {
            return null;
        }
        return KurdishNumberSpeller.spell(day) + "ی " + MONTHS.get(month) + "ی ساڵی " + KurdishNumberSpeller.spell(year);
    }

    private void convertTime(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        Matcher m = CLOCK.matcher(KurdishNumberSpeller.toAsciiDigits(token.text()));
        if (!m.matches()) {
            LOG.debug("Leaving unrecognised time '{}' unchanged", token.text());
            return;
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));

        Period period = Period.NONE;
        String grammaticalSuffix = "";
        String attached = m.group(3);
        if (!attached.isEmpty()) {
            period = periodOf(attached);
        }
        if (period == Period.NONE) {
            SuffixMatch match = findSuffix(tokens, index);
            if (match != null) {
                period = match.period();
                grammaticalSuffix = match.grammaticalSuffix();
                for (int j : match.consumed()) {
                    token.absorb(tokens.get(j));
                }
            }
        }

        String spoken = renderTime(hour, minute, period);
        token.rewrite(SuffixJoiner.join(spoken, grammaticalSuffix), TokenType.WORD);
        token.addTag(Tag.TIME);
    }

    private record SuffixMatch(Period period, String grammaticalSuffix, List<Integer> consumed) {
    }

    /**
     * Searches the next one to three live tokens, longest window first, for a period marker
     * optionally followed by exactly one known grammatical suffix.
     */
    private SuffixMatch findSuffix(List<Token> tokens, int index) {
        List<Integer> window = new ArrayList<>();
        int j = index;
        while (window.size() < MAX_LOOKAHEAD && (j = TokenLists.nextIndex(tokens, j)) >= 0) {
            window.add(j);
        }
        for (int size = window.size(); size >= 1; size--) {
            StringBuilder phrase = new StringBuilder();
            for (int k = 0; k < size; k++) {
                phrase.append(tokens.get(window.get(k)).text());
            }
            String candidate = compactForm(phrase.toString());
            if (candidate.length() > 1 && (candidate.charAt(0) == 'ی' || candidate.charAt(0) == 'ي')) {
                candidate = candidate.substring(1);
            }
            String upper = candidate.toUpperCase(Locale.ROOT);
            for (Marker marker : MARKERS) {
                String markerForm = compactForm(marker.text()).toUpperCase(Locale.ROOT);
                if (!upper.startsWith(markerForm)) {
                    continue;
                }
                String remainder = candidate.substring(markerForm.length());
                if (!remainder.isEmpty() && !SuffixJoiner.isSuffix(remainder)) {
                    continue;
                }
                return new SuffixMatch(marker.period(), remainder, List.copyOf(window.subList(0, size)));
            }
        }
        return null;
    }

    private static String compactForm(String text) {
        return text.replace(" ", "").replace("\u0640", "").replace("\u200C", "");
    }

    private static Period periodOf(String marker) {
        String form = compactForm(marker).toUpperCase(Locale.ROOT);
        for (Marker m : MARKERS) {
            if (compactForm(m.text()).toUpperCase(Locale.ROOT).equals(form)) {
                return m.period();
            }
        }
        return Period.NONE;
    }

    /**
     * Builds the spoken time. Minutes overflow into hours; the night marker means AM for the
     * small hours (12, 1-4) and PM otherwise. The day-period word is used only when an AM/PM
     * signal exists or the hour is unambiguous (0 or above 12).
     */
    String renderTime(int hour, int minute, Period period) {
        hour += minute / 60;
        minute %= 60;

        if (period == Period.NIGHT) {
            period = (hour == 12 || (hour >= 1 && hour <= 4)) ? Period.AM : Period.PM;
        }
        int hour24 = hour;
        if (period == Period.PM && hour >= 1 && hour < 12) {
            hour24 = hour + 12;
        } else if (period == Period.AM && hour == 12) {
            hour24 = 0;
        }
        hour24 %= 24;

        int hour12 = hour24 % 12 == 0 ? 12 : hour24 % 12;
        String hourText = KurdishNumberSpeller.spell(hour12);
        String minuteText = KurdishNumberSpeller.spell(minute);

        boolean explicit = period != Period.NONE || hour > 12 || hour == 0;
        if (explicit) {
            String label = dayPeriod(hour24);
            if (minute == 0) return hourText + "ی " + label;
            if (minute == 30) return hourText + " و نیوی " + label;
            return hourText + " و " + minuteText + " خولەکی " + label;
        }
        if (minute == 0) return hourText;
        if (minute == 30) return hourText + " و نیو";
        return hourText + " و " + minuteText + " خولەک";
    }

    /**
     * @param hour24 The hour on a 24-hour clock.
     * @return The Kurdish day-period word for the hour.
     */
    static String dayPeriod(int hour24) {
        if (hour24 < 1) return "نیوەشەو";
        if (hour24 < 4) return "شەو";
        if (hour24 < 6) return "بەرەبەیان";
        if (hour24 < 10) return "بەیانی";
        if (hour24 < 12) return "پێش نیوەڕۆ";
        if (hour24 < 14) return "نیوەڕۆ";
        if (hour24 < 18) return "دوای نیوەڕۆ";
        if (hour24 < 21) return "ئێوارە";
        return "شەو";
    }
}
