package com.newswatch.backend.scraper.extract;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts site date text such as "Senin, 06 Okt 2025 14:30 WIB" or "2025-10-06T14:30:00+07:00"
 * into a calendar date. Time of day and zone are ignored.
 */
public class PublishDateParser {

    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("(\\d{1,2})\\s+(\\p{L}+)\\.?,?\\s+(\\d{4})");
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile("(\\p{L}+)\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})");
    private static final Pattern NUMERIC_DATE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");

    private static final Map<String, Integer> ENGLISH_MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12));

    private static final Map<String, Integer> INDONESIAN_MONTHS = Map.ofEntries(
            Map.entry("januari", 1),
            Map.entry("februari", 2), Map.entry("peb", 2), Map.entry("pebruari", 2),
            Map.entry("maret", 3),
            Map.entry("mei", 5),
            Map.entry("juni", 6),
            Map.entry("juli", 7),
            Map.entry("agu", 8), Map.entry("agt", 8), Map.entry("agust", 8), Map.entry("agustus", 8),
            Map.entry("okt", 10), Map.entry("oktober", 10),
            Map.entry("nop", 11), Map.entry("nopember", 11),
            Map.entry("des", 12), Map.entry("desember", 12));

    private final Map<String, Integer> monthNames;

    public PublishDateParser(Map<String, Integer> monthNames) {
        this.monthNames = Map.copyOf(monthNames);
    }

    public static PublishDateParser english() {
        return new PublishDateParser(ENGLISH_MONTHS);
    }

    /**
     * Indonesian month names, with English names accepted as well
     */
    public static PublishDateParser indonesian() {
        Map<String, Integer> months = new HashMap<>(ENGLISH_MONTHS);
        months.putAll(INDONESIAN_MONTHS);
        return new PublishDateParser(months);
    }

    public LocalDate parse(String text) throws DateParseException {
        if (text == null || text.isBlank()) {
            throw new DateParseException(String.valueOf(text));
        }
        try {
            Matcher iso = ISO_DATE.matcher(text);
            if (iso.find()) {
                return LocalDate.of(toInt(iso.group(1)), toInt(iso.group(2)), toInt(iso.group(3)));
            }

            Matcher dayFirst = DAY_MONTH_YEAR.matcher(text);
            while (dayFirst.find()) {
                Integer month = month(dayFirst.group(2));
                if (month != null) {
                    return LocalDate.of(toInt(dayFirst.group(3)), month, toInt(dayFirst.group(1)));
                }
            }

            Matcher monthFirst = MONTH_DAY_YEAR.matcher(text);
            while (monthFirst.find()) {
                Integer month = month(monthFirst.group(1));
                if (month != null) {
                    return LocalDate.of(toInt(monthFirst.group(3)), month, toInt(monthFirst.group(2)));
                }
            }

            Matcher numeric = NUMERIC_DATE.matcher(text);
            if (numeric.find()) {
                return LocalDate.of(toInt(numeric.group(3)), toInt(numeric.group(2)), toInt(numeric.group(1)));
            }
        } catch (DateTimeException e) {
            throw new DateParseException(text, e);
        }
        throw new DateParseException(text);
    }

    private Integer month(String name) {
        return monthNames.get(name.toLowerCase(Locale.ROOT));
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
