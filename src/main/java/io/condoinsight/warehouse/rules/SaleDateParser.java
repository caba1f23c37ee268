package io.condoinsight.warehouse.rules;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Buckets the sale dates found in URA exports to the first day of their month.
 *
 * <p>Accepted shapes: {@code Dec-20}, {@code Dec-2020}, {@code Oct 2023},
 * {@code October 2023}, {@code 15 Jan 2024}, {@code 15-Jan-24},
 * {@code 2023-10-01}, {@code 2023/10/01}, {@code 2023-10}, {@code 10/2023}.
 */
public final class SaleDateParser {

    static final String SIGNATURE = "formats=MMM-yy,MMM yyyy,d MMM yyyy,yyyy-MM[-dd],MM/yyyy;pivot=50";

    private static final Pattern ISO = Pattern.compile("^(\\d{4})[-/](\\d{1,2})(?:[-/](\\d{1,2}))?(?:[T ].*)?$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Map<String, Integer> MONTHS = new HashMap<>();

    static {
        String[][] names = {
                {"jan", "january"}, {"feb", "february"}, {"mar", "march"}, {"apr", "april"},
                {"may", "may"}, {"jun", "june"}, {"jul", "july"}, {"aug", "august"},
                {"sep", "september", "sept"}, {"oct", "october"}, {"nov", "november"}, {"dec", "december"}
        };
        for (int i = 0; i < names.length; i++) {
            for (String name : names[i]) {
                MONTHS.put(name, i + 1);
            }
        }
    }

    private SaleDateParser() {
    }

    public static LocalDate toTransactionMonth(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("sale date is empty");
        }
        String value = raw.trim();
        try {
            Matcher iso = ISO.matcher(value);
            if (iso.matches()) {
                return YearMonth.of(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2))).atDay(1);
            }

            String[] parts = value.split("[-\\s/]+");
            if (parts.length == 2) {
                Integer month = MONTHS.get(parts[0].toLowerCase(Locale.ROOT));
                if (month != null) {
                    return YearMonth.of(parseYear(parts[1]), month).atDay(1);
                }
                if (DIGITS.matcher(parts[0]).matches() && parts[1].length() == 4) {
                    return YearMonth.of(parseYear(parts[1]), Integer.parseInt(parts[0])).atDay(1);
                }
            } else if (parts.length == 3 && DIGITS.matcher(parts[0]).matches()) {
                Integer month = MONTHS.get(parts[1].toLowerCase(Locale.ROOT));
                if (month != null) {
                    return YearMonth.of(parseYear(parts[2]), month).atDay(1);
                }
            }
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unparseable sale date '" + value + "'", e);
        }
        throw new IllegalArgumentException("unparseable sale date '" + value + "'");
    }

    private static int parseYear(String token) {
        if (!DIGITS.matcher(token).matches()) {
            throw new IllegalArgumentException("bad year '" + token + "'");
        }
        int year = Integer.parseInt(token);
        if (token.length() == 2) {
            return year < 50 ? 2000 + year : 1900 + year;
        }
        if (token.length() == 4) {
            return year;
        }
        throw new IllegalArgumentException("bad year '" + token + "'");
    }
}
