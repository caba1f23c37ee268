package io.condoinsight.warehouse.rules;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tenure type and lease arithmetic from free-text tenure strings such as
 * "99 yrs lease commencing from 2015" or "Freehold".
 */
public final class TenureClassifier {

    public static final String FREEHOLD = "Freehold";
    public static final int FREEHOLD_REMAINING_LEASE = 999;

    static final String SIGNATURE = "freehold|estate in perpetuity;999;99;from-year 1900..2100";

    private static final Pattern FROM_YEAR = Pattern.compile("(?:commencing\\s+from|from)\\s+(\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_YEAR = Pattern.compile("(\\d{4})");

    private TenureClassifier() {
    }

    public static String classify(String tenure) {
        if (tenure == null || tenure.isBlank()) {
            return "Unknown";
        }
        String t = tenure.toLowerCase(Locale.ROOT);
        if (isFreehold(t)) {
            return FREEHOLD;
        }
        if (t.contains("999")) {
            return "999-year";
        }
        if (t.contains("99")) {
            return "99-year";
        }
        return "Other";
    }

    public static Integer leaseStartYear(String tenure) {
        if (tenure == null || tenure.isBlank()) {
            return null;
        }
        Matcher from = FROM_YEAR.matcher(tenure);
        if (from.find()) {
            Integer year = plausibleYear(from.group(1));
            if (year != null) {
                return year;
            }
        }
        Matcher any = ANY_YEAR.matcher(tenure);
        while (any.find()) {
            Integer year = plausibleYear(any.group(1));
            if (year != null) {
                return year;
            }
        }
        return null;
    }

    public static Integer remainingLease(LeaseTerm term) {
        String tenure = term.getTenure();
        if (tenure == null || tenure.isBlank()) {
            return null;
        }
        if (isFreehold(tenure.toLowerCase(Locale.ROOT))) {
            return FREEHOLD_REMAINING_LEASE;
        }
        Integer start = leaseStartYear(tenure);
        if (start == null) {
            return null;
        }
        int length = "999-year".equals(classify(tenure)) ? 999 : 99;
        return Math.max(0, length - (term.getReferenceYear() - start));
    }

    private static boolean isFreehold(String lower) {
        return lower.contains("freehold") || lower.contains("estate in perpetuity");
    }

    private static Integer plausibleYear(String digits) {
        int year = Integer.parseInt(digits);
        return year >= 1900 && year <= 2100 ? year : null;
    }
}
