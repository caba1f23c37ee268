package io.condoinsight.warehouse.staging;

import java.math.BigDecimal;

/**
 * Lenient numeric parsing for exported spreadsheets: currency symbols, thousands
 * separators and placeholder dashes are tolerated.
 */
final class FieldParsers {

    /** Longest raw value quoted back in a row problem. */
    static final int QUOTE_LIMIT = 40;

    private FieldParsers() {
    }

    /**
     * @return null for an empty or placeholder value
     * @throws IllegalArgumentException if something other than a number is present
     */
    static BigDecimal decimal(String raw) {
        String cleaned = clean(raw);
        if (cleaned == null) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: '" + abbreviate(raw.trim()) + "'");
        }
    }

    static Integer integer(String raw) {
        BigDecimal value = decimal(raw);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("not a whole number: '" + abbreviate(raw.trim()) + "'");
        }
    }

    static String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Cuts {@code value} to {@link #QUOTE_LIMIT} characters, noting the original length.
     */
    static String abbreviate(String value) {
        if (value == null || value.length() <= QUOTE_LIMIT) {
            return value;
        }
        return value.substring(0, QUOTE_LIMIT) + "... (" + value.length() + " chars)";
    }

    private static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.trim()
                .replace("S$", "")
                .replace("$", "")
                .replace(",", "")
                .replace(" ", "");
        if (cleaned.isEmpty() || cleaned.equals("-") || cleaned.equalsIgnoreCase("na") || cleaned.equalsIgnoreCase("n.a.")) {
            return null;
        }
        return cleaned;
    }
}
