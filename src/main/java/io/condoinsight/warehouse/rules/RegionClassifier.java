package io.condoinsight.warehouse.rules;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Postal district normalisation and the district to market region lookup.
 */
public final class RegionClassifier {

    public static final String CCR = "CCR";
    public static final String RCR = "RCR";
    public static final String OCR = "OCR";

    static final List<String> CCR_DISTRICTS = List.of("D01", "D02", "D06", "D07", "D09", "D10", "D11");
    static final List<String> RCR_DISTRICTS = List.of("D03", "D04", "D05", "D08", "D12", "D13", "D14", "D15", "D20");

    static final String DISTRICT_SIGNATURE = "D01..D28";
    static final String REGION_SIGNATURE = "CCR=" + CCR_DISTRICTS + ";RCR=" + RCR_DISTRICTS + ";OCR=rest";
    static final String SEGMENT_SIGNATURE = "core central|rest of central|outside central";

    private static final Pattern NUMBER = Pattern.compile("(\\d+)");

    private RegionClassifier() {
    }

    /**
     * "9", "09", "D9", "District 09" all become "D09".
     */
    public static String normaliseDistrict(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("district is empty");
        }
        Matcher m = NUMBER.matcher(raw);
        if (!m.find()) {
            throw new IllegalArgumentException("no district number in '" + raw + "'");
        }
        int number = Integer.parseInt(m.group(1));
        if (number < 1 || number > 28) {
            throw new IllegalArgumentException("district out of range: " + raw);
        }
        return String.format("D%02d", number);
    }

    public static String regionForDistrict(String district) {
        String d = normaliseDistrict(district);
        if (CCR_DISTRICTS.contains(d)) {
            return CCR;
        }
        if (RCR_DISTRICTS.contains(d)) {
            return RCR;
        }
        return OCR;
    }

    /**
     * Normalises the declared market segment label to a region code.
     */
    public static String normaliseSegment(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("market segment is empty");
        }
        String l = label.trim().toLowerCase(Locale.ROOT);
        if (l.equals("ccr") || l.startsWith("core central")) {
            return CCR;
        }
        if (l.equals("rcr") || l.startsWith("rest of central")) {
            return RCR;
        }
        if (l.equals("ocr") || l.startsWith("outside central")) {
            return OCR;
        }
        throw new IllegalArgumentException("unknown market segment '" + label + "'");
    }
}
