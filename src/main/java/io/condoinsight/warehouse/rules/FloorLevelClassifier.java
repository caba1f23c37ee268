package io.condoinsight.warehouse.rules;

/**
 * Maps a URA floor range ("01 to 05", "B1 to B5", "-") to a floor tier label.
 */
public final class FloorLevelClassifier {

    public static final String UNKNOWN = "Unknown";

    static final String SIGNATURE = "low<=5,midlow<=10,mid<=20,midhigh<=30,high>30";

    private FloorLevelClassifier() {
    }

    public static String classify(String floorRange) {
        if (floorRange == null || floorRange.isBlank()) {
            return UNKNOWN;
        }
        String low = floorRange.trim().split("\\s+to\\s+")[0].trim();
        int lowFloor;
        try {
            lowFloor = Integer.parseInt(low);
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
        if (lowFloor <= 5) {
            return "Low (1-5)";
        }
        if (lowFloor <= 10) {
            return "Mid-Low (6-10)";
        }
        if (lowFloor <= 20) {
            return "Mid (11-20)";
        }
        if (lowFloor <= 30) {
            return "Mid-High (21-30)";
        }
        return "High (31+)";
    }
}
