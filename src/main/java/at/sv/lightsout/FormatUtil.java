package at.sv.lightsout;

import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * @param bri brightness in [0, 254]
     * @return the brightness in percent with at most one decimal, e.g. "50" or "49.6"
     */
    public static String formatBrightnessPercent(int bri) {
        double percent = bri * 100.0 / 254.0;
        return formatOneDecimal(percent);
    }

    /**
     * Confidence values are kept at full precision, this only rounds for display.
     */
    public static double roundConfidence(double confidence) {
        return Math.round(confidence * 100.0) / 100.0;
    }

    public static String formatConfidencePercent(double confidence) {
        return Math.round(confidence * 100.0) + "%";
    }

    private static String formatOneDecimal(double value) {
        double roundedOneDecimal = Math.round(value * 10.0) / 10.0;
        if (Math.abs(roundedOneDecimal - Math.rint(roundedOneDecimal)) < 0.0001) {
            return String.valueOf((int) Math.rint(roundedOneDecimal));
        }
        return String.format(Locale.ROOT, "%.1f", roundedOneDecimal);
    }
}
