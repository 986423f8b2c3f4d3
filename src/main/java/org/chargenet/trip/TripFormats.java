package org.chargenet.trip;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * User-facing formatting of trip quantities.
 */
@UtilityClass
public final class TripFormats {
    private static final long SECONDS_PER_HOUR = 3600L;
    private static final long SECONDS_PER_MINUTE = 60L;

    /**
     * {@code "x hrs y mins z secs"} from one hour up, {@code "y mins z secs"} below.
     * Input is rounded to whole seconds first.
     */
    public static String seconds(double seconds) {
        long total = Math.round(seconds);
        long minutes = total % SECONDS_PER_HOUR / SECONDS_PER_MINUTE;
        long secs = total % SECONDS_PER_MINUTE;
        if (total >= SECONDS_PER_HOUR) {
            return (total / SECONDS_PER_HOUR) + " hrs " + minutes + " mins " + secs + " secs";
        }
        return minutes + " mins " + secs + " secs";
    }

    /**
     * Kilometers with a thousands separator and one decimal, e.g. {@code "1,234.5 kms"}.
     */
    public static String meters(double meters) {
        return String.format(Locale.US, "%,.1f kms", meters / 1000.0d);
    }

    /**
     * Battery fraction as a percentage with one decimal, e.g. {@code "41.3%"}.
     */
    public static String battery(double fraction) {
        return String.format(Locale.US, "%.1f%%", fraction * 100.0d);
    }
}
