package com.querydigest.log.parser.report;

import java.util.Locale;

/**
 * Human readable durations from fractional seconds, e.g. {@code 250µs}, {@code 12.500ms}, {@code 3.200s},
 * {@code 2m5.000s}.
 */
final class DurationFormat {

    private DurationFormat() {
    }

    static String format(double seconds) {
        if (seconds < 0) {
            return "-" + format(-seconds);
        }
        long micros = Math.round(seconds * 1_000_000);
        if (micros < 1_000) {
            return micros + "µs";
        }
        if (micros < 1_000_000) {
            return String.format(Locale.ROOT, "%.3fms", micros / 1_000.0);
        }
        if (micros < 60_000_000) {
            return String.format(Locale.ROOT, "%.3fs", micros / 1_000_000.0);
        }
        long totalSeconds = micros / 1_000_000;
        double fraction = (micros % 1_000_000) / 1_000_000.0;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        double secs = totalSeconds % 60 + fraction;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh%dm%.3fs", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%dm%.3fs", minutes, secs);
    }
}
