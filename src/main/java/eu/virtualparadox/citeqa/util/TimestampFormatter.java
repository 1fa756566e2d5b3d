package eu.virtualparadox.citeqa.util;

import java.util.Locale;

/**
 * Renders media offsets as {@code MM:SS}, or {@code HH:MM:SS} from one hour upward.
 */
public final class TimestampFormatter {

    private TimestampFormatter() {
        // prevent instantiation
    }

    public static String format(final double seconds) {
        final long total = (long) Math.floor(Math.max(0.0, seconds));
        final long hours = total / 3600;
        final long minutes = (total % 3600) / 60;
        final long secs = total % 60;

        if (hours > 0) {
            return String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%02d:%02d", minutes, secs);
    }
}
