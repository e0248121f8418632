package org.stepflow.util;

public final class TimeUtil {
    public static final int MINUTE = 60;
    public static final int HOUR = 3600;
    public static final String NO_DURATION = "—";

    private TimeUtil() {
    }

    /**
     * Short human readable duration: {@code 45s}, {@code 2m 5s}, {@code 1h 30m}. Non-positive or non-finite
     * input renders as {@value #NO_DURATION}.
     */
    public static String formatDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) {
            return NO_DURATION;
        }
        if (seconds < MINUTE) {
            return Math.round(seconds) + "s";
        }
        if (seconds < HOUR) {
            long minutes = (long) Math.floor(seconds / MINUTE);
            long remaining = Math.round(seconds % MINUTE);
            return remaining > 0 ? minutes + "m " + remaining + "s" : minutes + "m";
        }
        long hours = (long) Math.floor(seconds / HOUR);
        long minutes = Math.round((seconds % HOUR) / MINUTE);
        return minutes > 0 ? hours + "h " + minutes + "m" : hours + "h";
    }
}
