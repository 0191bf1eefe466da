package org.trackstats;

/**
 * Renders millisecond durations the way track summaries show them, e.g. {@code 1d 2:03'04"},
 * {@code 12'30"} or {@code 00'05.250}.
 */
public final class DurationFormatter {

    private static final long SECOND_IN_MILLIS = 1000;
    private static final long MINUTE_IN_MILLIS = 60 * SECOND_IN_MILLIS;
    private static final long HOUR_IN_MILLIS = 60 * MINUTE_IN_MILLIS;
    private static final long DAY_IN_MILLIS = 24 * HOUR_IN_MILLIS;

    private DurationFormatter() {
    }

    /**
     * @param hideMillis drop the millisecond part instead of printing it after the seconds
     */
    public static String format(long duration, boolean hideMillis) {
        if (duration < 0) {
            throw new IllegalArgumentException("Negative duration: " + duration);
        }
        StringBuilder s = new StringBuilder();

        if (duration >= DAY_IN_MILLIS) {
            s.append(duration / DAY_IN_MILLIS).append("d ");
            duration %= DAY_IN_MILLIS;
        }
        if (duration >= HOUR_IN_MILLIS) {
            s.append(duration / HOUR_IN_MILLIS).append(':');
            duration %= HOUR_IN_MILLIS;
        }

        long mins = duration / MINUTE_IN_MILLIS;
        duration %= MINUTE_IN_MILLIS;
        appendTwoDigits(s, mins).append('\'');

        long secs = duration / SECOND_IN_MILLIS;
        duration %= SECOND_IN_MILLIS;
        appendTwoDigits(s, secs);

        if (!hideMillis && duration > 0) {
            s.append('.').append(String.format("%03d", duration));
        } else {
            s.append('"');
        }
        return s.toString();
    }

    public static String format(long duration) {
        return format(duration, true);
    }

    /** Same as {@link #format(long, boolean)} with {@code :} separators, e.g. {@code 2:03:04}. */
    public static String formatIso(long duration, boolean hideMillis) {
        return format(duration, hideMillis).replace('\'', ':').replace("\"", "");
    }

    private static StringBuilder appendTwoDigits(StringBuilder s, long value) {
        if (value < 10) {
            s.append('0');
        }
        return s.append(value);
    }
}
