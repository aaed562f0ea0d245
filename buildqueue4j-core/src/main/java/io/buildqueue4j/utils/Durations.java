package io.buildqueue4j.utils;

import java.time.Duration;
import java.util.Locale;

public final class Durations {
    private Durations() {
    }

    /**
     * Formats as seconds with two decimals, e.g. {@code 1250ms -> "1.25s"}.
     */
    public static String toSeconds(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration must not be null");
        }
        return String.format(Locale.ROOT, "%.2fs", duration.toMillis() / 1000.0);
    }

    /**
     * Elapsed milliseconds, clamped at zero for clocks that step backwards.
     */
    public static long toMillis(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0L;
        }
        return duration.toMillis();
    }
}
