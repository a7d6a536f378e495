package com.clawcron.common.infra;

import java.util.Locale;

/**
 * Duration formatting for log lines.
 */
public final class Durations {

    private Durations() {
    }

    /**
     * Format milliseconds: "450ms" below one second, otherwise seconds with up
     * to two decimals ("2.5s").
     */
    public static String formatMs(long ms) {
        if (ms < 0)
            ms = 0;
        if (ms < 1000) {
            return ms + "ms";
        }
        String formatted = String.format(Locale.ROOT, "%.2f", ms / 1000.0)
                .replaceAll("0+$", "")
                .replaceAll("\\.$", "");
        return formatted + "s";
    }
}
