package io.github.yok.masklink.core;

import java.util.Locale;

/**
 * Extraction mode of a run.
 */
public enum RunMode {
    // Incremental extraction bounded by the persisted per-table watermark
    DELTA,
    // Extraction ignoring watermark state; the state is neither read nor written
    FULL;

    /**
     * Parses a mode name.
     *
     * @param value "delta" or "full" (case-insensitive)
     * @return mode, or {@code null} when the value is blank or not a mode name
     */
    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "delta":
                return DELTA;
            case "full":
                return FULL;
            default:
                return null;
        }
    }
}
