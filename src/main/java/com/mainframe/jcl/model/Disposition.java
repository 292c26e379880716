package com.mainframe.jcl.model;

import java.util.List;
import java.util.Locale;

import lombok.Value;

/**
 * DISP=(status,normal,abnormal). Omitted slots take the fixed defaults below; the
 * values are recorded as written, never evaluated.
 */
@Value
public class Disposition {
    public static final String DEFAULT_STATUS = "NEW";
    public static final String DEFAULT_NORMAL = "DELETE";
    public static final String DEFAULT_ABNORMAL = "DELETE";

    public static final Disposition DEFAULT = new Disposition(DEFAULT_STATUS, DEFAULT_NORMAL, DEFAULT_ABNORMAL);

    String status;
    String normal;
    String abnormal;

    /**
     * Build from up to three positional slots; null or blank slots fall back to the defaults.
     */
    public static Disposition fromSlots(List<String> slots) {
        if (slots == null || slots.isEmpty()) {
            return DEFAULT;
        }
        return new Disposition(
                slot(slots, 0, DEFAULT_STATUS),
                slot(slots, 1, DEFAULT_NORMAL),
                slot(slots, 2, DEFAULT_ABNORMAL));
    }

    private static String slot(List<String> slots, int index, String fallback) {
        if (index >= slots.size()) {
            return fallback;
        }
        String value = slots.get(index);
        return (value == null || value.isBlank()) ? fallback : value.trim().toUpperCase(Locale.ROOT);
    }
}
