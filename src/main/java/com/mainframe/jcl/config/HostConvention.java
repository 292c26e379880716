package com.mainframe.jcl.config;

import java.util.Locale;

/**
 * How members are laid out on disk.
 */
public enum HostConvention {
    /** Flat directory tree, one file per member. */
    LWM,
    /** Partitioned data sets: one directory per library, one file per member. */
    Z;

    public static HostConvention fromString(String value) {
        if (value == null || value.isBlank()) {
            return LWM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown SYSTEM '" + value + "', expected LWM or Z", e);
        }
    }
}
