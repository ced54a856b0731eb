package com.arriraw.cli;

import java.util.Locale;

/**
 * Values of the {@code --fields} option.
 */
public enum FieldSelection {
    ALL, MINIMAL, DEFAULT;

    public static FieldSelection fromOption(String option) {
        return valueOf(option.trim().toUpperCase(Locale.ROOT));
    }
}
