package com.arriraw.cli;

import java.util.Locale;

/**
 * Values of the {@code --outputformat} option; the lower case name is also the file extension.
 */
public enum OutputFormat {
    JSON, CSV;

    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OutputFormat fromOption(String option) {
        return valueOf(option.trim().toUpperCase(Locale.ROOT));
    }
}
