package com.arriraw.types;

import lombok.Getter;

/**
 * How the eight digits of a BCD field are grouped.
 */
public enum BcdLayout {
    /** {@code YYYY/MM/DD} */
    DATE("/"),
    /** {@code hh:mm:ss:ff} */
    TIME(":"),
    /** Last two digit pairs only, e.g. {@code UTC+01:00}. */
    OFFSET(":");

    @Getter
    private final String separator;

    BcdLayout(String separator) {
        this.separator = separator;
    }
}
