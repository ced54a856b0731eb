package com.arriraw.core;

/**
 * What an extraction does when a field lies (partly) outside the header.
 */
public enum ExtractionMode {
    /** Abort the whole extraction; no partial result. */
    STRICT,
    /** Log the field and continue with the next one. */
    BEST_EFFORT
}
