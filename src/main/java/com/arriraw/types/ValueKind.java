package com.arriraw.types;

/**
 * Shape of a decoded {@link Value}.
 */
public enum ValueKind {
    INTEGER,
    FLOAT,
    STRING,
    FRAME_LINE,
    MAP
}
