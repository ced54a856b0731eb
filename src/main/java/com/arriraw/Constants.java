package com.arriraw;

public final class Constants {
    public static final int HEADER_BYTES = 4096;
    public static final int MAGIC_BYTES = 4;
    public static final int LITTLE_ENDIAN_MARKER = 0x12345678;
    public static final String UNKNOWN_LABEL = "Unknown";

    private Constants() {}
}
