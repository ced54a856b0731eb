package com.arriraw.core;

import com.arriraw.Constants;
import com.arriraw.error.ArriException;
import com.arriraw.util.HeaderBuffer;
import lombok.experimental.UtilityClass;

import java.nio.ByteOrder;

/**
 * Detects the byte order of a frame header from the order word that follows the 4 byte magic.
 */
@UtilityClass
public final class ByteOrderDetector {

    /**
     * @return {@link ByteOrder#LITTLE_ENDIAN} if the order word, read little-endian, equals
     *         {@code 0x12345678}; {@link ByteOrder#BIG_ENDIAN} otherwise
     * @throws ArriException with {@code OUT_OF_RANGE} if the header is shorter than 8 bytes
     */
    public static ByteOrder detect(HeaderBuffer header) throws ArriException {
        var cursor = header.duplicate();
        cursor.position(0).skip(Constants.MAGIC_BYTES);
        int marker = cursor.getInt32(ByteOrder.LITTLE_ENDIAN);
        return marker == Constants.LITTLE_ENDIAN_MARKER ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }
}
