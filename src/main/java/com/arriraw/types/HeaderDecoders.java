package com.arriraw.types;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Pure conversions from raw header bytes to their textual or numeric form.
 * None of these touch a buffer; {@link FieldDecoder} reads the bytes and hands them over.
 */
@UtilityClass
public final class HeaderDecoders {

    public static final int TSTOP_NEAR_CLOSE = -3;
    public static final int TSTOP_CLOSE = -2;
    public static final int TSTOP_INVALID = -1;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /**
     * Decode header text. Text is stored byte-swapped in little-endian files, so the bytes are
     * reversed first for that order. Invalid UTF-8 is dropped, NUL padding is removed wherever it sits.
     */
    public static String decodeText(byte[] raw, ByteOrder order) {
        var bytes = order == ByteOrder.LITTLE_ENDIAN ? reversed(raw) : raw;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        CharBuffer chars;
        try {
            chars = decoder.decode(ByteBuffer.wrap(bytes));
        } catch (CharacterCodingException e) {
            // unreachable with IGNORE on both actions
            throw new IllegalStateException("UTF-8 decoding failed", e);
        }
        return chars.toString().replace("\u0000", "");
    }

    /**
     * Split a user info string of the form {@code key1:value1;key2:value2} into an ordered map.
     * Pairs without a colon are dropped; anything after a second colon is ignored.
     */
    public static Map<String, String> splitUserString(String input) {
        var result = new LinkedHashMap<String, String>();
        for (var pair : input.split(";", -1)) {
            if (pair.indexOf(':') < 0) {
                continue;
            }
            var parts = pair.split(":", -1);
            result.put(parts[0].strip(), parts[1].strip());
        }
        return result;
    }

    /**
     * Timecode bytes are stored least significant pair first: {@code 67 45 23 01} reads {@code 01:23:45:67}.
     */
    public static String timecode(byte[] raw) {
        var sb = new StringBuilder(raw.length * 3);
        for (int i = raw.length - 1; i >= 0; i--) {
            if (sb.length() > 0) sb.append(':');
            sb.append(HEX[(raw[i] >> 4) & 0x0F]).append(HEX[raw[i] & 0x0F]);
        }
        return sb.toString();
    }

    /**
     * Convert a raw lens iris value to a T-stop: {@code 2^((raw/1000 - 1)/2)}, rounded to two decimals.
     */
    public static String tStop(int raw) throws ArriException {
        switch (raw) {
            case TSTOP_NEAR_CLOSE:
                return "NearClose";
            case TSTOP_CLOSE:
                return "Close";
            case TSTOP_INVALID:
                return "Invalid";
            default:
                double stop = Math.pow(2, ((raw / 1000.0) - 1) / 2);
                if (Double.isInfinite(stop)) {
                    throw new ArriException(ErrorType.OUT_OF_RANGE, "Iris value " + raw + " has no finite T-stop");
                }
                return plainDecimal(round(stop, 2));
        }
    }

    /**
     * Unsigned thousandths to a real number, optionally formatted to fixed decimals and suffixed with a unit.
     */
    public static Value scaledFloat(long raw, Integer decimals, String unit) {
        double value = raw / 1000.0;
        if (decimals == null && unit == null) {
            return Value.fromFloat(value);
        }
        var text = decimals != null
                ? new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString()
                : String.valueOf(value);
        if (unit != null) {
            text = text + " " + unit;
        }
        return Value.fromString(text);
    }

    /**
     * Format BCD bytes. Each byte yields its high and low nibble as decimal digits; big-endian data has its
     * byte order reversed before the digits are joined.
     */
    public static String bcd(byte[] raw, BcdLayout layout, String separator, ByteOrder order, String prefix) {
        var digits = new StringBuilder(raw.length * 2);
        for (int i = 0; i < raw.length; i++) {
            int b = raw[order == ByteOrder.BIG_ENDIAN ? raw.length - 1 - i : i] & 0xFF;
            digits.append(b >> 4).append(b & 0x0F);
        }
        var s = digits.toString();
        switch (layout) {
            case DATE:
                return s.substring(0, 4) + separator + s.substring(4, 6) + separator + s.substring(6, 8);
            case TIME:
                return s.substring(0, 2) + separator + s.substring(2, 4) + separator
                        + s.substring(4, 6) + separator + s.substring(6, 8);
            case OFFSET:
                return (prefix == null ? "" : prefix) + s.substring(4, 6) + separator + s.substring(6, 8);
            default:
                return s;
        }
    }

    /**
     * Mask the given bit positions out of a word and shift the result down to the lowest position.
     */
    public static long extractBits(long word, IntSortedSet positions) {
        if (positions.isEmpty()) {
            return 0;
        }
        long mask = 0;
        for (int bit : positions) {
            mask |= 1L << bit;
        }
        return (word & mask) >>> positions.firstInt();
    }

    /**
     * Format 16 bytes as a UUID using Microsoft GUID byte grouping (first three groups little-endian).
     */
    public static String uuid(byte[] raw) {
        var le = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        long timeLow = Integer.toUnsignedLong(le.getInt(0));
        long timeMid = Short.toUnsignedLong(le.getShort(4));
        long timeHigh = Short.toUnsignedLong(le.getShort(6));
        long mostSignificant = (timeLow << 32) | (timeMid << 16) | timeHigh;
        long leastSignificant = ByteBuffer.wrap(raw, 8, 8).order(ByteOrder.BIG_ENDIAN).getLong();
        return new UUID(mostSignificant, leastSignificant).toString();
    }

    /**
     * Shortest decimal text of a double, never in exponent notation and with at least one fraction digit.
     */
    static String plainDecimal(double value) {
        var decimal = BigDecimal.valueOf(value);
        if (decimal.scale() < 1) {
            decimal = decimal.setScale(1);
        }
        return decimal.toPlainString();
    }

    static double round(double value, int decimals) {
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static byte[] reversed(byte[] raw) {
        var result = new byte[raw.length];
        for (int i = 0; i < raw.length; i++) {
            result[i] = raw[raw.length - 1 - i];
        }
        return result;
    }
}
