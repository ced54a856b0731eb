package com.arriraw.util;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Read-only cursor over the header bytes of one frame file.
 * <p>
 * The backing array is never written. {@link #duplicate()} hands out independent cursors over the same
 * bytes, so every block reader can seek freely without affecting the others. Every read is bounds checked
 * and fails with {@link ErrorType#OUT_OF_RANGE} instead of returning partial data.
 */
public final class HeaderBuffer {

    private final byte[] array;
    private final ByteBuffer view;
    private int position;

    private HeaderBuffer(byte[] array) {
        this.array = array;
        this.view = ByteBuffer.wrap(array).asReadOnlyBuffer();
        this.position = 0;
    }

    /**
     * Create buffer over a private copy of the given bytes.
     */
    public static HeaderBuffer copyOf(byte[] bytes) {
        Objects.requireNonNull(bytes, "Header bytes cannot be null");
        return new HeaderBuffer(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Create buffer over a private copy of the remaining bytes of the given buffer.
     * The source buffer's position is left untouched.
     */
    public static HeaderBuffer copyOf(ByteBuffer bytes) {
        Objects.requireNonNull(bytes, "Header bytes cannot be null");
        var copy = new byte[bytes.remaining()];
        bytes.duplicate().get(copy);
        return new HeaderBuffer(copy);
    }

    /**
     * Independent cursor over the same bytes, starting at offset 0.
     */
    public HeaderBuffer duplicate() {
        return new HeaderBuffer(array);
    }

    public int position() {
        return position;
    }

    /**
     * Seek to an absolute offset.
     */
    public HeaderBuffer position(int newPosition) throws ArriException {
        if (newPosition < 0 || newPosition > array.length) {
            throw new ArriException(ErrorType.OUT_OF_RANGE,
                    "Offset 0x" + Integer.toHexString(newPosition) + " is outside a header of " + array.length + " bytes");
        }
        this.position = newPosition;
        return this;
    }

    public int limit() {
        return array.length;
    }

    public int remaining() {
        return array.length - position;
    }

    public HeaderBuffer skip(int length) throws ArriException {
        ensureRemaining(length, "skip");
        position += length;
        return this;
    }

    /**
     * Read raw bytes in stored order.
     */
    public byte[] getBytes(int length) throws ArriException {
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        ensureRemaining(length, "bytes[" + length + "]");
        var result = Arrays.copyOfRange(array, position, position + length);
        position += length;
        return result;
    }

    public int getUInt8() throws ArriException {
        ensureRemaining(1, "uint8");
        return array[position++] & 0xFF;
    }

    public int getInt8() throws ArriException {
        ensureRemaining(1, "int8");
        return array[position++];
    }

    public int getUInt16(ByteOrder order) throws ArriException {
        return getInt16(order) & 0xFFFF;
    }

    public short getInt16(ByteOrder order) throws ArriException {
        ensureRemaining(2, "int16");
        short value = view.order(order).getShort(position);
        position += 2;
        return value;
    }

    public int getInt32(ByteOrder order) throws ArriException {
        ensureRemaining(4, "int32");
        int value = view.order(order).getInt(position);
        position += 4;
        return value;
    }

    public long getUInt32(ByteOrder order) throws ArriException {
        return Integer.toUnsignedLong(getInt32(order));
    }

    /**
     * Read 64 bits. Callers decide whether the result is signed.
     */
    public long getInt64(ByteOrder order) throws ArriException {
        ensureRemaining(8, "int64");
        long value = view.order(order).getLong(position);
        position += 8;
        return value;
    }

    public float getFloat32(ByteOrder order) throws ArriException {
        return Float.intBitsToFloat(getInt32(order));
    }

    public double getFloat64(ByteOrder order) throws ArriException {
        return Double.longBitsToDouble(getInt64(order));
    }

    private void ensureRemaining(int length, String what) throws ArriException {
        if (length > remaining()) {
            throw new ArriException(ErrorType.OUT_OF_RANGE,
                    "Not enough bytes for " + what + " at offset 0x" + Integer.toHexString(position)
                            + ". Needed: " + length + ", available: " + remaining());
        }
    }

    @Override
    public String toString() {
        return "HeaderBuffer{position=" + position + ", limit=" + array.length + "}";
    }
}
