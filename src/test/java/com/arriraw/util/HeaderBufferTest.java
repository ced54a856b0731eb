package com.arriraw.util;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.*;

class HeaderBufferTest {

    @Test
    void shouldReadScalarsInBothOrders() throws ArriException {
        var buffer = HeaderBuffer.copyOf(new byte[]{0x01, 0x02, 0x03, 0x04, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});

        assertThat(buffer.getUInt16(ByteOrder.LITTLE_ENDIAN)).isEqualTo(0x0201);
        assertThat(buffer.getUInt16(ByteOrder.BIG_ENDIAN)).isEqualTo(0x0304);
        assertThat(buffer.getUInt32(ByteOrder.LITTLE_ENDIAN)).isEqualTo(0xFFFFFFFFL);
        assertThat(buffer.remaining()).isZero();

        buffer.position(0);
        assertThat(buffer.getInt32(ByteOrder.BIG_ENDIAN)).isEqualTo(0x01020304);
        assertThat(buffer.getInt8()).isEqualTo(-1);
        assertThat(buffer.getUInt8()).isEqualTo(0xFF);
        assertThat(buffer.getInt16(ByteOrder.LITTLE_ENDIAN)).isEqualTo((short) -1);
    }

    @Test
    void shouldReadFloatsAndLongs() throws ArriException {
        var bb = ByteBuffer.allocate(20).order(ByteOrder.BIG_ENDIAN);
        bb.putFloat(5.0f).putDouble(6.0).putLong(4L);
        var buffer = HeaderBuffer.copyOf(bb.array());

        assertThat(buffer.getFloat32(ByteOrder.BIG_ENDIAN)).isEqualTo(5.0f);
        assertThat(buffer.getFloat64(ByteOrder.BIG_ENDIAN)).isEqualTo(6.0);
        assertThat(buffer.getInt64(ByteOrder.BIG_ENDIAN)).isEqualTo(4L);
    }

    @Test
    void shouldFailOutOfRangeInsteadOfReadingPartially() throws ArriException {
        var buffer = HeaderBuffer.copyOf(new byte[6]);
        buffer.position(4);

        assertThatThrownBy(() -> buffer.getInt32(ByteOrder.LITTLE_ENDIAN))
                .isInstanceOf(ArriException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.OUT_OF_RANGE);
        assertThat(buffer.position()).isEqualTo(4);

        assertThatThrownBy(() -> buffer.position(7))
                .isInstanceOf(ArriException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.OUT_OF_RANGE);
        assertThatThrownBy(() -> buffer.skip(3))
                .isInstanceOf(ArriException.class);
    }

    @Test
    void shouldGiveIndependentCursors() throws ArriException {
        var buffer = HeaderBuffer.copyOf(new byte[]{1, 2, 3, 4});
        buffer.skip(2);
        var other = buffer.duplicate();

        assertThat(other.position()).isZero();
        assertThat(other.getUInt8()).isEqualTo(1);
        assertThat(buffer.getUInt8()).isEqualTo(3);
    }

    @Test
    void shouldCopySourceBytes() throws ArriException {
        var source = new byte[]{9, 9};
        var buffer = HeaderBuffer.copyOf(source);
        source[0] = 0;
        assertThat(buffer.getBytes(2)).containsExactly(9, 9);

        var bb = ByteBuffer.wrap(new byte[]{1, 2, 3});
        bb.get();
        var fromBuffer = HeaderBuffer.copyOf(bb);
        assertThat(fromBuffer.limit()).isEqualTo(2);
        assertThat(bb.position()).isEqualTo(1);
    }
}
