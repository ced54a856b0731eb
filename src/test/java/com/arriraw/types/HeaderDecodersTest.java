package com.arriraw.types;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HeaderDecodersTest {

    @ParameterizedTest
    @CsvSource({
            "-3, NearClose",
            "-2, Close",
            "-1, Invalid",
            "0, 0.71",
            "1000, 1.0",
            "2000, 1.41",
            "3000, 2.0",
            "4000, 2.83",
            "1500, 1.19",
            "50000, 23726566.41",
            "-2000000, 0.0"
    })
    void shouldConvertRawIrisToTStop(int raw, String expected) throws ArriException {
        assertThat(HeaderDecoders.tStop(raw)).isEqualTo(expected);
    }

    @Test
    void shouldRejectIrisValueWithoutFiniteTStop() {
        assertThatThrownBy(() -> HeaderDecoders.tStop(Integer.MAX_VALUE))
                .isInstanceOf(ArriException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.OUT_OF_RANGE);
    }

    @ParameterizedTest
    @CsvSource({
            "67452301, 01:23:45:67",
            "78563412, 12:34:56:78",
            "00000000, 00:00:00:00",
            "FFFFFFFF, ff:ff:ff:ff"
    })
    void shouldFormatTimecodeFromReversedBytes(String hex, String expected) {
        assertThat(HeaderDecoders.timecode(HexFormat.of().parseHex(hex))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "01000000, 0, LITTLE_ENDIAN, 1",
            "01000000, 31, LITTLE_ENDIAN, 0",
            "00000001, 0, LITTLE_ENDIAN, 0",
            "00000080, 31, LITTLE_ENDIAN, 1",
            "00000001, 0, BIG_ENDIAN, 1",
            "7FFFFFFF, 31, BIG_ENDIAN, 0",
            "FFFFFFF0, 0, BIG_ENDIAN, 0",
            "80000000, 31, BIG_ENDIAN, 1"
    })
    void shouldExtractSingleBit(String hex, int bit, String order, long expected) {
        var byteOrder = "BIG_ENDIAN".equals(order) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        long word = Integer.toUnsignedLong(ByteBuffer.wrap(HexFormat.of().parseHex(hex)).order(byteOrder).getInt());

        assertThat(HeaderDecoders.extractBits(word, new IntAVLTreeSet(new int[]{bit}))).isEqualTo(expected);
    }

    @Test
    void shouldShiftMultiBitFieldsDownToLowestPosition() {
        assertThat(HeaderDecoders.extractBits(0b11100, new IntAVLTreeSet(new int[]{2, 3, 4}))).isEqualTo(7);
        assertThat(HeaderDecoders.extractBits(0b01000, new IntAVLTreeSet(new int[]{4, 3, 2}))).isEqualTo(2);
        assertThat(HeaderDecoders.extractBits(0xFFFFFFFFL, new IntAVLTreeSet())).isZero();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "12345678 | DATE | BIG_ENDIAN | 7856/34/12",
            "12345678 | DATE | LITTLE_ENDIAN | 1234/56/78",
            "12345678 | TIME | BIG_ENDIAN | 78:56:34:12",
            "12345678 | TIME | LITTLE_ENDIAN | 12:34:56:78"
    })
    void shouldFormatBcd(String hex, BcdLayout layout, String order, String expected) {
        var byteOrder = "BIG_ENDIAN".equals(order) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        assertThat(HeaderDecoders.bcd(HexFormat.of().parseHex(hex), layout, layout.getSeparator(), byteOrder, null))
                .isEqualTo(expected);
    }

    @Test
    void shouldFormatBcdOffsetWithPrefix() {
        var raw = HexFormat.of().parseHex("00000130");
        assertThat(HeaderDecoders.bcd(raw, BcdLayout.OFFSET, ":", ByteOrder.LITTLE_ENDIAN, "+")).isEqualTo("+01:30");
        assertThat(HeaderDecoders.bcd(raw, BcdLayout.OFFSET, ":", ByteOrder.LITTLE_ENDIAN, null)).isEqualTo("01:30");
    }

    @Test
    void shouldSplitUserStrings() {
        assertThat(HeaderDecoders.splitUserString("key1:value1;key2:value2"))
                .containsExactly(Map.entry("key1", "value1"), Map.entry("key2", "value2"));
        assertThat(HeaderDecoders.splitUserString("key1: value1 ; key2 : value2 "))
                .containsExactly(Map.entry("key1", "value1"), Map.entry("key2", "value2"));
        assertThat(HeaderDecoders.splitUserString("key1:value1")).containsExactly(Map.entry("key1", "value1"));
        assertThat(HeaderDecoders.splitUserString("")).isEmpty();
    }

    @Test
    void shouldDropPairsWithoutColonAndIgnoreExtraColons() {
        assertThat(HeaderDecoders.splitUserString("novalue;a:b:c;;x:"))
                .containsExactly(Map.entry("a", "b"), Map.entry("x", ""));
    }

    @Test
    void shouldDecodeTextAndStripNulPadding() {
        var raw = "Hello, World!\u0000\u0000\u0000".getBytes(StandardCharsets.UTF_8);
        assertThat(HeaderDecoders.decodeText(raw, ByteOrder.BIG_ENDIAN)).isEqualTo("Hello, World!");
    }

    @Test
    void shouldReverseTextForLittleEndian() {
        var raw = "\u0000\u0000CBA".getBytes(StandardCharsets.UTF_8);
        assertThat(HeaderDecoders.decodeText(raw, ByteOrder.LITTLE_ENDIAN)).isEqualTo("ABC");
    }

    @Test
    void shouldIgnoreInvalidUtf8() {
        var raw = new byte[]{'O', (byte) 0xFF, 'K', 0};
        assertThat(HeaderDecoders.decodeText(raw, ByteOrder.BIG_ENDIAN)).isEqualTo("OK");
    }

    @Test
    void shouldScaleThousandths() {
        assertThat(HeaderDecoders.scaledFloat(25000, null, null)).isEqualTo(Value.fromFloat(25.0));
        assertThat(HeaderDecoders.scaledFloat(20833, 3, "ms")).isEqualTo(Value.fromString("20.833 ms"));
        assertThat(HeaderDecoders.scaledFloat(180000, 2, null)).isEqualTo(Value.fromString("180.00"));
        assertThat(HeaderDecoders.scaledFloat(1500, null, "m")).isEqualTo(Value.fromString("1.5 m"));
        assertThat(HeaderDecoders.scaledFloat(0xFFFFFFFFL, null, null)).isEqualTo(Value.fromFloat(4294967.295));
    }

    @Test
    void shouldFormatUuidWithLittleEndianGroups() {
        var raw = HexFormat.of().parseHex("33221100554477668899aabbccddeeff");
        assertThat(HeaderDecoders.uuid(raw)).isEqualTo("00112233-4455-6677-8899-aabbccddeeff");
    }
}
