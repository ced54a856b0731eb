package com.arriraw.core;

import com.arriraw.HeaderFixture;
import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.util.HeaderBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.*;

class ByteOrderDetectorTest {

    @Test
    void shouldDetectLittleEndianMarker() throws ArriException {
        var header = HeaderBuffer.copyOf(HeaderFixture.littleEndian().bytes());
        assertThat(ByteOrderDetector.detect(header)).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    void shouldTreatAnythingElseAsBigEndian() throws ArriException {
        assertThat(ByteOrderDetector.detect(HeaderBuffer.copyOf(HeaderFixture.bigEndian().bytes())))
                .isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(ByteOrderDetector.detect(HeaderBuffer.copyOf(new byte[8])))
                .isEqualTo(ByteOrder.BIG_ENDIAN);
    }

    @Test
    void shouldNotMoveCallerCursor() throws ArriException {
        var header = HeaderBuffer.copyOf(HeaderFixture.littleEndian().bytes());
        header.position(100);
        ByteOrderDetector.detect(header);
        assertThat(header.position()).isEqualTo(100);
    }

    @Test
    void shouldFailOnShortHeader() {
        assertThatThrownBy(() -> ByteOrderDetector.detect(HeaderBuffer.copyOf(new byte[7])))
                .isInstanceOf(ArriException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.OUT_OF_RANGE);
    }
}
