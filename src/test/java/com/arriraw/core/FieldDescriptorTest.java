package com.arriraw.core;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.types.DataType;
import com.arriraw.types.Value;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.*;

class FieldDescriptorTest {

    @Test
    void shouldBuildWithOptionalParameters() throws ArriException {
        var field = FieldDescriptor.builder("ExposureTime", 0x018C, DataType.SCALED_FLOAT)
                .byteOrder(ByteOrder.LITTLE_ENDIAN)
                .decimals(3)
                .unit("ms")
                .build();

        assertThat(field.getName()).isEqualTo("ExposureTime");
        assertThat(field.getOffset()).isEqualTo(0x018C);
        assertThat(field.requiredLength()).isEqualTo(4);
        assertThat(field.getDecimals()).isEqualTo(3);
        assertThat(field.getUnit()).isEqualTo("ms");
        assertThat(field.hasEnumeration()).isFalse();
        assertThat(field.getBitPositions()).isEmpty();
    }

    @Test
    void shouldPreferOwnByteOrder() throws ArriException {
        var fixed = FieldDescriptor.builder("a", 0, DataType.UINT16).byteOrder(ByteOrder.BIG_ENDIAN).build();
        var floating = FieldDescriptor.builder("b", 0, DataType.UINT16).build();

        assertThat(fixed.resolveOrder(ByteOrder.LITTLE_ENDIAN)).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(floating.resolveOrder(ByteOrder.LITTLE_ENDIAN)).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    void shouldNormalizeBitPositions() throws ArriException {
        var field = FieldDescriptor.builder("Flags", 0, DataType.BITS).bitPositions(4, 2, 3, 2).build();

        assertThat(field.getBitPositions()).containsExactly(2, 3, 4);
    }

    @Test
    void shouldApplyEnumerationOrUnknown() throws ArriException {
        var field = FieldDescriptor.builder("Vari", 0, DataType.BITS)
                .bitPositions(1)
                .mapping(0, "Valid Image")
                .mapping(1, "Duplicate Image")
                .build();

        assertThat(field.applyEnumeration(Value.fromUnsigned(1))).isEqualTo(Value.fromString("Duplicate Image"));
        assertThat(field.applyEnumeration(Value.fromUnsigned(5))).isEqualTo(Value.fromString("Unknown"));
        assertThat(field.applyEnumeration(Value.fromFloat(0.0))).isEqualTo(Value.fromString("Valid Image"));
        assertThat(field.applyEnumeration(Value.fromFloat(0.5))).isEqualTo(Value.fromString("Unknown"));
    }

    @Test
    void shouldLeaveValueWithoutEnumerationUnchanged() throws ArriException {
        var field = FieldDescriptor.builder("Plain", 0, DataType.UINT8).build();
        assertThat(field.applyEnumeration(Value.fromUnsigned(5))).isEqualTo(Value.fromUnsigned(5));
    }

    @Test
    void shouldRejectInvalidDescriptors() {
        assertInvalid(() -> FieldDescriptor.builder("neg", -1, DataType.UINT8).build());
        assertInvalid(() -> FieldDescriptor.builder("str", 0, DataType.STRING).build());
        assertInvalid(() -> FieldDescriptor.builder("bits", 0, DataType.BITS).build());
        assertInvalid(() -> FieldDescriptor.builder("bits", 0, DataType.BITS).bitPositions(32).build());
        assertInvalid(() -> FieldDescriptor.builder("u8", 0, DataType.UINT8).bitPositions(1).build());
        assertInvalid(() -> FieldDescriptor.builder("fl", 0, DataType.FRAME_LINE).build());
        assertInvalid(() -> FieldDescriptor.builder("fl", 0, DataType.FRAME_LINE)
                .frameLineId("1A").mapping(1, "x").build());
        assertInvalid(() -> FieldDescriptor.builder("f", 0, DataType.SCALED_FLOAT).decimals(-1).build());
    }

    private static void assertInvalid(ThrowingCallable builder) {
        assertThatThrownBy(builder)
                .isInstanceOf(ArriException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_DESCRIPTOR);
    }
}
