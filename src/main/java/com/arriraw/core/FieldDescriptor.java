package com.arriraw.core;

import com.arriraw.Constants;
import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.types.DataType;
import com.arriraw.types.Value;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * One entry of a field catalog: where a field lives in the header and how to decode it.
 * Descriptors are immutable and validated when built.
 */
@lombok.Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldDescriptor {
    String name;
    int offset;
    DataType dataType;
    /** Byte length for variable width datatypes, 0 otherwise. */
    int length;
    /** Overrides the byte order detected for the file; null to use the detected order. */
    ByteOrder byteOrder;
    /** Bit indices read by {@link DataType#BITS} fields; empty for every other datatype. */
    IntSortedSet bitPositions;
    /** Raw value to label table, empty when the field has none. */
    Long2ObjectMap<String> enumeration;
    Integer decimals;
    String unit;
    String prefix;
    /** Identifier used to namespace frame line entries, e.g. {@code 1A}. */
    String frameLineId;

    public static Builder builder(String name, int offset, DataType dataType) {
        return new Builder(name, offset, dataType);
    }

    /**
     * Bytes that must be available at {@link #getOffset()} before decoding starts.
     */
    public int requiredLength() {
        return dataType.hasVariableWidth() ? length : dataType.getWidth();
    }

    public ByteOrder resolveOrder(ByteOrder detected) {
        return byteOrder != null ? byteOrder : detected;
    }

    public boolean hasEnumeration() {
        return !enumeration.isEmpty();
    }

    /**
     * Replace a decoded value by its enumeration label, or {@value Constants#UNKNOWN_LABEL} when the raw
     * value is not in the table. Fields without a table return the value unchanged.
     */
    public Value applyEnumeration(Value decoded) {
        if (!hasEnumeration()) {
            return decoded;
        }
        String label = null;
        if (decoded instanceof Value.IntegerValue) {
            label = enumeration.get(((Value.IntegerValue) decoded).getValue());
        } else if (decoded instanceof Value.FloatValue) {
            double raw = ((Value.FloatValue) decoded).getValue();
            if (raw == Math.rint(raw) && !Double.isInfinite(raw)) {
                label = enumeration.get((long) raw);
            }
        }
        return Value.fromString(label != null ? label : Constants.UNKNOWN_LABEL);
    }

    /**
     * Fluent builder for {@link FieldDescriptor}. Only name, offset and datatype are mandatory; which of
     * the optional parameters are required depends on the datatype and is checked by {@link #build()}.
     */
    public static final class Builder {
        private final String name;
        private final int offset;
        private final DataType dataType;
        private int length;
        private ByteOrder byteOrder;
        private final IntSortedSet bitPositions = new IntAVLTreeSet();
        private final Long2ObjectMap<String> enumeration = new Long2ObjectLinkedOpenHashMap<>();
        private Integer decimals;
        private String unit;
        private String prefix;
        private String frameLineId;

        private Builder(String name, int offset, DataType dataType) {
            this.name = Objects.requireNonNull(name, "Field name cannot be null");
            this.offset = offset;
            this.dataType = Objects.requireNonNull(dataType, "Datatype cannot be null");
        }

        public Builder length(int length) {
            this.length = length;
            return this;
        }

        public Builder byteOrder(ByteOrder byteOrder) {
            this.byteOrder = byteOrder;
            return this;
        }

        public Builder bitPositions(int... positions) {
            for (int position : positions) {
                bitPositions.add(position);
            }
            return this;
        }

        public Builder mapping(long raw, String label) {
            enumeration.put(raw, Objects.requireNonNull(label, "Label cannot be null"));
            return this;
        }

        public Builder decimals(Integer decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder frameLineId(String frameLineId) {
            this.frameLineId = frameLineId;
            return this;
        }

        public FieldDescriptor build() throws ArriException {
            if (offset < 0) {
                throw invalid("negative offset " + offset);
            }
            if (dataType.hasVariableWidth() && length <= 0) {
                throw invalid("datatype " + dataType.getTag() + " needs a positive length");
            }
            if (dataType == DataType.BITS) {
                if (bitPositions.isEmpty()) {
                    throw invalid("bit field needs at least one bit position");
                }
                if (bitPositions.firstInt() < 0 || bitPositions.lastInt() > 31) {
                    throw invalid("bit positions must lie within 0..31, got " + bitPositions);
                }
            } else if (!bitPositions.isEmpty()) {
                throw invalid("bit positions are only valid for bit fields");
            }
            if (dataType == DataType.FRAME_LINE && (frameLineId == null || frameLineId.isEmpty())) {
                throw invalid("frame line field needs a frame line id");
            }
            if (dataType.isComposite() && !enumeration.isEmpty()) {
                throw invalid("datatype " + dataType.getTag() + " cannot carry an enumeration table");
            }
            if (decimals != null && decimals < 0) {
                throw invalid("negative decimals " + decimals);
            }
            return new FieldDescriptor(name, offset, dataType, length, byteOrder,
                    IntSortedSets.unmodifiable(new IntAVLTreeSet(bitPositions)),
                    Long2ObjectMaps.unmodifiable(new Long2ObjectLinkedOpenHashMap<>(enumeration)),
                    decimals, unit, prefix, frameLineId);
        }

        private ArriException invalid(String reason) {
            return new ArriException(ErrorType.INVALID_DESCRIPTOR, "Field '" + name + "': " + reason);
        }
    }
}
