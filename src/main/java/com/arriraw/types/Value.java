package com.arriraw.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A value decoded from one header field.
 * <p>
 * Scalar values are stored under the field's own name. Composite values (frame lines, user fields)
 * expand into several named entries, see {@link #namedValues(String)}.
 */
public abstract class Value {

    public abstract ValueKind getKind();
    public abstract boolean equals(Object obj);
    public abstract int hashCode();
    public abstract String toString();

    /**
     * Plain Java representation used for JSON and tabular export.
     */
    public abstract Object toJava();

    /**
     * Entries this value contributes to a metadata map when decoded for the given field name.
     */
    public Map<String, Value> namedValues(String fieldName) {
        return Collections.singletonMap(fieldName, this);
    }

    public boolean isComposite() {
        return false;
    }

    // Factory methods
    public static Value fromSigned(long value) {
        return new IntegerValue(value, false);
    }

    public static Value fromUnsigned(long value) {
        return new IntegerValue(value, true);
    }

    public static Value fromFloat(double value) {
        return new FloatValue(value);
    }

    public static Value fromString(String value) {
        return new StringValue(value);
    }

    public static Value fromMap(Map<String, Value> value) {
        return new MapValue(value);
    }

    public static Value inactiveFrameLine(String frameLineId) {
        return new FrameLineValue(frameLineId, FrameLineValue.INACTIVE, null, 0, 0, 0, 0);
    }

    public static Value activeFrameLine(String frameLineId, String type, String name,
                                        int left, int top, int width, int height) {
        return new FrameLineValue(frameLineId, type, name, left, top, width, height);
    }

    // Integer Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class IntegerValue extends Value {
        private final long value;
        private final boolean unsigned;

        public IntegerValue(long value, boolean unsigned) {
            this.value = value;
            this.unsigned = unsigned;
        }

        @Override
        public ValueKind getKind() { return ValueKind.INTEGER; }

        @Override
        public Object toJava() {
            if (unsigned && value < 0) {
                return new BigInteger(Long.toUnsignedString(value));
            }
            return value;
        }

        @Override
        public String toString() {
            return unsigned ? Long.toUnsignedString(value) : String.valueOf(value);
        }
    }

    // Float Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FloatValue extends Value {
        private final double value;

        public FloatValue(double value) {
            this.value = value;
        }

        @Override
        public ValueKind getKind() { return ValueKind.FLOAT; }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // String Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class StringValue extends Value {
        private final String value;

        public StringValue(String value) {
            this.value = Objects.requireNonNull(value, "String cannot be null");
        }

        @Override
        public ValueKind getKind() { return ValueKind.STRING; }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    // Frame line Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FrameLineValue extends Value {
        public static final String MASTER = "Master";
        public static final String AUX = "Aux";
        public static final String INACTIVE = "Inactive";
        public static final String PLACEHOLDER = "--";

        private final String frameLineId;
        private final String type;
        private final String name;
        private final int left;
        private final int top;
        private final int width;
        private final int height;

        FrameLineValue(String frameLineId, String type, String name, int left, int top, int width, int height) {
            this.frameLineId = Objects.requireNonNull(frameLineId, "Frame line id cannot be null");
            this.type = Objects.requireNonNull(type, "Frame line type cannot be null");
            this.name = name;
            this.left = left;
            this.top = top;
            this.width = width;
            this.height = height;
        }

        public boolean isActive() {
            return !INACTIVE.equals(type);
        }

        @Override
        public ValueKind getKind() { return ValueKind.FRAME_LINE; }

        @Override
        public boolean isComposite() {
            return true;
        }

        /**
         * Entries are namespaced by the frame line id, not by the field name: {@code FrameLine1AType},
         * {@code FrameLine1AName}, ... An inactive frame line reports the placeholder for every dimension.
         */
        @Override
        public Map<String, Value> namedValues(String fieldName) {
            var prefix = "FrameLine" + frameLineId;
            var result = new LinkedHashMap<String, Value>();
            result.put(prefix + "Type", Value.fromString(type));
            if (isActive()) {
                result.put(prefix + "Name", Value.fromString(name));
                result.put(prefix + "Left", Value.fromUnsigned(left));
                result.put(prefix + "Top", Value.fromUnsigned(top));
                result.put(prefix + "Width", Value.fromUnsigned(width));
                result.put(prefix + "Height", Value.fromUnsigned(height));
            } else {
                var placeholder = Value.fromString(PLACEHOLDER);
                result.put(prefix + "Name", placeholder);
                result.put(prefix + "Left", placeholder);
                result.put(prefix + "Top", placeholder);
                result.put(prefix + "Width", placeholder);
                result.put(prefix + "Height", placeholder);
            }
            return result;
        }

        @Override
        public Object toJava() {
            var result = new LinkedHashMap<String, Object>();
            namedValues(frameLineId).forEach((key, value) -> result.put(key, value.toJava()));
            return result;
        }

        @Override
        public String toString() {
            if (!isActive()) {
                return "FrameLine" + frameLineId + "{" + type + "}";
            }
            return "FrameLine" + frameLineId + "{" + type + ", '" + name + "', "
                    + left + ", " + top + ", " + width + ", " + height + "}";
        }
    }

    // Map Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class MapValue extends Value {
        private final Map<String, Value> value;

        public MapValue(Map<String, Value> value) {
            this.value = Collections.unmodifiableMap(
                    new LinkedHashMap<>(Objects.requireNonNull(value, "Map cannot be null")));
        }

        @Override
        public ValueKind getKind() { return ValueKind.MAP; }

        @Override
        public boolean isComposite() {
            return true;
        }

        /**
         * User fields are merged into the metadata map under their own keys.
         */
        @Override
        public Map<String, Value> namedValues(String fieldName) {
            return value;
        }

        @Override
        public Object toJava() {
            var result = new LinkedHashMap<String, Object>();
            value.forEach((key, entry) -> result.put(key, entry.toJava()));
            return result;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
