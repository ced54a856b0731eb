package com.arriraw.types;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Datatype tags of header fields, each bound to exactly one {@link FieldDecoder}.
 * <p>
 * Scalar tags use struct-style letters ({@code B, H, I, Q, f, ...}); the header specific encodings
 * use names ({@code string, TStop, frameline, ...}).
 */
public enum DataType {
    UINT8(1, FieldDecoder.UINT8, "B"),
    INT8(1, FieldDecoder.INT8, "b"),
    UINT16(2, FieldDecoder.UINT16, "H"),
    INT16(2, FieldDecoder.INT16, "h"),
    UINT32(4, FieldDecoder.UINT32, "I", "L"),
    INT32(4, FieldDecoder.INT32, "i", "l"),
    UINT64(8, FieldDecoder.UINT64, "Q"),
    INT64(8, FieldDecoder.INT64, "q"),
    FLOAT32(4, FieldDecoder.FLOAT32, "f"),
    FLOAT64(8, FieldDecoder.FLOAT64, "d"),
    SCALED_FLOAT(4, FieldDecoder.SCALED_FLOAT, "float"),
    STRING(DataType.VARIABLE, FieldDecoder.STRING, "string"),
    USER_STRING(DataType.VARIABLE, FieldDecoder.USER_STRING, "UserString"),
    TIMECODE(4, FieldDecoder.TIMECODE, "timecode"),
    TSTOP(4, FieldDecoder.TSTOP, "TStop"),
    FRAME_LINE(4, FieldDecoder.FRAME_LINE, "frameline"),
    UUID(16, FieldDecoder.UUID, "uuid"),
    BITS(4, FieldDecoder.BITS, "bits"),
    DATE(4, FieldDecoder.BCD, "date"),
    TIME(4, FieldDecoder.BCD, "time"),
    OFFSET(4, FieldDecoder.BCD, "offset");

    /**
     * Width marker for tags whose byte length comes from the field descriptor.
     */
    public static final int VARIABLE = -1;

    private static final Map<String, DataType> LOOKUP = new HashMap<>();

    static {
        for (var type : values()) {
            for (var tag : type.tags) {
                LOOKUP.put(tag, type);
            }
        }
    }

    /**
     * Bytes consumed at the field offset, or {@link #VARIABLE}. For frame lines this is the minimum
     * (the type word); an active frame line reads further.
     */
    @Getter
    private final int width;

    @Getter
    private final FieldDecoder decoder;

    private final List<String> tags;

    DataType(int width, FieldDecoder decoder, String... tags) {
        this.width = width;
        this.decoder = decoder;
        this.tags = List.of(tags);
    }

    /**
     * The canonical tag as written in catalogs.
     */
    public String getTag() {
        return tags.get(0);
    }

    public boolean hasVariableWidth() {
        return width == VARIABLE;
    }

    /**
     * Composite datatypes emit several named entries and cannot carry an enumeration table.
     */
    public boolean isComposite() {
        return this == FRAME_LINE || this == USER_STRING;
    }

    public BcdLayout getBcdLayout() {
        switch (this) {
            case DATE:
                return BcdLayout.DATE;
            case TIME:
                return BcdLayout.TIME;
            case OFFSET:
                return BcdLayout.OFFSET;
            default:
                throw new IllegalStateException(this + " is not a BCD datatype");
        }
    }

    public static DataType fromTag(String tag) throws ArriException {
        var type = tag == null ? null : LOOKUP.get(tag);
        if (type == null) {
            throw new ArriException(ErrorType.INVALID_DATATYPE, "Unknown datatype tag: " + tag);
        }
        return type;
    }
}
