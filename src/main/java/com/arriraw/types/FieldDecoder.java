package com.arriraw.types;

import com.arriraw.core.FieldDescriptor;
import com.arriraw.error.ArriException;
import com.arriraw.util.HeaderBuffer;

import java.nio.ByteOrder;
import java.util.LinkedHashMap;

/**
 * Decodes one field from a header buffer that is already positioned at the field's offset.
 * <p>
 * Implementations are stateless; the same instance serves every field of its datatype, on any number
 * of buffers at once. The byte order passed in is already resolved (field override, else file order).
 */
public interface FieldDecoder {
    Value decode(HeaderBuffer buffer, FieldDescriptor field, ByteOrder order) throws ArriException;

    // Scalar numbers
    FieldDecoder UINT8 = (buffer, field, order) -> Value.fromUnsigned(buffer.getUInt8());
    FieldDecoder INT8 = (buffer, field, order) -> Value.fromSigned(buffer.getInt8());
    FieldDecoder UINT16 = (buffer, field, order) -> Value.fromUnsigned(buffer.getUInt16(order));
    FieldDecoder INT16 = (buffer, field, order) -> Value.fromSigned(buffer.getInt16(order));
    FieldDecoder UINT32 = (buffer, field, order) -> Value.fromUnsigned(buffer.getUInt32(order));
    FieldDecoder INT32 = (buffer, field, order) -> Value.fromSigned(buffer.getInt32(order));
    FieldDecoder UINT64 = (buffer, field, order) -> Value.fromUnsigned(buffer.getInt64(order));
    FieldDecoder INT64 = (buffer, field, order) -> Value.fromSigned(buffer.getInt64(order));
    FieldDecoder FLOAT32 = (buffer, field, order) -> Value.fromFloat(buffer.getFloat32(order));
    FieldDecoder FLOAT64 = (buffer, field, order) -> Value.fromFloat(buffer.getFloat64(order));

    /**
     * Unsigned thousandths, see {@link HeaderDecoders#scaledFloat(long, Integer, String)}.
     */
    FieldDecoder SCALED_FLOAT = (buffer, field, order) ->
            HeaderDecoders.scaledFloat(buffer.getUInt32(order), field.getDecimals(), field.getUnit());

    FieldDecoder STRING = (buffer, field, order) ->
            Value.fromString(HeaderDecoders.decodeText(buffer.getBytes(field.getLength()), order));

    /**
     * Free-form {@code key:value;...} text. Every well-formed pair becomes its own entry.
     */
    FieldDecoder USER_STRING = (buffer, field, order) -> {
        var text = HeaderDecoders.decodeText(buffer.getBytes(field.getLength()), order);
        var pairs = new LinkedHashMap<String, Value>();
        HeaderDecoders.splitUserString(text).forEach((key, value) -> pairs.put(key, Value.fromString(value)));
        return Value.fromMap(pairs);
    };

    FieldDecoder TIMECODE = (buffer, field, order) ->
            Value.fromString(HeaderDecoders.timecode(buffer.getBytes(4)));

    FieldDecoder TSTOP = (buffer, field, order) ->
            Value.fromString(HeaderDecoders.tStop(buffer.getInt32(order)));

    /**
     * Frame lines are always stored little-endian, whatever the file order. The type word decides the
     * shape: inactive frame lines stop after it, active ones carry a 32 byte name and four 16 bit
     * dimensions. The name text follows the resolved order like every other string.
     */
    FieldDecoder FRAME_LINE = (buffer, field, order) -> {
        long type = buffer.getUInt32(ByteOrder.LITTLE_ENDIAN);
        String label;
        if (type == 1) {
            label = Value.FrameLineValue.MASTER;
        } else if (type == 2) {
            label = Value.FrameLineValue.AUX;
        } else {
            return Value.inactiveFrameLine(field.getFrameLineId());
        }
        var name = HeaderDecoders.decodeText(buffer.getBytes(32), order);
        int left = buffer.getUInt16(ByteOrder.LITTLE_ENDIAN);
        int top = buffer.getUInt16(ByteOrder.LITTLE_ENDIAN);
        int width = buffer.getUInt16(ByteOrder.LITTLE_ENDIAN);
        int height = buffer.getUInt16(ByteOrder.LITTLE_ENDIAN);
        return Value.activeFrameLine(field.getFrameLineId(), label, name, left, top, width, height);
    };

    FieldDecoder UUID = (buffer, field, order) ->
            Value.fromString(HeaderDecoders.uuid(buffer.getBytes(16)));

    FieldDecoder BITS = (buffer, field, order) ->
            Value.fromUnsigned(HeaderDecoders.extractBits(buffer.getUInt32(order), field.getBitPositions()));

    /**
     * Shared by the date, time and offset datatypes; the field's datatype picks the layout.
     */
    FieldDecoder BCD = (buffer, field, order) -> {
        var layout = field.getDataType().getBcdLayout();
        return Value.fromString(HeaderDecoders.bcd(buffer.getBytes(4), layout, layout.getSeparator(),
                order, field.getPrefix()));
    };
}
