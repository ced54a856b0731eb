package com.arriraw.core;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.types.Value;
import com.arriraw.util.HeaderBuffer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteOrder;
import java.util.Objects;
import java.util.Set;

/**
 * Walks a field catalog over one header and collects the decoded values.
 * <p>
 * For each field (optionally restricted to an allow-list of names) the extractor seeks to the
 * field's offset, resolves the byte order, runs the datatype's decoder, applies the enumeration
 * table and merges the result. The allow-list only decides which fields are decoded, never how.
 */
public final class MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private final HeaderBuffer buffer;
    @Getter
    private final ByteOrder byteOrder;
    private final Set<String> allowList;
    @Getter
    private final ExtractionMode mode;

    /**
     * @param header    shared header; the extractor works on its own cursor
     * @param byteOrder order detected for the file
     * @param allowList names to extract, or null for every field
     */
    public MetadataExtractor(HeaderBuffer header, ByteOrder byteOrder, Set<String> allowList, ExtractionMode mode) {
        this.buffer = Objects.requireNonNull(header, "Header cannot be null").duplicate();
        this.byteOrder = Objects.requireNonNull(byteOrder, "Byte order cannot be null");
        this.allowList = allowList == null ? null : Set.copyOf(allowList);
        this.mode = Objects.requireNonNull(mode, "Extraction mode cannot be null");
    }

    public MetadataExtractor(HeaderBuffer header, Set<String> allowList) throws ArriException {
        this(header, ByteOrderDetector.detect(header), allowList, ExtractionMode.STRICT);
    }

    public boolean isSelected(FieldDescriptor field) {
        return allowList == null || allowList.contains(field.getName());
    }

    public MetadataMap extract(FieldCatalog catalog) throws ArriException {
        var result = new MetadataMap();
        for (var field : catalog.getFields()) {
            if (!isSelected(field)) {
                continue;
            }
            try {
                result.putAll(decodeField(field).namedValues(field.getName()));
            } catch (ArriException e) {
                if (mode == ExtractionMode.BEST_EFFORT && e.getErrorType() == ErrorType.OUT_OF_RANGE) {
                    log.warn("Skipping field {} of {}: {}", field.getName(), catalog.getName(), e.getMessage());
                    continue;
                }
                throw e;
            }
        }
        log.debug("Extracted {} values from {}", result.size(), catalog.getName());
        return result;
    }

    /**
     * Decode a single field, enumeration table applied.
     */
    public Value decodeField(FieldDescriptor field) throws ArriException {
        if ((long) field.getOffset() + field.requiredLength() > buffer.limit()) {
            throw new ArriException(ErrorType.OUT_OF_RANGE, "Field " + field.getName() + " at offset 0x"
                    + Integer.toHexString(field.getOffset()) + " needs " + field.requiredLength()
                    + " bytes but the header has " + buffer.limit());
        }
        buffer.position(field.getOffset());
        var order = field.resolveOrder(byteOrder);
        var decoded = field.getDataType().getDecoder().decode(buffer, field, order);
        return field.applyEnumeration(decoded);
    }
}
