package com.arriraw.catalog;

import com.arriraw.core.FieldCatalog;
import com.arriraw.core.FieldDescriptor;
import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.types.DataType;
import com.arriraw.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Reads field catalogs from JSON.
 * <pre>
 * { "block": "CDI",
 *   "fields": [
 *     { "name": "CameraId", "offset": "0x0174", "datatype": "string", "length": 4, "endianness": "&lt;" },
 *     { "name": "Vari", "offset": "0x02C4", "datatype": "bits", "bit_position": 1,
 *       "mapping": { "0": "Valid Image", "1": "Duplicate Image" } } ] }
 * </pre>
 * {@code bit_position} may be a single index or a list; both end up as one sorted index set.
 */
@UtilityClass
public final class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    public static FieldCatalog load(InputStream in) throws ArriException {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Unreadable catalog: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Catalog must be a JSON object");
        }
        var name = root.path("block").asText("custom");
        var fieldsNode = root.path("fields");
        if (!fieldsNode.isArray()) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Catalog " + name + " has no 'fields' array");
        }
        var fields = new ArrayList<FieldDescriptor>(fieldsNode.size());
        for (var fieldNode : fieldsNode) {
            fields.add(parseField(fieldNode));
        }
        log.debug("Loaded catalog {} with {} fields", name, fields.size());
        return new FieldCatalog(name, fields);
    }

    public static FieldCatalog loadResource(String resourceName) throws ArriException {
        try (var in = CatalogLoader.class.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new ArriException(ErrorType.CATALOG_ERROR, "Catalog resource not found: " + resourceName);
            }
            return load(in);
        } catch (IOException e) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Cannot read catalog resource " + resourceName, e);
        }
    }

    static FieldDescriptor parseField(JsonNode node) throws ArriException {
        var name = requiredText(node, "name");
        var builder = FieldDescriptor.builder(name, parseOffset(node.get("offset"), name),
                DataType.fromTag(requiredText(node, "datatype")));

        if (node.hasNonNull("length")) {
            builder.length(node.get("length").asInt());
        }
        if (node.hasNonNull("endianness")) {
            builder.byteOrder(parseByteOrder(node.get("endianness").asText(), name));
        }
        var bits = node.get("bit_position");
        if (bits != null && !bits.isNull()) {
            if (bits.isArray()) {
                for (var bit : bits) {
                    builder.bitPositions(bit.asInt());
                }
            } else {
                builder.bitPositions(bits.asInt());
            }
        }
        var mapping = node.get("mapping");
        if (mapping != null && mapping.isObject()) {
            var entries = mapping.fields();
            while (entries.hasNext()) {
                var entry = entries.next();
                try {
                    builder.mapping(Long.parseLong(entry.getKey().trim()), entry.getValue().asText());
                } catch (NumberFormatException e) {
                    throw new ArriException(ErrorType.CATALOG_ERROR,
                            "Field '" + name + "': mapping key is not an integer: " + entry.getKey(), e);
                }
            }
        }
        if (node.hasNonNull("decimals")) {
            builder.decimals(node.get("decimals").asInt());
        }
        if (node.hasNonNull("unit")) {
            builder.unit(node.get("unit").asText());
        }
        if (node.hasNonNull("prefix")) {
            builder.prefix(node.get("prefix").asText());
        }
        if (node.hasNonNull("number")) {
            builder.frameLineId(node.get("number").asText());
        }
        return builder.build();
    }

    static int parseOffset(JsonNode node, String fieldName) throws ArriException {
        if (node == null || node.isNull()) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Field '" + fieldName + "' has no offset");
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        var text = node.asText().trim().toLowerCase(Locale.ROOT);
        try {
            return text.startsWith("0x") ? Integer.parseInt(text.substring(2), 16) : Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ArriException(ErrorType.CATALOG_ERROR,
                    "Field '" + fieldName + "' has an invalid offset: " + node.asText(), e);
        }
    }

    static ByteOrder parseByteOrder(String token, String fieldName) throws ArriException {
        switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "<":
            case "little":
                return ByteOrder.LITTLE_ENDIAN;
            case ">":
            case "big":
                return ByteOrder.BIG_ENDIAN;
            default:
                throw new ArriException(ErrorType.CATALOG_ERROR,
                        "Field '" + fieldName + "' has an invalid endianness: " + token);
        }
    }

    private static String requiredText(JsonNode node, String key) throws ArriException {
        var value = node.get(key);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new ArriException(ErrorType.CATALOG_ERROR, "Catalog field is missing '" + key + "': " + node);
        }
        return value.asText();
    }
}
