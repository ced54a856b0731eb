package com.arriraw.cli;

import com.arriraw.core.MetadataMap;
import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.util.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one file's metadata as JSON or as a tab separated table.
 */
public final class MetadataExporter {

    private MetadataExporter() {}

    public static void write(OutputFormat format, Path target, MetadataMap metadata) throws ArriException {
        try {
            Files.writeString(target, render(format, metadata), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    public static String render(OutputFormat format, MetadataMap metadata) throws ArriException {
        switch (format) {
            case CSV:
                return toCsv(metadata);
            case JSON:
            default:
                return toJson(metadata);
        }
    }

    static String toJson(MetadataMap metadata) throws ArriException {
        try {
            return Json.MAPPER.writeValueAsString(metadata.toJavaMap());
        } catch (IOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot serialize metadata: " + e.getMessage(), e);
        }
    }

    /**
     * One column table indexed by field name: a header row {@code <TAB>0}, then {@code name<TAB>value}.
     */
    static String toCsv(MetadataMap metadata) {
        var sb = new StringBuilder();
        sb.append('\t').append('0').append('\n');
        metadata.asMap().forEach((name, value) ->
                sb.append(escape(name)).append('\t').append(escape(value.toString())).append('\n'));
        return sb.toString();
    }

    /**
     * Quotes cells containing the separator, a quote or a line break; embedded quotes are doubled.
     */
    static String escape(String cell) {
        var doubled = cell.replace("\"", "\"\"");
        if (doubled.indexOf('\t') >= 0 || doubled.indexOf('"') >= 0
                || doubled.indexOf('\r') >= 0 || doubled.indexOf('\n') >= 0) {
            return "\"" + doubled + "\"";
        }
        return doubled;
    }
}
