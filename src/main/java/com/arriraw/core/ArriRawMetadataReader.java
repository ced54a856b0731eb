package com.arriraw.core;

import com.arriraw.Constants;
import com.arriraw.catalog.CanonicalCatalogs;
import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.util.HeaderBuffer;
import com.arriraw.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads all nine metadata blocks of one ARRIRAW frame header.
 * <p>
 * The first {@value Constants#HEADER_BYTES} bytes of the source are loaded once, the byte order is
 * detected once, and one {@link BlockReader} per block decodes its fields from that shared header.
 * <p>
 * Usage:
 * <pre>
 *   var reader = ArriRawMetadataReader.open(Path.of("A001C001_000000.ari"));
 *   var metadata = reader.dictionary();
 *   var lens = metadata.get("LensModel");
 * </pre>
 */
public final class ArriRawMetadataReader {
    private static final Logger log = LoggerFactory.getLogger(ArriRawMetadataReader.class);

    @Getter
    private final HeaderBuffer header;
    @Getter
    private final ByteOrder byteOrder;
    private final Set<String> allowList;
    @Getter
    private final List<BlockReader> blockReaders;

    /**
     * Read the given header with caller supplied catalogs, in the given order.
     *
     * @param allowList names to extract, or null for every field
     */
    public ArriRawMetadataReader(HeaderBuffer header, List<FieldCatalog> catalogs,
                                 Set<String> allowList, ExtractionMode mode) throws ArriException {
        this.header = Objects.requireNonNull(header, "Header cannot be null");
        this.allowList = allowList == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(allowList));
        this.byteOrder = ByteOrderDetector.detect(header);
        log.debug("Header of {} bytes, byte order {}", header.limit(), byteOrder);

        var readers = new ArrayList<BlockReader>(catalogs.size());
        for (var catalog : catalogs) {
            readers.add(new BlockReader(catalog, new MetadataExtractor(header, byteOrder, this.allowList, mode)));
        }
        this.blockReaders = Collections.unmodifiableList(readers);
    }

    // ========== FACTORY METHODS ==========

    public static ArriRawMetadataReader open(Path path) throws ArriException {
        return open(path, null, ExtractionMode.STRICT);
    }

    public static ArriRawMetadataReader open(Path path, Set<String> allowList) throws ArriException {
        return open(path, allowList, ExtractionMode.STRICT);
    }

    public static ArriRawMetadataReader open(Path path, Set<String> allowList, ExtractionMode mode) throws ArriException {
        return withCanonicalCatalogs(loadHeader(path), allowList, mode);
    }

    public static ArriRawMetadataReader fromBytes(byte[] bytes, Set<String> allowList) throws ArriException {
        return withCanonicalCatalogs(HeaderBuffer.copyOf(truncate(bytes)), allowList, ExtractionMode.STRICT);
    }

    public static ArriRawMetadataReader fromStream(InputStream in, Set<String> allowList) throws ArriException {
        return withCanonicalCatalogs(readHeader(in, "stream"), allowList, ExtractionMode.STRICT);
    }

    /**
     * Read from any supported source: {@link Path}, {@link File}, {@code byte[]}, {@link ByteBuffer}
     * or {@link InputStream}. Streams are read but not closed.
     *
     * @throws ArriException with {@code INVALID_BUFFER_TYPE} for anything else
     */
    public static ArriRawMetadataReader read(Object source, Set<String> allowList, ExtractionMode mode)
            throws ArriException {
        return withCanonicalCatalogs(toHeader(source), allowList, mode);
    }

    /**
     * One-call convenience: the merged metadata of a file.
     */
    public static MetadataMap readMetadata(Path path, Set<String> allowList) throws ArriException {
        return open(path, allowList).dictionary();
    }

    private static ArriRawMetadataReader withCanonicalCatalogs(HeaderBuffer header, Set<String> allowList,
                                                               ExtractionMode mode) throws ArriException {
        return new ArriRawMetadataReader(header, new ArrayList<>(CanonicalCatalogs.all().values()), allowList, mode);
    }

    // ========== RESULTS ==========

    /**
     * Merged metadata of all blocks, in block order. A later block overwrites an earlier one on name collision.
     */
    public MetadataMap dictionary() {
        var merged = new MetadataMap();
        for (var reader : blockReaders) {
            merged.putAll(reader.getData());
        }
        return merged;
    }

    /**
     * {@link #dictionary()} as pretty printed JSON.
     */
    public String json() throws ArriException {
        try {
            return Json.MAPPER.writeValueAsString(dictionary().toJavaMap());
        } catch (JsonProcessingException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot serialize metadata: " + e.getMessage(), e);
        }
    }

    /**
     * Every field name declared by the catalogs, in block order, each name once. Independent of the allow-list.
     */
    public List<String> listFields() {
        var names = new LinkedHashSet<String>();
        for (var reader : blockReaders) {
            names.addAll(reader.listFieldNames());
        }
        return List.copyOf(names);
    }

    public BlockReader getBlockReader(BlockKind kind) {
        for (var reader : blockReaders) {
            if (reader.getName().equals(kind.name())) {
                return reader;
            }
        }
        return null;
    }

    public Set<String> getAllowList() {
        return allowList;
    }

    // ========== HEADER LOADING ==========

    static HeaderBuffer toHeader(Object source) throws ArriException {
        if (source instanceof Path) {
            return loadHeader((Path) source);
        }
        if (source instanceof File) {
            return loadHeader(((File) source).toPath());
        }
        if (source instanceof byte[]) {
            return HeaderBuffer.copyOf(truncate((byte[]) source));
        }
        if (source instanceof ByteBuffer) {
            var bytes = ((ByteBuffer) source).duplicate();
            if (bytes.remaining() > Constants.HEADER_BYTES) {
                bytes.limit(bytes.position() + Constants.HEADER_BYTES);
            }
            return HeaderBuffer.copyOf(bytes);
        }
        if (source instanceof InputStream) {
            return readHeader((InputStream) source, "stream");
        }
        throw new ArriException(ErrorType.INVALID_BUFFER_TYPE, "Source must be a path, file, byte array, "
                + "byte buffer or input stream, got " + (source == null ? "null" : source.getClass().getName()));
    }

    static HeaderBuffer loadHeader(Path path) throws ArriException {
        Objects.requireNonNull(path, "Path cannot be null");
        try (var in = Files.newInputStream(path)) {
            return readHeader(in, path.toString());
        } catch (NoSuchFileException | FileNotFoundException | AccessDeniedException e) {
            throw new ArriException(ErrorType.SOURCE_NOT_FOUND, "Cannot open " + path, e);
        } catch (IOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private static HeaderBuffer readHeader(InputStream in, String description) throws ArriException {
        try {
            var bytes = in.readNBytes(Constants.HEADER_BYTES);
            if (bytes.length < Constants.HEADER_BYTES) {
                log.debug("Source {} holds only {} header bytes", description, bytes.length);
            }
            return HeaderBuffer.copyOf(bytes);
        } catch (IOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot read " + description + ": " + e.getMessage(), e);
        }
    }

    private static byte[] truncate(byte[] bytes) {
        Objects.requireNonNull(bytes, "Header bytes cannot be null");
        return bytes.length > Constants.HEADER_BYTES ? Arrays.copyOf(bytes, Constants.HEADER_BYTES) : bytes;
    }
}
