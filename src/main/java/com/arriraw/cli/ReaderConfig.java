package com.arriraw.cli;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import com.arriraw.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings of the command line tool: which file extensions to scan for and the named field lists.
 * <pre>
 * { "supported_files": [".ari"],
 *   "defaultfields": ["CameraModel", "LensModel"],
 *   "minimal": ["CameraClipName"] }
 * </pre>
 */
@Getter
public final class ReaderConfig {
    private static final Logger log = LoggerFactory.getLogger(ReaderConfig.class);

    public static final String SUPPORTED_FILES = "supported_files";
    public static final String DEFAULT_FIELDS = "defaultfields";
    public static final String MINIMAL = "minimal";
    public static final String DEFAULT_RESOURCE = "/config.json";
    public static final String DEFAULT_FILE_NAME = "config.json";

    private final List<String> supportedFiles;
    private final Set<String> defaultFields;
    /** Null when the config defines no minimal list. */
    private final Set<String> minimalFields;

    public ReaderConfig(List<String> supportedFiles, Set<String> defaultFields, Set<String> minimalFields) {
        this.supportedFiles = List.copyOf(supportedFiles);
        this.defaultFields = Set.copyOf(defaultFields);
        this.minimalFields = minimalFields == null ? null : Set.copyOf(minimalFields);
    }

    public static ReaderConfig load(Path path) throws ArriException {
        try (var in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ArriException(ErrorType.CONFIG_ERROR, "Error loading " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * The config shipped with the tool.
     */
    public static ReaderConfig loadDefault() throws ArriException {
        try (var in = ReaderConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ArriException(ErrorType.CONFIG_ERROR, "Default config resource not found");
            }
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ArriException(ErrorType.CONFIG_ERROR, "Error loading default config: " + e.getMessage(), e);
        }
    }

    /**
     * An explicit path wins; otherwise {@code config.json} in the working directory, otherwise the bundled default.
     */
    public static ReaderConfig resolve(Path explicit, Path workingDirectory) throws ArriException {
        if (explicit != null) {
            return load(explicit);
        }
        var local = workingDirectory.resolve(DEFAULT_FILE_NAME);
        if (Files.isRegularFile(local)) {
            return load(local);
        }
        return loadDefault();
    }

    static ReaderConfig load(InputStream in, String description) throws ArriException {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ArriException(ErrorType.CONFIG_ERROR, "Error loading " + description + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ArriException(ErrorType.CONFIG_ERROR, "Config " + description + " must be a JSON object");
        }
        var missing = new ArrayList<String>();
        for (var key : List.of(SUPPORTED_FILES, DEFAULT_FIELDS)) {
            if (!root.has(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Invalid config file {}. Missing keys: {}", description, missing);
        }
        var minimal = root.has(MINIMAL) ? new LinkedHashSet<>(textList(root, MINIMAL)) : null;
        return new ReaderConfig(textList(root, SUPPORTED_FILES), new LinkedHashSet<>(textList(root, DEFAULT_FIELDS)),
                minimal);
    }

    /**
     * Allow-list for a {@code --fields} choice; null means every field.
     */
    public Set<String> fieldsFor(FieldSelection selection) throws ArriException {
        switch (selection) {
            case ALL:
                return null;
            case MINIMAL:
                if (minimalFields == null) {
                    throw new ArriException(ErrorType.CONFIG_ERROR, "Config defines no '" + MINIMAL + "' field list");
                }
                return minimalFields;
            case DEFAULT:
            default:
                return defaultFields;
        }
    }

    private static List<String> textList(JsonNode root, String key) throws ArriException {
        var node = root.path(key);
        var result = new ArrayList<String>();
        if (node.isMissingNode() || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new ArriException(ErrorType.CONFIG_ERROR, "Config key '" + key + "' must be a list");
        }
        for (var item : node) {
            result.add(item.asText());
        }
        return result;
    }
}
