package com.arriraw.cli;

import com.arriraw.error.ArriException;
import com.arriraw.error.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds frame files below a directory.
 * <p>
 * Frame sequences store one file per frame in the same directory. With multipart suppression only
 * the first matching file of each directory is returned, which is enough since all frames of a
 * clip share the same header metadata.
 */
public final class FileFinder {
    private static final Logger log = LoggerFactory.getLogger(FileFinder.class);

    private final List<String> extensions;
    private final boolean ignoreMultipart;

    public FileFinder(List<String> extensions, boolean ignoreMultipart) {
        this.extensions = List.copyOf(extensions);
        this.ignoreMultipart = ignoreMultipart;
    }

    public FileFinder(List<String> extensions) {
        this(extensions, true);
    }

    public List<Path> find(Path root) throws ArriException {
        List<Path> candidates;
        try (var walk = Files.walk(root)) {
            candidates = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot scan " + root + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new ArriException(ErrorType.IO_ERROR, "Cannot scan " + root + ": " + e.getMessage(), e.getCause());
        }

        var result = new ArrayList<Path>();
        var seenDirectories = new HashSet<Path>();
        for (var file : candidates) {
            if (!matches(file)) {
                continue;
            }
            if (ignoreMultipart && !seenDirectories.add(file.getParent())) {
                continue;
            }
            result.add(file);
        }
        if (result.isEmpty()) {
            throw new ArriException(ErrorType.NO_MATCHING_FILES,
                    "No files with the extensions " + String.join(" ", extensions) + " were found.");
        }
        log.debug("Found {} files below {}", result.size(), root);
        return result;
    }

    boolean matches(Path file) {
        var name = file.getFileName().toString();
        for (var extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
