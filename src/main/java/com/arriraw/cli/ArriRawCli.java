package com.arriraw.cli;

import com.arriraw.core.ArriRawMetadataReader;
import com.arriraw.core.MetadataMap;
import com.arriraw.error.ArriException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Extracts header metadata from every frame file below a directory and writes one output file per input.
 * <pre>
 *   java -jar arriraw-metadata-reader.jar -i /media/A001 -o /tmp/out -ofmt csv -f all -v
 * </pre>
 */
public class ArriRawCli {
    private static final Logger log = LoggerFactory.getLogger(ArriRawCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_BAD_ARGS = 2;

    private static final String[] ARG_INPUT = {"-i", "--inputpath"};
    private static final String[] ARG_VERBOSE = {"-v", "--verbose"};
    private static final String[] ARG_CONFIG = {"-c", "--config"};
    private static final String[] ARG_OUTPUT = {"-o", "--outputpath"};
    private static final String[] ARG_FORMAT = {"-ofmt", "--outputformat"};
    private static final String[] ARG_FIELDS = {"-f", "--fields"};
    private static final String[] ARG_HELP = {"-h", "--help"};

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDirectory;

    public ArriRawCli(PrintStream out, PrintStream err, Path workingDirectory) {
        this.out = out;
        this.err = err;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        var cli = new ArriRawCli(System.out, System.err, Paths.get("").toAbsolutePath());
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (findArg(args, ARG_HELP)) {
            usage(out);
            return EXIT_OK;
        }
        var input = getArg(args, ARG_INPUT);
        if (input == null) {
            err.println("No input path specified; specify with: -i path");
            usage(err);
            return EXIT_BAD_ARGS;
        }
        OutputFormat format;
        FieldSelection selection;
        try {
            format = OutputFormat.fromOption(valueOr(getArg(args, ARG_FORMAT), "json"));
            selection = FieldSelection.fromOption(valueOr(getArg(args, ARG_FIELDS), "default"));
        } catch (IllegalArgumentException e) {
            err.println("Invalid option value: " + e.getMessage());
            usage(err);
            return EXIT_BAD_ARGS;
        }
        boolean verbose = findArg(args, ARG_VERBOSE);
        var configArg = getArg(args, ARG_CONFIG);
        var outputArg = getArg(args, ARG_OUTPUT);
        var outputDirectory = outputArg == null ? workingDirectory : workingDirectory.resolve(stripQuotes(outputArg));

        try {
            var config = ReaderConfig.resolve(configArg == null ? null : workingDirectory.resolve(configArg),
                    workingDirectory);
            var inputPath = workingDirectory.resolve(stripQuotes(input));
            out.println("Input path: " + inputPath);
            process(inputPath, outputDirectory, config, config.fieldsFor(selection), format, verbose);
            return EXIT_OK;
        } catch (ArriException e) {
            log.error("Extraction failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    void process(Path inputPath, Path outputDirectory, ReaderConfig config, Set<String> fields,
                 OutputFormat format, boolean verbose) throws ArriException {
        var files = new FileFinder(config.getSupportedFiles()).find(inputPath);
        for (var file : files) {
            out.println("Processing: " + file);
            var metadata = ArriRawMetadataReader.readMetadata(file, fields);
            if (verbose) {
                print(metadata);
            }
            var target = outputDirectory.resolve(baseName(file) + "." + format.extension());
            MetadataExporter.write(format, target, metadata);
            log.debug("Wrote {} values to {}", metadata.size(), target);
        }
    }

    private void print(MetadataMap metadata) {
        metadata.asMap().forEach((name, value) -> out.println(String.format("Key: %-32s -- Value: %s", name, value)));
    }

    static String baseName(Path file) {
        var name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String stripQuotes(String path) {
        var result = path;
        while (result.startsWith("'") || result.startsWith("\"")) {
            result = result.substring(1);
        }
        while (result.endsWith("'") || result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String valueOr(String value, String fallback) {
        return value == null ? fallback : value;
    }

    private static void usage(PrintStream stream) {
        stream.println("Usage: arriraw-metadata-reader -i <path> [options]");
        stream.println("  -i, --inputpath <path>         directory containing the files to be processed");
        stream.println("  -v, --verbose                  print every extracted value");
        stream.println("  -c, --config <file>            config file (default: ./config.json or the bundled one)");
        stream.println("  -o, --outputpath <dir>         output directory (default: working directory)");
        stream.println("  -ofmt, --outputformat <fmt>    json | csv (default: json)");
        stream.println("  -f, --fields <set>             all | minimal | default (default: default)");
    }

    static boolean findArg(String[] args, String[] names) {
        for (var arg : args) {
            for (var name : names) {
                if (arg.equals(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String getArg(String[] args, String[] names) {
        for (int i = 0; i < args.length; i++) {
            for (var name : names) {
                if (args[i].equals(name)) {
                    return i + 1 < args.length ? args[i + 1] : null;
                }
            }
        }
        return null;
    }
}
