package com.tsparser.astdump;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsparser.ParseException;
import com.tsparser.Parser;
import com.tsparser.ToStringOptions;
import com.tsparser.ast.Program;
import com.tsparser.jackson.TsParserJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Parses a source file and prints it back, either re-serialized or as a JSON syntax tree.
 *
 * Usage:
 *   java -cp ... com.tsparser.astdump.AstDump [options] &lt;file&gt;
 *
 * Options:
 *   --mode=print|json  Output re-serialized source or the JSON tree (default: print)
 *   --compact          Compact source, or unindented JSON
 *   --no-types         Leave out type annotations when printing
 *   --no-comments      Leave out comments when printing
 */
public class AstDump {

    private static final Logger logger = LoggerFactory.getLogger(AstDump.class);

    private static final ObjectMapper mapper = TsParserJackson.createObjectMapper();

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.out);
            System.exit(1);
        }
        System.exit(new AstDump(config, System.out, System.err).run());
    }

    public AstDump(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /** Returns the process exit code: 0 on success, 1 if the file cannot be read or parsed. */
    public int run() {
        String source;
        try {
            source = Files.readString(config.file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Could not read {}: {}", config.file, e.getMessage());
            err.println("Error: could not read " + config.file);
            return 1;
        }

        Program program;
        try {
            program = Parser.parse(source);
        } catch (ParseException e) {
            logger.error("Parse failed for {}: {}", config.file, e.getMessage());
            err.println(config.file + ": " + e.getMessage());
            return 1;
        }

        if (config.mode == Mode.JSON) {
            try {
                String json = config.compact
                    ? mapper.writeValueAsString(program)
                    : mapper.writerWithDefaultPrettyPrinter().writeValueAsString(program);
                out.println(json);
            } catch (JsonProcessingException e) {
                logger.error("JSON output failed for {}", config.file, e);
                err.println("Error: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            out.print(program.toSource(config.toStringOptions()));
            if (config.compact) {
                out.println();
            }
        }
        return 0;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: AstDump [options] <file>");
        stream.println();
        stream.println("Options:");
        stream.println("  --mode=print|json  Output re-serialized source or the JSON tree (default: print)");
        stream.println("  --compact          Compact source, or unindented JSON");
        stream.println("  --no-types         Leave out type annotations when printing");
        stream.println("  --no-comments      Leave out comments when printing");
        stream.println("  --help             Show this help");
    }

    // ========== Inner classes ==========

    public enum Mode {
        PRINT, JSON
    }

    public static class Config {
        Mode mode = Mode.PRINT;
        boolean compact = false;
        boolean includeTypes = true;
        boolean includeComments = true;
        Path file;

        /** Returns null when the arguments are invalid or help was requested. */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + mode.toLowerCase(Locale.ROOT));
                        return null;
                    }
                } else if (arg.equals("--compact")) {
                    config.compact = true;
                } else if (arg.equals("--no-types")) {
                    config.includeTypes = false;
                } else if (arg.equals("--no-comments")) {
                    config.includeComments = false;
                } else if (!arg.startsWith("-")) {
                    if (config.file != null) {
                        err.println("Error: only one file may be given");
                        return null;
                    }
                    config.file = Path.of(arg);
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.file == null) {
                err.println("Error: No file specified");
                return null;
            }

            return config;
        }

        ToStringOptions toStringOptions() {
            return new ToStringOptions(!compact, includeTypes, includeComments);
        }

        public Mode getMode() {
            return mode;
        }

        public Path getFile() {
            return file;
        }
    }
}
