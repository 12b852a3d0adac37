package com.godzilla.cli;

import com.godzilla.Emitter;
import com.godzilla.EmitterOptions;
import com.godzilla.EmitterOptions.DeclarationMode;
import com.godzilla.UnsupportedNodeException;
import com.godzilla.ast.File;
import com.godzilla.jackson.JacksonAstJsonProvider;
import com.godzilla.json.AstJsonDeserializer;
import com.godzilla.json.AstJsonException;
import com.godzilla.source.Code;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an ESTree JSON document and prints either the reconstructed source or
 * the compiled Go text.
 *
 * Usage:
 *   java -cp ... com.godzilla.cli.GodzillaCli [options] [file]
 *
 * Options:
 *   --mode=source|go                Output to produce (default: go)
 *   --declarations=emit|skip|fail   Declaration handling when compiling (default: emit)
 *
 * Without a file the document is read from standard input.
 *
 * Exit codes: 0 success, 1 usage error, 2 the document could not be decoded or compiled.
 */
public class GodzillaCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final AstJsonDeserializer deserializer;

    public GodzillaCli() {
        this(new JacksonAstJsonProvider().getDeserializer());
    }

    GodzillaCli(AstJsonDeserializer deserializer) {
        this.deserializer = deserializer;
    }

    public static void main(String[] args) {
        int exitCode = new GodzillaCli().run(args, System.in, System.out, System.err);
        System.exit(exitCode);
    }

    /**
     * Runs the tool against the given streams and returns the process exit code.
     */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        if (config.help) {
            printUsage(out);
            return EXIT_OK;
        }

        File file;
        try {
            file = config.input == null
                ? deserializer.deserializeFile(in)
                : readFile(config.input);
        } catch (AstJsonException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: cannot read " + config.input + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            if (config.mode == Mode.SOURCE) {
                out.println(file.toSource());
            } else {
                new Emitter(new EmitterOptions(config.declarations)).compile(file, Code.of(out));
            }
        } catch (UnsupportedNodeException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        out.flush();
        return EXIT_OK;
    }

    private File readFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return deserializer.deserializeFile(in);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: GodzillaCli [options] [file]");
        stream.println();
        stream.println("Options:");
        stream.println("  --mode=source|go               Output to produce (default: go)");
        stream.println("  --declarations=emit|skip|fail  Declaration handling when compiling (default: emit)");
        stream.println("  --help                         Show this help");
        stream.println();
        stream.println("Reads the JSON document from standard input when no file is given.");
        stream.println();
        stream.println("Examples:");
        stream.println("  GodzillaCli --mode=source hello.json");
        stream.println("  babel-parse hello.js | GodzillaCli --declarations=fail");
    }

    public enum Mode {
        SOURCE,
        GO
    }

    static class Config {
        Mode mode = Mode.GO;
        DeclarationMode declarations = EmitterOptions.defaults().declarations();
        Path input;
        boolean help = false;

        static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase();
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.startsWith("--declarations=")) {
                    try {
                        config.declarations = DeclarationMode.parse(arg.substring(15));
                    } catch (IllegalArgumentException e) {
                        err.println(e.getMessage());
                        return null;
                    }
                } else if (!arg.startsWith("-")) {
                    if (config.input != null) {
                        err.println("Error: only one input file may be given");
                        return null;
                    }
                    config.input = Path.of(arg);
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            return config;
        }
    }
}
