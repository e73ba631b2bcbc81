package dumb.natded;

import dumb.natded.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        var err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);
        System.exit(run(args, in, out, err));
    }

    /**
     * Parses the formula given as arguments, or runs the interactive loop when there is none.
     *
     * @return the process exit status
     */
    static int run(String[] args, BufferedReader in, PrintWriter out, PrintWriter err) {
        Path configFile = null;
        Boolean json = null, showFree = null;
        List<String> words = new ArrayList<>();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "-j", "--json" -> json = true;
                    case "-f", "--free" -> showFree = true;
                    case "-h", "--help" -> {
                        printUsage(out);
                        return EXIT_OK;
                    }
                    default -> {
                        if (args[i].startsWith("--") || (args[i].startsWith("-") && !args[i].startsWith("->"))) {
                            logger.warn("Unknown option: {}", args[i]);
                            printUsage(err);
                            return EXIT_USAGE;
                        }
                        words.add(args[i]);
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                err.printf("Missing value for %s%n", args[i - 1]);
                printUsage(err);
                return EXIT_USAGE;
            }
        }

        var config = Config.DEFAULT;
        if (configFile != null) {
            try {
                config = Config.load(configFile);
                logger.debug("Loaded {} from {}", config, configFile);
            } catch (IOException e) {
                logger.error("Cannot read configuration {}: {}", configFile, e.getMessage());
                return EXIT_USAGE;
            }
        }
        if (json != null) config = config.withJson(json);
        if (showFree != null) config = config.withShowFree(showFree);

        if (words.isEmpty()) {
            try {
                new Repl(in, out, err, config).run();
                return EXIT_OK;
            } catch (IOException e) {
                logger.error("Error reading input: {}", e.getMessage(), e);
                return EXIT_FAILURE;
            }
        }

        var text = String.join(" ", words);
        try {
            var f = Logic.parse(text);
            out.println(config.json() ? Json.str(f.toJson()) : f.toText());
            if (config.showFree()) out.println("free: {" + String.join(", ", f.freeVars()) + "}");
            out.flush();
            return EXIT_OK;
        } catch (SyntaxException e) {
            err.println("error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    private static void printUsage(PrintWriter w) {
        w.printf("Usage: java %s [-c config.json] [-j|--json] [-f|--free] [formula...]%n", Main.class.getName());
        w.println("Without a formula, reads commands from standard input; type 'help' there for the syntax.");
        w.flush();
    }
}
