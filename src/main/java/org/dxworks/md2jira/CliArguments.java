package org.dxworks.md2jira;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command line. Unknown switches and missing values raise {@link IllegalArgumentException}.
 */
public final class CliArguments {

    static final String STDIN = "-";

    private Path input;
    private Path output;
    private Path config;
    private boolean verbose;
    private boolean preserveHtml;
    private boolean json;
    private boolean help;
    private boolean version;
    private boolean explicitStdin;

    private CliArguments() {}

    public static CliArguments parse(String... args) {
        CliArguments parsed = new CliArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> parsed.output = Paths.get(valueOf(args, ++i, arg));
                case "--config" -> parsed.config = Paths.get(valueOf(args, ++i, arg));
                case "--verbose", "-v" -> parsed.verbose = true;
                case "--preserve-html" -> parsed.preserveHtml = true;
                case "--json" -> parsed.json = true;
                case "-h", "--help" -> parsed.help = true;
                case "--version" -> parsed.version = true;
                default -> {
                    if (arg.startsWith("-") && !STDIN.equals(arg)) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (parsed.input != null || parsed.explicitStdin) {
                        throw new IllegalArgumentException("Only one input may be given, got extra " + arg);
                    }
                    if (STDIN.equals(arg)) {
                        parsed.explicitStdin = true;
                    } else {
                        parsed.input = Paths.get(arg);
                    }
                }
            }
        }
        return parsed;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    /** Input file or directory; null means standard input. */
    public Path getInput() {
        return input;
    }

    /** Output file (or directory for directory input); null means standard output. */
    public Path getOutput() {
        return output;
    }

    public Path getConfig() {
        return config;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isPreserveHtml() {
        return preserveHtml;
    }

    public boolean isJson() {
        return json;
    }

    public boolean isHelp() {
        return help;
    }

    public boolean isVersion() {
        return version;
    }

    public boolean isExplicitStdin() {
        return explicitStdin;
    }
}
