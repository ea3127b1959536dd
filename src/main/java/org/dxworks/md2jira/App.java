package org.dxworks.md2jira;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.md2jira.converter.ConversionOptions;
import org.dxworks.md2jira.converter.MarkdownToJiraConverter;
import org.dxworks.md2jira.model.ConversionResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    static final String VERSION = "1.0.0";
    static final String REPORT_FILE_NAME = "md2jira-report.jsonl";
    static final String OUTPUT_EXTENSION = ".jira";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean interactive;

    App(InputStream stdin, PrintStream out, PrintStream err, boolean interactive) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
        this.interactive = interactive;
    }

    public static void main(String[] args) {
        App app = new App(System.in, System.out, System.err, System.console() != null);
        System.exit(app.run(args));
    }

    int run(String... args) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        if (cli.isVersion()) {
            out.println("md2jira version " + VERSION);
            return EXIT_OK;
        }
        if (cli.isHelp()) {
            printUsage(out);
            return EXIT_OK;
        }

        if (cli.getConfig() != null && !Files.isRegularFile(cli.getConfig())) {
            err.println("Error: Config file does not exist: " + cli.getConfig());
            return EXIT_FAILURE;
        }
        Md2JiraConfig config = cli.getConfig() != null ? Md2JiraConfig.load(cli.getConfig()) : Md2JiraConfig.load();
        ConversionOptions options = config.toOptions(cli.isPreserveHtml(), cli.isVerbose());
        MarkdownToJiraConverter converter = new MarkdownToJiraConverter(options);

        Path input = cli.getInput();
        if (input != null && !Files.exists(input)) {
            err.println("Error: Input path does not exist: " + input);
            return EXIT_FAILURE;
        }
        if (input == null && !cli.isExplicitStdin() && interactive) {
            printUsage(err);
            return EXIT_USAGE;
        }

        try {
            if (input != null && Files.isDirectory(input)) {
                if (cli.getOutput() == null) {
                    err.println("Error: Converting a directory requires -o <output-directory>");
                    return EXIT_USAGE;
                }
                return convertDirectory(converter, input, cli.getOutput());
            }
            return convertSingle(converter, cli, input);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int convertSingle(MarkdownToJiraConverter converter, CliArguments cli, Path input) throws IOException {
        ConversionResult result = input != null
                ? converter.convertFile(input)
                : converter.convertWithWarnings(MarkdownToJiraConverter.decode(stdin.readAllBytes()));

        if (cli.isVerbose() && result.hasWarnings()) {
            err.println("Warnings:");
            for (String warning : result.getWarnings()) {
                err.println("  - " + warning);
            }
            err.println();
        }

        String rendered = cli.isJson() ? MAPPER.writeValueAsString(result) : result.getOutput();
        Path output = cli.getOutput();
        if (output != null) {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
        } else {
            out.println(rendered);
        }
        return EXIT_OK;
    }

    private int convertDirectory(MarkdownToJiraConverter converter, Path inputDir, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> files = collectMarkdownFiles(inputDir);

        out.println("Converting " + files.size() + " Markdown files from " + inputDir.toAbsolutePath());

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        Map<Path, Path> targetOwners = new LinkedHashMap<>();
        for (Path file : files) {
            targetOwners.putIfAbsent(targetFor(inputDir, outputDir, file), file);
        }

        Path report = outputDir.resolve(REPORT_FILE_NAME);
        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", inputDir.toString());
            runInfo.put("total_files", files.size());
            writeRecord(writer, runInfo);

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (out) {
                    out.println("[" + current + "/" + files.size() + "] Converting " + inputDir.relativize(file));
                }

                Path target = targetFor(inputDir, outputDir, file);
                try {
                    Path owner = targetOwners.get(target);
                    if (!owner.equals(file)) {
                        throw new IOException("Output " + target + " is already written from " + owner);
                    }
                    ConversionResult result = converter.convertFileToFile(file, target);

                    Map<String, Object> fileInfo = new LinkedHashMap<>();
                    fileInfo.put("kind", "file");
                    fileInfo.put("file", file.toString());
                    fileInfo.put("output", target.toString());
                    fileInfo.put("warnings", result.getWarnings());
                    writeRecord(writer, fileInfo);

                    if (converter.getOptions().isVerbose()) {
                        synchronized (err) {
                            result.getWarnings().forEach(w -> err.println("  " + file.getFileName() + ": " + w));
                        }
                    }
                    successCount.incrementAndGet();
                } catch (IOException e) {
                    Map<String, Object> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());
                    try {
                        writeRecord(writer, error);
                    } catch (IOException ioException) {
                        synchronized (err) {
                            err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                        }
                    }

                    errorCount.incrementAndGet();
                    synchronized (err) {
                        err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }

        out.println("Converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            out.println("Errors: " + errorCount.get());
        }
        out.println("Report written to: " + report.toAbsolutePath());
        return errorCount.get() > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    // Parallel workers share one report writer, hence the lock.
    private static void writeRecord(BufferedWriter writer, Map<String, Object> record) throws IOException {
        String line = MAPPER.writeValueAsString(record);
        synchronized (writer) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }

    static List<Path> collectMarkdownFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(dir)) {
            stream.filter(Files::isRegularFile)
                  .filter(App::isMarkdownFile)
                  .sorted()
                  .forEach(files::add);
        }
        return files;
    }

    static boolean isMarkdownFile(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".md") || fileName.endsWith(".markdown");
    }

    static Path targetFor(Path inputDir, Path outputDir, Path file) {
        Path relative = inputDir.relativize(file);
        String fileName = relative.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path parent = relative.getParent();
        Path targetDir = parent == null ? outputDir : outputDir.resolve(parent.toString());
        return targetDir.resolve(baseName + OUTPUT_EXTENSION);
    }

    private static void printUsage(PrintStream stream) {
        stream.println("md2jira - Markdown to JIRA Markup Converter");
        stream.println();
        stream.println("Usage:");
        stream.println("  java -jar md2jira.jar [options] [input.md | input-dir | -]");
        stream.println("  cat file.md | java -jar md2jira.jar");
        stream.println();
        stream.println("Options:");
        stream.println("  -o <path>         Output file, or output directory for directory input (default: stdout)");
        stream.println("  --verbose         Show conversion warnings on stderr");
        stream.println("  --preserve-html   Keep raw HTML blocks instead of converting them (inline tags are always converted)");
        stream.println("  --json            Print {\"output\": ..., \"warnings\": [...]} instead of plain text");
        stream.println("  --config <file>   YAML config (default: ./" + Md2JiraConfig.CONFIG_FILE_NAME + " if present)");
        stream.println("  --version         Show version information");
        stream.println("  -h, --help        Show this help");
    }
}
