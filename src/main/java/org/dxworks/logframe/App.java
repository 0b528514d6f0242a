package org.dxworks.logframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.logframe.calc.ColumnCalculator;
import org.dxworks.logframe.model.TableResult;
import org.dxworks.logframe.model.TabularData;
import org.dxworks.logframe.reader.TableReader;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar logframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a directory of experiment files or a single file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported formats: " + String.join(", ", new TreeSet<>(ReaderRegistry.allFormatNames())));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        LogframeConfig config = LogframeConfig.load();
        List<Path> files = collectInputFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " input files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Files are independent; each one gets its own parser and calculator
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    TableResult result = convertFile(file, config);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error_type", e.getClass().getSimpleName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
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
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectInputFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> !p.getFileName().toString().startsWith("."))
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (BufferedReader reader = TextFiles.open(path)) {
            long count = reader.lines().limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // Unreadable files are reported by convertFile
            return true;
        }
    }

    /**
     * Reads one file in whichever supported format it has and applies the
     * configured derived columns.
     */
    public static TableResult convertFile(Path file, LogframeConfig config) throws IOException {
        Map<InputFormat, TableReader> readers = ReaderRegistry.buildReaders(config);
        InputFormat format = new FormatDetector(readers).detect(file);

        TabularData data;
        try (BufferedReader reader = TextFiles.open(file)) {
            data = readers.get(format).read(reader);
        }

        if (config.hasDerivedColumns()) {
            ColumnCalculator calculator = new ColumnCalculator(data);
            config.applyTo(calculator);
            data = calculator.toTabularData();
        }
        if (!config.getColumnOrder().isEmpty()) {
            data.orderColumns(config.getColumnOrder());
        }

        return TableResult.of(file.toString(), format.getName(), data);
    }
}
