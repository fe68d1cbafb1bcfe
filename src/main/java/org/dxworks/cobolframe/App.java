package org.dxworks.cobolframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolframe.analyzer.cobol.CallExtractor;
import org.dxworks.cobolframe.analyzer.cobol.CobolProgramParser;
import org.dxworks.cobolframe.model.cobol.COBOLDivision;
import org.dxworks.cobolframe.model.cobol.COBOLProgram;
import org.dxworks.cobolframe.render.DiagramRenderer;
import org.dxworks.cobolframe.render.MermaidCallGraphRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar cobolframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a COBOL source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting COBOL structure analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        RunSummary summary = run(input, jsonlOutput, CobolframeConfig.load());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + summary.analyzed + " files");
        if (summary.errors > 0) {
            System.out.println("Errors: " + summary.errors);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Parses every COBOL file under {@code input} in parallel and writes one JSON line per program.
     */
    public static RunSummary run(Path input, Path jsonlOutput, CobolframeConfig config) throws IOException {
        CobolProgramParser parser = new CobolProgramParser(
                config.getSourceFormat(), new CallExtractor(config.getTransferKeywords()));
        return run(input, jsonlOutput, config, parser);
    }

    static RunSummary run(Path input, Path jsonlOutput, CobolframeConfig config, CobolProgramParser parser)
            throws IOException {
        CobolSourceCollector collector = new CobolSourceCollector(config);
        DiagramRenderer renderer = config.isEmitMermaid() ? new MermaidCallGraphRenderer() : null;

        List<Path> files = collector.collect(input);
        System.out.println("Found " + files.size() + " COBOL source files");

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
            writeLine(writer, runInfo);

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                try {
                    COBOLProgram program = parser.parse(file.toString(), CobolSourceCollector.read(file));
                    synchronized (writer) {
                        writeLine(writer, program);
                        if (renderer != null) {
                            writeDiagrams(writer, program, renderer);
                        }
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (IOException | InvalidSourceException e) {
                    errorCount.incrementAndGet();
                    log.warn("Error analyzing {}: {}", file.getFileName(), e.getMessage());
                    writeError(writer, file, e);
                } catch (RuntimeException e) {
                    errorCount.incrementAndGet();
                    log.error("Unexpected failure analyzing {}", file.getFileName(), e);
                    writeError(writer, file, e);
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        return new RunSummary(successCount.get(), errorCount.get());
    }

    private static void writeDiagrams(BufferedWriter writer, COBOLProgram program, DiagramRenderer renderer)
            throws IOException {
        for (COBOLDivision division : program.divisions) {
            if (division.callGraph == null) continue;
            Map<String, Object> diagram = new LinkedHashMap<>();
            diagram.put("kind", "diagram");
            diagram.put("file", program.filePath);
            diagram.put("division", division.name);
            diagram.put("mermaid", renderer.render(division.callGraph));
            writeLine(writer, diagram);
        }
    }

    private static void writeError(BufferedWriter writer, Path file, Exception e) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error", e.getMessage() != null ? e.getMessage() : e.toString());
        try {
            synchronized (writer) {
                writeLine(writer, error);
                writer.flush();
            }
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to write error for " + file, ioException);
        }
    }

    private static void writeLine(BufferedWriter writer, Object value) throws IOException {
        writer.write(MAPPER.writeValueAsString(value));
        writer.newLine();
    }

    public static class RunSummary {
        public final int analyzed;
        public final int errors;

        RunSummary(int analyzed, int errors) {
            this.analyzed = analyzed;
            this.errors = errors;
        }
    }
}
