package org.dxworks.cobolframe;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds COBOL source files under an input path and reads them for parsing.
 */
public class CobolSourceCollector {

    private static final String BOM = "\uFEFF";

    private final Set<String> extensions;
    private final int maxFileLines;

    public CobolSourceCollector(Set<String> extensions, int maxFileLines) {
        this.extensions = Set.copyOf(extensions);
        this.maxFileLines = maxFileLines;
    }

    public CobolSourceCollector(CobolframeConfig config) {
        this(config.getExtensions(), config.getMaxFileLines());
    }

    public boolean isCobolSource(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public List<Path> collect(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(this::isCobolSource)
                      .filter(this::withinMaxLines)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && isCobolSource(input) && withinMaxLines(input)) {
            files.add(input);
        }

        return files;
    }

    /**
     * Reads a source file as UTF-8 without a leading byte order mark.
     *
     * @throws InvalidSourceException if the file holds no text
     */
    public static String read(Path file) throws IOException {
        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);
        if (sourceCode.startsWith(BOM)) {
            sourceCode = sourceCode.substring(1);
        }
        if (sourceCode.isBlank()) {
            throw new InvalidSourceException("Empty source file: " + file);
        }
        return sourceCode;
    }

    private boolean withinMaxLines(Path path) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (UncheckedIOException | IOException e) {
            // undecodable files are still collected; reading reports the failure per file
            return true;
        }
    }
}
